package com.openforge.llmkit.rag;

import com.openforge.llmkit.llm.LlmBackend;
import com.openforge.llmkit.llm.model.Conversation;
import com.openforge.llmkit.llm.model.Role;
import com.openforge.llmkit.vector.Document;
import com.openforge.llmkit.vector.QueryOptions;
import com.openforge.llmkit.vector.VectorDatabase;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Retrieval-augmented generation: embed, look up similar documents, and put
 * their text in front of the query.
 *
 * Augmented prompt layout (each retrieved text is followed by a newline):
 *
 *   Context: first document
 *   second document
 *
 *   Query: what the user asked
 */
@Slf4j
public class RagService {

    private final LlmBackend     embeddingBackend;
    private final LlmBackend     generationBackend;
    private final VectorDatabase vectorDatabase;
    private final QueryOptions   queryOptions;

    public RagService(LlmBackend embeddingBackend,
                      LlmBackend generationBackend,
                      VectorDatabase vectorDatabase,
                      QueryOptions queryOptions) {
        this.embeddingBackend  = Objects.requireNonNull(embeddingBackend, "embeddingBackend must not be null");
        this.generationBackend = Objects.requireNonNull(generationBackend, "generationBackend must not be null");
        this.vectorDatabase    = Objects.requireNonNull(vectorDatabase, "vectorDatabase must not be null");
        this.queryOptions      = queryOptions == null ? QueryOptions.defaults() : queryOptions;
    }

    /** Embeds {@code content} and stores it; returns the new document id. */
    public String ingest(String content) {
        List<Float> embedding = embeddingBackend.embed(content);
        String docId = vectorDatabase.insertDocument(content, embedding);
        log.info("[RAG] Ingested document {} via {} (dim={})", docId, embeddingBackend.name(), embedding.size());
        return docId;
    }

    /** Builds the augmented prompt for {@code query}. */
    public String augment(String query) {
        List<Float>    embedding = embeddingBackend.embed(query);
        List<Document> documents = vectorDatabase.queryRelevantDocuments(
                embedding, embeddingBackend.name(), queryOptions);

        StringBuilder context = new StringBuilder();
        for (Document document : documents) {
            String content = document.content();
            if (content != null) {
                context.append(content).append('\n');
            }
        }
        log.debug("[RAG] Retrieved {} document(s) for query, context-length={}",
                documents.size(), context.length());
        return "Context: " + context + "\nQuery: " + query;
    }

    /** Generates an answer to {@code query} from the augmented prompt. */
    public String answer(String query) {
        Conversation conversation = new Conversation()
                .addMessage(Role.USER, augment(query));
        return generationBackend.generate(conversation);
    }
}
