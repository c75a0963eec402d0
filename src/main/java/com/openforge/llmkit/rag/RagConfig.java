package com.openforge.llmkit.rag;

import com.openforge.llmkit.llm.LlmBackend;
import com.openforge.llmkit.vector.MilvusProperties;
import com.openforge.llmkit.vector.QueryOptions;
import com.openforge.llmkit.vector.VectorDatabase;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the RAG service from the configured backends, active when vector.milvus.enabled=true.
 */
@Configuration
@ConditionalOnProperty(name = "vector.milvus.enabled", havingValue = "true")
public class RagConfig {

    @Bean
    public RagService ragService(@Qualifier("embeddingBackend") LlmBackend embeddingBackend,
                                 @Qualifier("generationBackend") LlmBackend generationBackend,
                                 VectorDatabase vectorDatabase,
                                 MilvusProperties milvusProperties) {
        return new RagService(embeddingBackend, generationBackend, vectorDatabase,
                QueryOptions.limit(milvusProperties.topK()));
    }
}
