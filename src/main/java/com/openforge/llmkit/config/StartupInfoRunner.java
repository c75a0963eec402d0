package com.openforge.llmkit.config;

import com.openforge.llmkit.llm.LlmProperties;
import com.openforge.llmkit.vector.MilvusProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready.
 * API keys are masked.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final LlmProperties    llmProperties;
    private final MilvusProperties milvusProperties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              llmkit  -  Startup Summary                  ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Backends                                                ║
                ║    Generation     : {}
                ║    Embeddings     : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Ollama                                                  ║
                ║    Endpoint       : {}  timeout={}s
                ║    Models         : gen={}  emb={}
                ╠══════════════════════════════════════════════════════════╣
                ║  OpenAI                                                  ║
                ║    Endpoint       : {}  timeout={}s  key={}
                ║    Models         : gen={}  emb={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Vector DB (Milvus)                                      ║
                ║    Enabled        : {}
                ║    Address        : {}:{}
                ║    Collections    : {}_*  {}  top-k={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                llmProperties.backend().generation(),
                llmProperties.backend().embeddings(),
                System.getProperty("java.version"),

                orDefault(llmProperties.ollama().baseUrl()), llmProperties.ollama().timeoutSeconds(),
                llmProperties.ollama().genModel(), llmProperties.ollama().embModel(),

                orDefault(llmProperties.openai().baseUrl()), llmProperties.openai().timeoutSeconds(),
                maskKey(llmProperties.openai().apiKey()),
                llmProperties.openai().genModel(), llmProperties.openai().embModel(),

                milvusProperties.enabled(),
                milvusProperties.host(), milvusProperties.port(),
                milvusProperties.collectionPrefix(), milvusProperties.collections(), milvusProperties.topK()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String orDefault(String baseUrl) {
        return baseUrl == null || baseUrl.isBlank() ? "(provider default)" : baseUrl;
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key looks like a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
