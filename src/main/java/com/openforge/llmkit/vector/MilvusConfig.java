package com.openforge.llmkit.vector;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

/**
 * Milvus infrastructure beans, active when vector.milvus.enabled=true.
 *
 * Collections are not created here: {@link MilvusVectorDatabase} creates the
 * collection for a backend the first time it is used.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MilvusProperties.class)
@ConditionalOnProperty(name = "vector.milvus.enabled", havingValue = "true")
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    @Nullable
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            MilvusClientV2 client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(15_000)
                            .build()
            );
            log.info("[Milvus] Connected successfully.");
            return client;
        } catch (Exception e) {
            log.warn("[Milvus] Connection failed, vector store calls will fail until restart. Cause: {}. " +
                     "To suppress this warning, set vector.milvus.enabled=false.", e.getMessage());
            return null;
        }
    }

    @Bean
    public VectorDatabase vectorDatabase(@Nullable MilvusClientV2 milvusClient, MilvusProperties props) {
        return new MilvusVectorDatabase(milvusClient, props);
    }
}
