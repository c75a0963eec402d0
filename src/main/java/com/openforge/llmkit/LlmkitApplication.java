package com.openforge.llmkit;

import com.openforge.llmkit.llm.LlmProperties;
import com.openforge.llmkit.vector.MilvusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// Register ConfigurationProperties globally so they are available
// regardless of whether the conditional Milvus beans are loaded.
@SpringBootApplication
@EnableConfigurationProperties({LlmProperties.class, MilvusProperties.class})
public class LlmkitApplication {

    public static void main(String[] args) {
        SpringApplication.run(LlmkitApplication.class, args);
    }
}
