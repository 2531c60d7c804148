package io.docgraph;

import io.docgraph.processing.config.ProcessingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties(ProcessingConfig.class)
@ConfigurationPropertiesScan
public class KnowledgeGraphApplication {
    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");

        SpringApplication.run(KnowledgeGraphApplication.class, args);
    }
}
