package com.openforge.mindstore;

import com.openforge.mindstore.admin.AdminProperties;
import com.openforge.mindstore.embedding.EmbeddingProperties;
import com.openforge.mindstore.thought.ThoughtStoreProperties;
import com.openforge.mindstore.vector.MilvusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// Register ConfigurationProperties globally so they are available
// regardless of whether the conditional Milvus / embedding beans are loaded.
@SpringBootApplication
@EnableConfigurationProperties({
        MilvusProperties.class,
        EmbeddingProperties.class,
        ThoughtStoreProperties.class,
        AdminProperties.class
})
public class MindstoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(MindstoreApplication.class, args);
    }
}
