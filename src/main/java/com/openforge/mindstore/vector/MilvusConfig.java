package com.openforge.mindstore.vector;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

/**
 * Milvus infrastructure bean configuration.
 *
 * Only connects; collections are created lazily by the stores
 * (thoughts / relations / results) and by the collection admin.
 * A failed connection yields a null client: reads then degrade to empty
 * results and writes fail with {@link VectorBackendException}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MilvusProperties.class)
@ConditionalOnProperty(name = "mindstore.milvus.enabled", havingValue = "true", matchIfMissing = true)
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    @Nullable
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            MilvusClientV2 client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(props.connectTimeoutMs())
                            .build()
            );
            log.info("[Milvus] Connected successfully.");
            return client;
        } catch (Exception e) {
            log.warn("[Milvus] Connection failed, thought memory is unavailable. Cause: {}. " +
                     "To suppress this warning, set mindstore.milvus.enabled=false.",
                    e.getMessage());
            return null;
        }
    }
}
