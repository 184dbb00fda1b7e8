package com.openforge.mindstore.vector;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection parameters for the Milvus vector database.
 *
 * application.yml:
 *
 * mindstore:
 *   milvus:
 *     enabled: true
 *     host: localhost
 *     port: 19530
 *     connect-timeout-ms: 15000
 */
@ConfigurationProperties(prefix = "mindstore.milvus")
public record MilvusProperties(
        @DefaultValue("true")      boolean enabled,
        @DefaultValue("localhost") String  host,
        @DefaultValue("19530")     int     port,
        @DefaultValue("15000")     long    connectTimeoutMs
) {}
