package com.openforge.mindstore.admin;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Map;

/**
 * Collection administration settings.
 *
 * application.yml:
 *
 * mindstore:
 *   admin:
 *     default-vector-size: 768
 *     layers:                      # optional, replaces a layer's collection list
 *       semantic: [core, codebase]
 *
 * @param defaultVectorSize dimension used when creating, checking or healing collections without an explicit size
 * @param layers            memory layer name (case-insensitive) → collections, overriding the built-in mapping
 */
@ConfigurationProperties(prefix = "mindstore.admin")
public record AdminProperties(
        @DefaultValue("768") int defaultVectorSize,
        Map<String, List<String>> layers
) {

    public AdminProperties {
        layers = layers == null ? Map.of() : Map.copyOf(layers);
    }

    public static AdminProperties defaults() {
        return new AdminProperties(768, Map.of());
    }
}
