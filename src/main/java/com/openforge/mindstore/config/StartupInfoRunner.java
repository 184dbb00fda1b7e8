package com.openforge.mindstore.config;

import com.openforge.mindstore.admin.AdminProperties;
import com.openforge.mindstore.embedding.EmbeddingProperties;
import com.openforge.mindstore.layer.MemoryLayerManager;
import com.openforge.mindstore.thought.ThoughtStore;
import com.openforge.mindstore.thought.ThoughtStoreProperties;
import com.openforge.mindstore.vector.MilvusProperties;
import com.openforge.mindstore.vector.VectorBackendException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Brings the memory up and prints a structured startup summary once the
 * application context is ready.
 *
 * Steps performed:
 *   - Memory layers: initializes the collection admin and creates missing layer collections
 *   - Thought store: creates the thought / relation / result collections
 *   - Embedding: model + dimensions, or "disabled" (substring search only)
 *
 * A vector backend that is down does not stop the application; the failure
 * is reported here and reads stay empty until it comes back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final MemoryLayerManager     layerManager;
    private final ThoughtStore           thoughtStore;
    private final MilvusProperties       milvusProperties;
    private final EmbeddingProperties    embeddingProperties;
    private final ThoughtStoreProperties thoughtProperties;
    private final AdminProperties        adminProperties;
    private final Environment            env;

    @Override
    public void run(ApplicationArguments args) {
        String memoryStatus = initializeMemory();
        String port         = env.getProperty("server.port", "8080");
        String javaVersion  = System.getProperty("java.version");

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Mindstore  ·  Startup Summary               ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Vector DB (Milvus)                                      ║
                ║    Enabled        : {}
                ║    Address        : {}:{}
                ║    Memory         : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Thought Memory                                          ║
                ║    Collections    : {}, {}, {}
                ║    Vector size    : {}  (admin default {})
                ║    Inference      : window={}  threshold={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Model          : {}
                ║    Endpoint       : {}  key={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,

                milvusProperties.enabled(),
                milvusProperties.host(), milvusProperties.port(),
                memoryStatus,

                thoughtProperties.thoughtsCollection(),
                thoughtProperties.relationsCollection(),
                thoughtProperties.resultsCollection(),
                thoughtProperties.vectorSize(), adminProperties.defaultVectorSize(),
                thoughtProperties.inferenceWindow(), thoughtProperties.similarityThreshold(),

                thoughtStore.supportsSemanticSearch()
                        ? embeddingProperties.model() + "  dim=" + embeddingProperties.dimensions()
                        : "✘ disabled (substring search only)",
                embeddingProperties.baseUrl(),
                maskKey(embeddingProperties.apiKey())
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Initializes memory layers and thought collections.
     * Returns a one-line summary or the failure reason.
     */
    private String initializeMemory() {
        if (!milvusProperties.enabled()) return "✘ disabled";
        try {
            layerManager.initialize();
            thoughtStore.initialize();
            return "✔ ready  vectors=" + layerManager.getTotalMemoryVectors();
        } catch (VectorBackendException e) {
            log.error("[Memory] Initialization failed: {}", e.getMessage());
            return "✘ FAILED: " + e.getMessage();
        }
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" for blank keys.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) return "(not set)";
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
