package com.openforge.mindstore.thought;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Thought memory settings.
 *
 * application.yml:
 *
 * mindstore:
 *   thoughts:
 *     thoughts-collection: mindstore_neuro_thoughts
 *     relations-collection: mindstore_thought_relations
 *     results-collection: mindstore_thought_results
 *     vector-size: 768
 *     batch-size: 100
 *     scroll-page-size: 256
 *     max-chain-depth: 64
 *     inference-window: 10
 *     similarity-threshold: 0.7
 *     max-causal-depth: 10
 *
 * @param vectorSize          dimension of the three collections; must equal the embedding dimension
 * @param batchSize           points per upsert request in batch saves
 * @param scrollPageSize      points per scroll request when reading a whole session
 * @param maxChainDepth       depth cap when following parent-thought links
 * @param inferenceWindow     how many recent thoughts relation inference compares against
 * @param similarityThreshold cosine similarity a pair must exceed to be related
 * @param maxCausalDepth      upper bound accepted for causal-chain search depth
 */
@ConfigurationProperties(prefix = "mindstore.thoughts")
public record ThoughtStoreProperties(
        @DefaultValue("mindstore_neuro_thoughts")    String thoughtsCollection,
        @DefaultValue("mindstore_thought_relations") String relationsCollection,
        @DefaultValue("mindstore_thought_results")   String resultsCollection,
        @DefaultValue("768")  int    vectorSize,
        @DefaultValue("100")  int    batchSize,
        @DefaultValue("256")  int    scrollPageSize,
        @DefaultValue("64")   int    maxChainDepth,
        @DefaultValue("10")   int    inferenceWindow,
        @DefaultValue("0.7")  double similarityThreshold,
        @DefaultValue("10")   int    maxCausalDepth
) {

    public static ThoughtStoreProperties defaults() {
        return new ThoughtStoreProperties(
                "mindstore_neuro_thoughts",
                "mindstore_thought_relations",
                "mindstore_thought_results",
                768, 100, 256, 64, 10, 0.7, 10);
    }

    public ThoughtStoreProperties withVectorSize(int size) {
        return new ThoughtStoreProperties(thoughtsCollection, relationsCollection, resultsCollection,
                size, batchSize, scrollPageSize, maxChainDepth, inferenceWindow,
                similarityThreshold, maxCausalDepth);
    }

    public ThoughtStoreProperties withScrollPageSize(int size) {
        return new ThoughtStoreProperties(thoughtsCollection, relationsCollection, resultsCollection,
                vectorSize, batchSize, size, maxChainDepth, inferenceWindow,
                similarityThreshold, maxCausalDepth);
    }

    public ThoughtStoreProperties withBatchSize(int size) {
        return new ThoughtStoreProperties(thoughtsCollection, relationsCollection, resultsCollection,
                vectorSize, size, scrollPageSize, maxChainDepth, inferenceWindow,
                similarityThreshold, maxCausalDepth);
    }
}
