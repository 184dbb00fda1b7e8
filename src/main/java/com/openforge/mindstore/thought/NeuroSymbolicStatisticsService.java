package com.openforge.mindstore.thought;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Counts over a session's thoughts, relations and results, plus chain
 * statistics from the relation graph.
 *
 * A chain start is a thought with no incoming relation. The average chain
 * length is estimated from at most {@link #CHAIN_SAMPLE_SIZE} starts, taking
 * the longest chain of each at depth {@link #CHAIN_SAMPLE_DEPTH}. Walking
 * every start is quadratic in session size; the sample keeps the call cheap
 * at the price of an estimate for sessions with many independent roots.
 */
@Service
@RequiredArgsConstructor
public class NeuroSymbolicStatisticsService {

    static final int CHAIN_SAMPLE_SIZE  = 10;
    static final int CHAIN_SAMPLE_DEPTH = 10;

    private final ThoughtStore      thoughtStore;
    private final RelationGraph     relationGraph;
    private final ResultStore       resultStore;
    private final CausalChainFinder chainFinder;

    public NeuroSymbolicStats getStats(String sessionId) {
        List<Thought>         thoughts  = thoughtStore.getThoughts(sessionId);
        List<ThoughtRelation> relations = relationGraph.getSessionRelations(sessionId);
        List<ThoughtResult>   results   = resultStore.getSessionResults(sessionId);

        Set<UUID> targets = relations.stream()
                .map(ThoughtRelation::targetThoughtId)
                .collect(Collectors.toSet());
        List<Thought> chainStarts = thoughts.stream()
                .filter(t -> !targets.contains(t.id()))
                .toList();

        double averageChainLength = 0.0;
        if (!chainStarts.isEmpty()) {
            Map<UUID, Thought> known = thoughts.stream()
                    .collect(Collectors.toMap(Thought::id, Function.identity(), (a, b) -> b));
            Map<UUID, List<UUID>> outgoing = new HashMap<>();
            int depth = Math.min(CHAIN_SAMPLE_DEPTH, thoughtStore.properties().maxCausalDepth());

            List<Thought> sample = chainStarts.subList(0, Math.min(CHAIN_SAMPLE_SIZE, chainStarts.size()));
            int totalLength = 0;
            for (Thought start : sample) {
                totalLength += chainFinder.findCausalChains(known, start.id(), depth, outgoing).stream()
                        .mapToInt(List::size)
                        .max()
                        .orElse(0);
            }
            averageChainLength = (double) totalLength / sample.size();
        }

        return new NeuroSymbolicStats(
                thoughts.size(),
                relations.size(),
                results.size(),
                ThoughtStore.countBy(thoughts, t -> t.type().tag()),
                ThoughtStore.countBy(relations, r -> r.type().wire()),
                ThoughtStore.countBy(results, r -> r.resultType().wire()),
                chainStarts.size(),
                averageChainLength,
                thoughts.isEmpty() ? null : thoughts.get(0).timestamp(),
                thoughts.isEmpty() ? null : thoughts.get(thoughts.size() - 1).timestamp());
    }
}
