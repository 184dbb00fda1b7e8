package com.openforge.mindstore.thought;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reconstructs linear reasoning traces by walking outgoing relations.
 *
 * Depth-first with an explicit stack. A thought already on the current
 * branch is never re-entered, which makes cycles terminate; the same
 * thought may still appear on different branches. A branch ends at
 * {@code maxDepth} thoughts or at a thought with no further unvisited
 * successor, and its path is kept when it holds more than one thought.
 */
@Slf4j
@Service
public class CausalChainFinder {

    public static final int DEFAULT_MAX_DEPTH = 5;

    private final ThoughtStore           thoughtStore;
    private final RelationGraph          relationGraph;
    private final ThoughtStoreProperties props;

    public CausalChainFinder(ThoughtStore thoughtStore, RelationGraph relationGraph, ThoughtStoreProperties props) {
        this.thoughtStore  = thoughtStore;
        this.relationGraph = relationGraph;
        this.props         = props;
    }

    public List<List<Thought>> findCausalChains(String sessionId, UUID startId) {
        return findCausalChains(sessionId, startId, DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth maximum chain length in thoughts, 1..maxCausalDepth
     * @return every maximal chain starting at {@code startId}; [] for an unknown start
     */
    public List<List<Thought>> findCausalChains(String sessionId, UUID startId, int maxDepth) {
        requireDepth(maxDepth);
        Map<UUID, Thought> known = thoughtStore.getThoughts(sessionId).stream()
                .collect(Collectors.toMap(Thought::id, Function.identity(), (a, b) -> b));
        return findCausalChains(known, startId, maxDepth, new HashMap<>());
    }

    /**
     * Variant over an already loaded session; {@code outgoing} memoizes
     * successor lookups and may be shared between calls.
     */
    List<List<Thought>> findCausalChains(Map<UUID, Thought> known,
                                         UUID startId,
                                         int maxDepth,
                                         Map<UUID, List<UUID>> outgoing) {
        requireDepth(maxDepth);
        Thought start = known.get(startId);
        if (start == null) return List.of();

        List<List<Thought>> chains = new ArrayList<>();
        List<Thought> path = new ArrayList<>();
        Set<UUID> onPath = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        path.add(start);
        onPath.add(startId);
        stack.push(new Frame(successors(startId, known, onPath, outgoing)));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            boolean atLimit = path.size() >= maxDepth;

            if (!atLimit && frame.next < frame.children.size()) {
                UUID child = frame.children.get(frame.next++);
                if (onPath.contains(child)) continue;
                path.add(known.get(child));
                onPath.add(child);
                stack.push(new Frame(successors(child, known, onPath, outgoing)));
                continue;
            }

            if ((atLimit || frame.children.isEmpty()) && path.size() > 1) {
                chains.add(List.copyOf(path));
            }
            stack.pop();
            Thought left = path.remove(path.size() - 1);
            onPath.remove(left.id());
        }

        log.debug("[Thoughts] {} causal chain(s) from {} (maxDepth={})", chains.size(), startId, maxDepth);
        return chains;
    }

    private List<UUID> successors(UUID id,
                                  Map<UUID, Thought> known,
                                  Set<UUID> onPath,
                                  Map<UUID, List<UUID>> outgoing) {
        List<UUID> targets = outgoing.computeIfAbsent(id, k -> {
            Set<UUID> distinct = new LinkedHashSet<>();
            for (ThoughtRelation r : relationGraph.getOutgoingRelations(k)) {
                distinct.add(r.targetThoughtId());
            }
            return new ArrayList<>(distinct);
        });
        List<UUID> open = new ArrayList<>();
        for (UUID t : targets) {
            if (known.containsKey(t) && !onPath.contains(t)) open.add(t);
        }
        return open;
    }

    private void requireDepth(int maxDepth) {
        if (maxDepth < 1 || maxDepth > props.maxCausalDepth()) {
            throw new IllegalArgumentException(
                    "maxDepth must be within [1, " + props.maxCausalDepth() + "], got " + maxDepth);
        }
    }

    private static final class Frame {
        final List<UUID> children;
        int next;

        Frame(List<UUID> children) {
            this.children = children;
        }
    }
}
