package com.openforge.mindstore.thought;

import com.openforge.mindstore.testsupport.MemoryHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static com.openforge.mindstore.testsupport.ThoughtFixtures.T0;
import static com.openforge.mindstore.testsupport.ThoughtFixtures.thought;
import static org.junit.jupiter.api.Assertions.*;

class CausalChainFinderTest {

    private static final String SESSION = "s";

    private MemoryHarness h;
    private Thought a;
    private Thought b;
    private Thought c;

    @BeforeEach
    void setUp() {
        h = new MemoryHarness(2, null);
        a = thought(SESSION, ThoughtType.Known.OBSERVATION, "A", 0);
        b = thought(SESSION, ThoughtType.Known.ANALYTICAL, "B", 1);
        c = thought(SESSION, ThoughtType.Known.DECISION, "C", 2);
        h.thoughts.saveThoughts(SESSION, List.of(a, b, c));
    }

    private void link(Thought from, Thought to) {
        h.relations.saveRelation(SESSION, ThoughtRelation.of(from.id(), to.id(), RelationType.LEADS_TO, 1.0, T0));
    }

    private static List<List<String>> contents(List<List<Thought>> chains) {
        return chains.stream().map(chain -> chain.stream().map(Thought::content).toList()).toList();
    }

    @Test
    void shouldFollowLinearChain() {
        link(a, b);
        link(b, c);

        assertEquals(List.of(List.of("A", "B", "C")), contents(h.chains.findCausalChains(SESSION, a.id())));
    }

    @Test
    void shouldTerminateOnCycle() {
        link(a, b);
        link(b, a);

        assertEquals(List.of(List.of("A", "B")), contents(h.chains.findCausalChains(SESSION, a.id(), 10)));
    }

    @Test
    void shouldReturnEveryBranch() {
        link(a, b);
        link(a, c);

        List<List<String>> chains = contents(h.chains.findCausalChains(SESSION, a.id()));

        assertEquals(2, chains.size());
        assertTrue(chains.contains(List.of("A", "B")));
        assertTrue(chains.contains(List.of("A", "C")));
    }

    @Test
    void shouldCutChainsAtMaxDepth() {
        link(a, b);
        link(b, c);

        assertEquals(List.of(List.of("A", "B")), contents(h.chains.findCausalChains(SESSION, a.id(), 2)));
        assertEquals(List.of(), h.chains.findCausalChains(SESSION, a.id(), 1));
    }

    @Test
    void shouldIgnoreEdgesToUnknownThoughts() {
        h.relations.saveRelation(SESSION,
                ThoughtRelation.of(a.id(), UUID.randomUUID(), RelationType.LEADS_TO, 1.0, T0));

        assertEquals(List.of(), h.chains.findCausalChains(SESSION, a.id()));
    }

    @Test
    void shouldCollapseDuplicateEdges() {
        link(a, b);
        link(a, b);

        assertEquals(List.of(List.of("A", "B")), contents(h.chains.findCausalChains(SESSION, a.id())));
    }

    @Test
    void shouldReturnEmptyForUnknownStart() {
        link(a, b);

        assertEquals(List.of(), h.chains.findCausalChains(SESSION, UUID.randomUUID()));
    }

    @Test
    void shouldRejectDepthOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> h.chains.findCausalChains(SESSION, a.id(), 0));
        assertThrows(IllegalArgumentException.class, () -> h.chains.findCausalChains(SESSION, a.id(), 11));
    }
}
