// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.fudg;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.fail;

public class CandidatePropagationTest extends GraphTestBase {
    private static final List<String> FIXTURES =
            Arrays.asList("coordination.json", "until.json", "sandwich.json", "dentist.json", "vehicles.json");

    private static GraphRecord bundleOfThree() {
        return new GraphRecord()
                .addTokens("A", "B", "C")
                .addNode("W(A)").addNode("W(B)").addNode("W(C)").addNode("CBB1");
    }

    private static void expectParents(FudgGraph g, Map<String, Set<String>> expected) {
        expected.forEach((node, parents) -> assertThat(node, names(g.node(node).parentCandidates()), is(parents)));
    }

    @Test
    public void designatedTopSettlesTheBundle() {
        FudgGraph g = FudgGraph.fromRecord(bundleOfThree()
                .addEdge("CBB1", "W(A)", EdgeLabel.UNSPEC)
                .addEdge("CBB1", "W(B)", EdgeLabel.UNSPEC)
                .addEdge("CBB1", "W(C)", EdgeLabel.TOP));
        new CandidatePropagation(g).run();
        CbbNode b = bundle(g, "CBB1");
        assertThat(names(b.topCandidates()), contains("C"));
        assertThat(names(b.parentCandidates()), contains("$$"));
        assertThat(names(g.node("W(C)").parentCandidates()), contains("$$"));
        assertThat(names(g.node("W(A)").parentCandidates()), contains("B", "C"));
    }

    @Test
    public void anyUnspecifiedMemberMightBeTop() {
        FudgGraph g = FudgGraph.fromRecord(bundleOfThree()
                .addEdge("CBB1", "W(A)", EdgeLabel.UNSPEC)
                .addEdge("CBB1", "W(B)", EdgeLabel.UNSPEC)
                .addEdge("W(C)", "CBB1"));
        new CandidatePropagation(g).run();
        CbbNode b = bundle(g, "CBB1");
        assertThat(names(b.topCandidates()), contains("A", "B"));
        assertThat(names(b.parentCandidates()), contains("C"));
        // A heads the bundle and attaches to C, or attaches to B, which does.
        assertThat(names(g.node("W(A)").parentCandidates()), contains("B", "C"));
        assertThat(names(g.node("W(C)").parentCandidates()), contains("$$"));
    }

    @Test
    public void modifierOfABundleLandsOnAPossibleTop() {
        FudgGraph g = FudgGraph.fromRecord(bundleOfThree()
                .addEdge("CBB1", "W(A)", EdgeLabel.UNSPEC)
                .addEdge("CBB1", "W(B)", EdgeLabel.UNSPEC)
                .addEdge("CBB1", "W(C)"));
        new CandidatePropagation(g).run();
        assertThat(names(g.node("W(C)").parentCandidates()), contains("A", "B"));
    }

    @Test
    public void nestedBundleOffersItsOwnTops() {
        FudgGraph g = FudgGraph.fromRecord(new GraphRecord()
                .addTokens("A", "B", "C", "D")
                .addNode("W(A)").addNode("W(B)").addNode("W(C)").addNode("W(D)")
                .addNode("CBB1").addNode("CBB2")
                .addEdge("CBB1", "CBB2", EdgeLabel.UNSPEC)
                .addEdge("CBB1", "W(A)", EdgeLabel.UNSPEC)
                .addEdge("CBB2", "W(B)", EdgeLabel.UNSPEC)
                .addEdge("CBB2", "W(C)", EdgeLabel.TOP)
                .addEdge("W(D)", "CBB1"));
        new CandidatePropagation(g).run();
        assertThat(names(bundle(g, "CBB2").topCandidates()), contains("C"));
        assertThat(names(bundle(g, "CBB1").topCandidates()), contains("A", "C"));
        assertThat(names(bundle(g, "CBB2").parentCandidates()), contains("A", "D"));
        assertThat(names(g.node("W(B)").parentCandidates()), contains("C"));
    }

    @Test
    public void aliasAnswersForItsCanonicalBundle() {
        FudgGraph g = FudgGraph.fromRecord(new GraphRecord()
                .addTokens("a", "b", "c")
                .addNode("W(a)").addNode("W(b)").addNode("W(c)").addNode("CBB1").addNode("CBB2")
                .addEdge("CBB1", "W(a)", EdgeLabel.UNSPEC)
                .addEdge("CBB1", "W(b)", EdgeLabel.UNSPEC)
                .addEdge("CBB2", "W(a)", EdgeLabel.TOP)
                .addEdge("CBB2", "W(b)", EdgeLabel.UNSPEC)
                .addEdge("W($$)", "W(c)")
                .addEdge("W(c)", "CBB2"));
        new CandidatePropagation(g).run();
        CbbNode cbb1 = bundle(g, "CBB1"), cbb2 = bundle(g, "CBB2");
        assertThat(names(cbb1.topCandidates()), contains("a"));
        assertThat(names(cbb2.topCandidates()), contains("a"));
        assertThat(names(cbb2.parentCandidates()), contains("c"));
        assertThat(names(g.node("W(a)").parentCandidates()), contains("c"));
        assertThat(names(g.node("W(b)").parentCandidates()), contains("a"));
        assertThat(names(g.node("W(c)").parentCandidates()), contains("$$"));
    }

    @Test
    public void conflictingParents() {
        FudgGraph g = FudgGraph.fromRecord(new GraphRecord()
                .addTokens("a", "b", "c")
                .addNode("W(a)").addNode("W(b)").addNode("W(c)")
                .addEdge("W(a)", "W(c)")
                .addEdge("W(b)", "W(c)"));
        try {
            new CandidatePropagation(g).run();
            fail();
        } catch (WellFormednessException e) {
            assertThat(e.nodeName(), is("c"));
            assertThat(e.getMessage(), containsString("Is the annotation valid?"));
        }
    }

    @Test(expected = InvariantViolationException.class)
    public void downwardNeedsUpward() {
        new CandidatePropagation(fromResource("sandwich.json")).downward();
    }

    @Test
    public void coordinationFixture() {
        FudgGraph g = resolved("coordination.json");
        expectParents(g, ImmutableMap.<String, Set<String>>builder()
                .put("MW(&_THEN)", ImmutableSet.of("I'm"))
                .put("W(tweet)", ImmutableSet.of("&_THEN"))
                .put("W(wait)", ImmutableSet.of("&_THEN"))
                .put("W(2)", ImmutableSet.of("or"))
                .put("W(hour)", ImmutableSet.of("or"))
                .put("W(an)", ImmutableSet.of("hour"))
                .put("W(I'm)", ImmutableSet.of("think"))
                .put("W(think)", ImmutableSet.of("$$"))
                .put("W(I)", ImmutableSet.of("think"))
                .build());
        assertThat(names(g.lexicalNodeOf("or").get().parentCandidates()), contains("wait"));
    }

    @Test
    public void untilFixture() {
        FudgGraph g = resolved("until.json");
        CbbNode b = bundle(g, "CBB1");
        assertThat(names(b.topCandidates()), contains("feel"));
        assertThat(names(b.parentCandidates()), contains("until"));
        assertThat(b.height(), is(3));
        assertThat(b.depth(), is(4));
        assertThat(g.node("W(maybe)").height(), is(6));
        expectParents(g, ImmutableMap.<String, Set<String>>of(
                "W(again)", ImmutableSet.of("feel"),
                "W(you)", ImmutableSet.of("feel"),
                "W(feel)", ImmutableSet.of("until"),
                "W(until)", ImmutableSet.of("put_off")));
    }

    @Test
    public void sandwichFixture() {
        FudgGraph g = resolved("sandwich.json");
        assertThat(names(bundle(g, "CBB1").topCandidates()), contains("Sandwich"));
        assertThat(names(bundle(g, "CBB1").parentCandidates()), contains("$$"));
        assertThat(names(bundle(g, "CBB2").topCandidates()), contains("standards"));
        assertThat(names(bundle(g, "CBB2").parentCandidates()), contains("to"));
        expectParents(g, ImmutableMap.<String, Set<String>>of(
                "W(A)", ImmutableSet.of("Quality", "Sandwich", "Top"),
                "W(Sandwich)", ImmutableSet.of("$$"),
                "W(artistic)", ImmutableSet.of("standards"),
                "W(standards)", ImmutableSet.of("to")));
    }

    @Test
    public void dentistFixture() {
        FudgGraph g = resolved("dentist.json");
        assertThat(names(bundle(g, "CBB1").topCandidates()), contains("as", "early", "had"));
        assertThat(names(bundle(g, "CBB1").parentCandidates()), contains("wish"));
        assertThat(names(bundle(g, "CBB2").topCandidates()), contains("early"));
        assertThat(names(bundle(g, "CBB2").parentCandidates()), contains("as", "had", "wish"));
        expectParents(g, ImmutableMap.<String, Set<String>>of(
                "W(in)", ImmutableSet.of("early", "life", "my~2", "on"),
                "W(as)", ImmutableSet.of("early", "had", "wish"),
                "W(early)", ImmutableSet.of("as", "had", "wish"),
                "W(had)", ImmutableSet.of("as", "early", "wish"),
                "W(my~1)", ImmutableSet.of("as")));
    }

    @Test
    public void vehiclesFixture() {
        FudgGraph g = resolved("vehicles.json");
        assertThat(names(bundle(g, "CBB1").topCandidates()), contains("have~1"));
        assertThat(names(bundle(g, "CBB1").parentCandidates()), contains("$$"));
        assertThat(names(bundle(g, "CBB3").topCandidates()), contains("best", "of~2", "one", "the~2"));
        assertThat(names(bundle(g, "CBB3").parentCandidates()), contains("was"));
        expectParents(g, ImmutableMap.<String, Set<String>>of(
                "W(best)", ImmutableSet.of("of~2", "one", "the~2", "was"),
                "W(15)", ImmutableSet.of("I~1", "and~1", "boats", "cars", "have~1", "in", "lifetime", "my",
                        "over", "purchased", "rvs", "vehicles"),
                "W(have~1)", ImmutableSet.of("$$"),
                "W(was)", ImmutableSet.of("say")));
    }

    @Test
    public void candidatesRespectTheGraph() {
        for (String f : FIXTURES) {
            FudgGraph g = resolved(f);
            for (CbbNode b : g.bundles()) {
                assertThat(f, b.topCandidates(), not(hasItem(b)));
                for (Node t : b.topCandidates()) assertThat(f + " " + t, t.isBundle(), is(false));
            }
            for (Node n : g.nodes()) {
                if (n.isRoot()) {
                    assertThat(n.hasParentCandidates(), is(false));
                    continue;
                }
                Set<Node> pc = n.parentCandidates();
                assertThat(f + " " + n, pc, not(empty()));
                assertThat(f + " " + n, pc, not(hasItem(n)));
                for (Node p : pc) {
                    assertThat(f + " " + n, n.descendants(), not(hasItem(p)));
                    assertThat(f + " " + n, p.isBundle(), is(false));
                }
            }
        }
    }

    @Test
    public void heightIsOneMoreThanTallestChild() {
        for (String f : FIXTURES) {
            FudgGraph g = resolved(f);
            for (Node n : g.nodes()) {
                int expected = n.children().stream().mapToInt(c -> c.height() + 1).max().orElse(0);
                assertThat(f + " " + n, n.height(), is(expected));
            }
        }
    }

    @Test
    public void propagationIsIdempotent() {
        for (String f : FIXTURES) {
            FudgGraph g = resolved(f);
            Map<Node, Set<Node>> tops = new HashMap<>();
            Map<Node, Set<Node>> parents = new HashMap<>();
            for (CbbNode b : g.bundles()) tops.put(b, b.topCandidates());
            for (Node n : g.nodes()) if (!n.isRoot()) parents.put(n, n.parentCandidates());

            new CandidatePropagation(g).setTracing(EnumSet.allOf(CandidatePropagation.Trace.class)).run();
            for (CbbNode b : g.bundles()) assertThat(f + " " + b, b.topCandidates(), is(tops.get(b)));
            for (Node n : g.nodes()) if (!n.isRoot()) assertThat(f + " " + n, n.parentCandidates(), is(parents.get(n)));
        }
    }
}
