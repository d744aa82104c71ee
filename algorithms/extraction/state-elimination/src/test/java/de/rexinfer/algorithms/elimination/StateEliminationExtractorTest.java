/* Copyright (C) 2026 The rexinfer Authors
 * This file is part of rexinfer.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.rexinfer.algorithms.elimination;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import de.rexinfer.datastructure.graph.GraphSnapshot;
import de.rexinfer.datastructure.graph.TransitionGraph;
import de.rexinfer.datastructure.regex.Regex;
import de.rexinfer.datastructure.regex.RegexRenderer;
import de.rexinfer.datastructure.regex.RegexSimplifiers;
import org.testng.Assert;
import org.testng.annotations.Test;

public class StateEliminationExtractorTest {

    @Test
    public void testStarFollowedBySymbol() {
        final TransitionGraph<Character> graph = new TransitionGraph<>();
        final int q0 = graph.addInitialState(false);
        final int q1 = graph.addState(true);
        graph.addTransition(q0, 'a', q0);
        graph.addTransition(q0, 'b', q1);

        final ExtractionResult<Character> result = new StateEliminationExtractor<Character>().extractFromSymbols(graph);

        Assert.assertFalse(result.isEmptyLanguage());
        Assert.assertEquals(result.toString(), "a*b");
        Assert.assertEquals(result.getInteriorStates(), 1);
        Assert.assertEquals(result.getEliminationSteps(), 1);

        // the input graph is left untouched
        Assert.assertEquals(graph.size(), 2);
        Assert.assertEquals(graph.getNumTransitions(), 2);
    }

    @Test
    public void testEmptyWord() {
        final TransitionGraph<Character> graph = new TransitionGraph<>();
        graph.addInitialState(true);

        final ExtractionResult<Character> result = new StateEliminationExtractor<Character>().extractFromSymbols(graph);

        Assert.assertEquals(result.getRegex(), Regex.epsilon());
        Assert.assertEquals(result.toString(), "ε");
        Assert.assertEquals(result.getEliminationSteps(), 0);
    }

    @Test
    public void testParallelTransitions() {
        final TransitionGraph<Character> graph = new TransitionGraph<>();
        final int q0 = graph.addInitialState(false);
        final int q1 = graph.addState(true);
        graph.addTransition(q0, 'a', q1);
        graph.addTransition(q0, 'b', q1);

        final ExtractionResult<Character> result = new StateEliminationExtractor<Character>().extractFromSymbols(graph);

        Assert.assertEquals(result.toString(), "a|b");
        Assert.assertEquals(result.getInteriorStates(), 0);
    }

    @Test
    public void testEmptyLanguage() {
        final TransitionGraph<Character> graph = new TransitionGraph<>();
        final int q0 = graph.addInitialState(false);
        final int q1 = graph.addState(false);
        graph.addTransition(q0, 'a', q1);

        final ExtractionResult<Character> result = new StateEliminationExtractor<Character>().extractFromSymbols(graph);

        Assert.assertTrue(result.isEmptyLanguage());
        Assert.assertEquals(result.toString(), "∅");
        Assert.assertEquals(result.render(RegexRenderer.javaPattern()), "[^\\s\\S]");
        Assert.expectThrows(IllegalStateException.class, result::getRegex);
    }

    @Test
    public void testLoopThroughAcceptingInitialState() {
        final TransitionGraph<Character> graph = evenAb();
        final List<String> stages = new ArrayList<>();
        final List<GraphSnapshot<Regex<Character>>> snapshots = new ArrayList<>();

        final StateEliminationExtractor<Character> extractor =
                new StateEliminationExtractor<>(RegexSimplifiers.nested(), (stage, snapshot) -> {
                    stages.add(stage);
                    snapshots.add(snapshot);
                });
        final ExtractionResult<Character> result = extractor.extractFromSymbols(graph);

        Assert.assertTrue(result.getUniformization().isSourceAdded());
        Assert.assertTrue(result.getUniformization().isSinkAdded());
        Assert.assertEquals(result.getInteriorStates(), 2);
        Assert.assertEquals(result.getEliminationSteps(), 2);

        Assert.assertEquals(stages.size(), 3);
        Assert.assertEquals(stages.get(0), StateEliminationExtractor.STAGE_UNIFORM);
        Assert.assertEquals(snapshots.get(0).size(), 4);
        Assert.assertEquals(snapshots.get(1).size(), 3);
        Assert.assertEquals(snapshots.get(2).size(), 2);
        Assert.assertEquals(snapshots.get(2).getTransitions().size(), 1);

        assertSameLanguage(result, "(ab)*", 6);
    }

    @Test
    public void testStructuralPolicyDescribesSameLanguage() {
        final StateEliminationExtractor<Character> nested = new StateEliminationExtractor<>(RegexSimplifiers.nested());
        final StateEliminationExtractor<Character> structural =
                new StateEliminationExtractor<>(RegexSimplifiers.structural());

        final ExtractionResult<Character> simplified = nested.extractFromSymbols(evenAb());
        final ExtractionResult<Character> raw = structural.extractFromSymbols(evenAb());

        assertSameLanguage(simplified, "(ab)*", 6);
        assertSameLanguage(raw, "(ab)*", 6);
        Assert.assertTrue(simplified.getRegex().size() <= raw.getRegex().size());
    }

    @Test
    public void testBranchingAutomaton() {
        // a(b|c)*d with an additional accepting state after the first a
        final TransitionGraph<Character> graph = new TransitionGraph<>();
        final int q0 = graph.addInitialState(false);
        final int q1 = graph.addState(true);
        final int q2 = graph.addState(true);
        graph.addTransition(q0, 'a', q1);
        graph.addTransition(q1, 'b', q1);
        graph.addTransition(q1, 'c', q1);
        graph.addTransition(q1, 'd', q2);

        final ExtractionResult<Character> result = new StateEliminationExtractor<Character>().extractFromSymbols(graph);

        assertSameLanguage(result, "a[bc]*d?", 6, 'a', 'b', 'c', 'd');
    }

    @Test
    public void testConsumesGraph() {
        final TransitionGraph<Regex<Character>> graph = evenAb().relabel(Regex::symbol);

        new StateEliminationExtractor<Character>().extract(graph);

        Assert.assertEquals(graph.size(), 2);
        Assert.assertEquals(graph.getNumTransitions(), 1);
        Assert.assertTrue(Uniformizer.isUniform(graph));
    }

    private static TransitionGraph<Character> evenAb() {
        final TransitionGraph<Character> graph = new TransitionGraph<>();
        final int q0 = graph.addInitialState(true);
        final int q1 = graph.addState(false);
        graph.addTransition(q0, 'a', q1);
        graph.addTransition(q1, 'b', q0);
        return graph;
    }

    private static void assertSameLanguage(ExtractionResult<Character> result, String expected, int maxLength) {
        assertSameLanguage(result, expected, maxLength, 'a', 'b');
    }

    private static void assertSameLanguage(ExtractionResult<Character> result,
                                           String expected,
                                           int maxLength,
                                           char... alphabet) {
        final Pattern actual = Pattern.compile(result.render(RegexRenderer.javaPattern()));
        final Pattern reference = Pattern.compile(expected);

        List<String> layer = new ArrayList<>();
        layer.add("");
        for (int len = 0; len <= maxLength; len++) {
            final List<String> next = new ArrayList<>();
            for (String w : layer) {
                Assert.assertEquals(actual.matcher(w).matches(), reference.matcher(w).matches(), "word '" + w + "'");
                for (char c : alphabet) {
                    next.add(w + c);
                }
            }
            layer = next;
        }
    }
}
