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
package de.rexinfer.algorithms.zerorev;

import de.rexinfer.datastructure.graph.TransitionGraph;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ZeroReversibilityTest {

    @Test
    public void testForwardClash() {
        final TransitionGraph<Character> graph = new TransitionGraph<>();
        final int q0 = graph.addInitialState(false);
        final int q1 = graph.addState(false);
        final int q2 = graph.addState(true);
        graph.addTransition(q0, 'a', q1);
        graph.addTransition(q0, 'a', q2);

        final Clash<Character> clash = ZeroReversibility.findClash(graph);

        Assert.assertNotNull(clash);
        Assert.assertEquals(clash.getDirection(), Clash.Direction.FORWARD);
        Assert.assertEquals(clash.getPivot(), q0);
        Assert.assertEquals(clash.getLabel(), Character.valueOf('a'));
        Assert.assertEquals(clash.getFirst(), q1);
        Assert.assertEquals(clash.getSecond(), q2);
        Assert.assertFalse(ZeroReversibility.isDeterministic(graph));
        Assert.assertTrue(ZeroReversibility.isReverseDeterministic(graph));
    }

    @Test
    public void testBackwardClash() {
        final TransitionGraph<Character> graph = new TransitionGraph<>();
        final int q0 = graph.addInitialState(false);
        final int q1 = graph.addState(false);
        final int q2 = graph.addState(true);
        graph.addTransition(q0, 'a', q1);
        graph.addTransition(q0, 'b', q2);
        graph.addTransition(q1, 'b', q2);

        final Clash<Character> clash = ZeroReversibility.findClash(graph);

        Assert.assertNotNull(clash);
        Assert.assertEquals(clash.getDirection(), Clash.Direction.BACKWARD);
        Assert.assertEquals(clash.getPivot(), q2);
        Assert.assertTrue(ZeroReversibility.isDeterministic(graph));
        Assert.assertFalse(ZeroReversibility.isReverseDeterministic(graph));
    }

    @Test
    public void testSelfLoopClash() {
        final TransitionGraph<Character> graph = new TransitionGraph<>();
        final int q0 = graph.addInitialState(false);
        final int q1 = graph.addState(true);
        graph.addTransition(q0, 'a', q0);
        graph.addTransition(q0, 'a', q1);

        final Clash<Character> clash = ZeroReversibility.findClash(graph, q0);

        Assert.assertNotNull(clash);
        Assert.assertEquals(clash.getDirection(), Clash.Direction.FORWARD);
    }

    @Test
    public void testDistinctLabelsDoNotClash() {
        final TransitionGraph<Character> graph = new TransitionGraph<>();
        final int q0 = graph.addInitialState(false);
        final int q1 = graph.addState(true);
        graph.addTransition(q0, 'a', q1);
        graph.addTransition(q0, 'b', q1);
        graph.addTransition(q1, 'c', q1);

        Assert.assertTrue(ZeroReversibility.isZeroReversible(graph));
        Assert.assertNull(ZeroReversibility.findClash(graph, q1));
    }
}
