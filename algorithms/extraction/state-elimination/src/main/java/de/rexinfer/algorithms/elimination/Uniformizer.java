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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import de.rexinfer.datastructure.graph.Transition;
import de.rexinfer.datastructure.graph.TransitionGraph;
import de.rexinfer.datastructure.regex.Regex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites an automaton into the shape required by state elimination: a single source without incoming transitions,
 * a single sink without outgoing transitions, and only states that lie on some path from the source to the sink.
 */
public final class Uniformizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Uniformizer.class);

    private Uniformizer() {
        // prevent instantiation
    }

    /**
     * Uniformizes the given graph in place. A fresh source is introduced if the initial state has incoming
     * transitions or is accepting. A fresh sink is introduced unless there is exactly one accepting state and it has
     * no outgoing transitions. Afterwards the sink is the only accepting state. States that are not reachable from the
     * source or cannot reach the sink are removed.
     */
    public static <I> UniformizationReport uniformize(TransitionGraph<Regex<I>> graph) {
        final int initial = graph.getInitialState();

        int source = initial;
        final boolean sourceAdded = !graph.incoming(initial).isEmpty() || graph.isAccepting(initial);
        if (sourceAdded) {
            source = graph.addInitialState(false);
            graph.addTransition(source, Regex.epsilon(), initial);
        }

        final List<Integer> accepting = graph.getAcceptingStates();
        final boolean sinkAdded = accepting.size() != 1 || !graph.outgoing(accepting.get(0)).isEmpty();
        final int sink;
        if (sinkAdded) {
            sink = graph.addState(true);
            for (Integer acc : accepting) {
                graph.addTransition(acc, Regex.epsilon(), sink);
                graph.setAccepting(acc, false);
            }
        } else {
            sink = accepting.get(0);
        }

        final List<Integer> pruned = prune(graph, source, sink);
        if (!pruned.isEmpty()) {
            LOGGER.warn("Removed {} states not on any path from source {} to sink {}: {}",
                        pruned.size(),
                        source,
                        sink,
                        pruned);
        }

        final UniformizationReport report = new UniformizationReport(source, sink, sourceAdded, sinkAdded, pruned);
        LOGGER.debug("Uniform automaton: {}", report);
        return report;
    }

    /**
     * Checks whether the given graph is uniform, i.e. its initial state is the only state without incoming
     * transitions, its only accepting state is the only state without outgoing transitions, these two states are
     * distinct, and every state lies on a path between them.
     */
    public static <L> boolean isUniform(TransitionGraph<L> graph) {
        final List<Integer> accepting = graph.getAcceptingStates();
        if (accepting.size() != 1) {
            return false;
        }
        final int source = graph.getInitialState();
        final int sink = accepting.get(0);
        if (source == sink) {
            return false;
        }

        for (Integer state : graph.getStates()) {
            if (graph.incoming(state).isEmpty() != (state == source)) {
                return false;
            }
            if (graph.outgoing(state).isEmpty() != (state == sink)) {
                return false;
            }
        }

        final BitSet reachable = search(graph, source, true);
        final BitSet coReachable = search(graph, sink, false);
        for (Integer state : graph.getStates()) {
            if (!reachable.get(state) || !coReachable.get(state)) {
                return false;
            }
        }
        return true;
    }

    private static <L> List<Integer> prune(TransitionGraph<L> graph, int source, int sink) {
        final BitSet reachable = search(graph, source, true);
        final BitSet coReachable = search(graph, sink, false);

        final List<Integer> useless = new ArrayList<>();
        for (Integer state : graph.getStates()) {
            if (state != source && state != sink && (!reachable.get(state) || !coReachable.get(state))) {
                useless.add(state);
            }
        }

        for (Integer state : useless) {
            for (Transition<L> t : graph.outgoing(state)) {
                graph.removeTransition(t);
            }
            for (Transition<L> t : graph.incoming(state)) {
                graph.removeTransition(t);
            }
        }
        for (Integer state : useless) {
            graph.removeState(state);
        }

        return useless;
    }

    private static <L> BitSet search(TransitionGraph<L> graph, int start, boolean forward) {
        final BitSet visited = new BitSet();
        final Deque<Integer> stack = new ArrayDeque<>();
        visited.set(start);
        stack.push(start);

        while (!stack.isEmpty()) {
            final int state = stack.pop();
            final List<Transition<L>> transitions = forward ? graph.outgoing(state) : graph.incoming(state);
            for (Transition<L> t : transitions) {
                final int next = forward ? t.getTarget() : t.getSource();
                if (!visited.get(next)) {
                    visited.set(next);
                    stack.push(next);
                }
            }
        }

        return visited;
    }
}
