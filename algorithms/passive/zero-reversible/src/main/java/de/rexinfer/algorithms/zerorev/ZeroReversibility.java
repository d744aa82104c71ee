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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import de.rexinfer.datastructure.graph.Transition;
import de.rexinfer.datastructure.graph.TransitionGraph;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks for the two properties that make up 0-reversibility: determinism and reverse determinism.
 */
public final class ZeroReversibility {

    private ZeroReversibility() {
        // prevent instantiation
    }

    public static <L> boolean isZeroReversible(TransitionGraph<L> graph) {
        return findClash(graph) == null;
    }

    public static <L> boolean isDeterministic(TransitionGraph<L> graph) {
        for (Integer state : graph.getStates()) {
            if (findForwardClash(graph, state) != null) {
                return false;
            }
        }
        return true;
    }

    public static <L> boolean isReverseDeterministic(TransitionGraph<L> graph) {
        for (Integer state : graph.getStates()) {
            if (findBackwardClash(graph, state) != null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Scans the whole graph in ascending state order.
     *
     * @return the first clash found, or {@code null} if the graph is 0-reversible
     */
    public static <L> @Nullable Clash<L> findClash(TransitionGraph<L> graph) {
        for (Integer state : graph.getStates()) {
            final Clash<L> clash = findClash(graph, state);
            if (clash != null) {
                return clash;
            }
        }
        return null;
    }

    /**
     * Looks for a clash pivoted at the given state. Forward clashes are reported before backward clashes.
     */
    public static <L> @Nullable Clash<L> findClash(TransitionGraph<L> graph, int state) {
        final Clash<L> forward = findForwardClash(graph, state);
        return forward != null ? forward : findBackwardClash(graph, state);
    }

    private static <L> @Nullable Clash<L> findForwardClash(TransitionGraph<L> graph, int state) {
        final List<Transition<L>> outgoing = graph.outgoing(state);
        final Map<L, Integer> targets = new HashMap<>();
        for (Transition<L> t : outgoing) {
            final Integer other = targets.putIfAbsent(t.getLabel(), t.getTarget());
            if (other != null && other != t.getTarget()) {
                return new Clash<>(Clash.Direction.FORWARD, state, t.getLabel(), other, t.getTarget());
            }
        }
        return null;
    }

    private static <L> @Nullable Clash<L> findBackwardClash(TransitionGraph<L> graph, int state) {
        final List<Transition<L>> incoming = graph.incoming(state);
        final Map<L, Integer> sources = new HashMap<>();
        for (Transition<L> t : incoming) {
            final Integer other = sources.putIfAbsent(t.getLabel(), t.getSource());
            if (other != null && other != t.getSource()) {
                return new Clash<>(Clash.Direction.BACKWARD, state, t.getLabel(), other, t.getSource());
            }
        }
        return null;
    }
}
