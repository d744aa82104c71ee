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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import de.rexinfer.datastructure.graph.SnapshotListener;
import de.rexinfer.datastructure.graph.Transition;
import de.rexinfer.datastructure.graph.TransitionGraph;
import de.rexinfer.datastructure.regex.Regex;
import de.rexinfer.datastructure.regex.RegexSimplifier;
import de.rexinfer.datastructure.regex.RegexSimplifiers;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts a regular expression from an automaton by state elimination.
 * <p>
 * The automaton is {@link Uniformizer uniformized} first. Then the interior states are removed one by one, in
 * ascending id order. Removing a state {@code q} replaces every path {@code p -x-> q -z-> r} (with an optional loop
 * {@code q -y-> q}) by a transition {@code p -xy*z-> r}, which is merged via union with an already present transition
 * from {@code p} to {@code r}. Once only source and sink are left, the label of the single transition between them
 * denotes the language of the automaton.
 * <p>
 * Compound labels are constructed through the configured {@link RegexSimplifier}.
 *
 * @param <I>
 *         symbol type
 */
public class StateEliminationExtractor<I> {

    public static final String STAGE_UNIFORM = "uniform";
    public static final String STAGE_ELIMINATED = "eliminated";

    private static final Logger LOGGER = LoggerFactory.getLogger(StateEliminationExtractor.class);

    private final RegexSimplifier<I> simplifier;
    private final SnapshotListener<Regex<I>> listener;

    public StateEliminationExtractor() {
        this(RegexSimplifiers.nested());
    }

    public StateEliminationExtractor(RegexSimplifier<I> simplifier) {
        this(simplifier, SnapshotListener.ignore());
    }

    /**
     * @param simplifier
     *         the policy used for constructing compound labels
     * @param listener
     *         receives a snapshot of the uniform automaton and one after every elimination step
     */
    public StateEliminationExtractor(RegexSimplifier<I> simplifier, SnapshotListener<Regex<I>> listener) {
        this.simplifier = simplifier;
        this.listener = listener;
    }

    /**
     * Extracts an expression from an automaton labelled with plain symbols. The given graph is not modified.
     */
    public ExtractionResult<I> extractFromSymbols(TransitionGraph<I> graph) {
        return extract(graph.<Regex<I>>relabel(Regex::symbol));
    }

    /**
     * Extracts an expression from the given automaton. The graph is consumed: afterwards it only consists of source
     * and sink.
     */
    public ExtractionResult<I> extract(TransitionGraph<Regex<I>> graph) {
        final UniformizationReport report = Uniformizer.uniformize(graph);
        final int source = report.getSource();
        final int sink = report.getSink();

        collapseParallelTransitions(graph);
        listener.onSnapshot(STAGE_UNIFORM, graph.snapshot());

        final List<Integer> interior = new ArrayList<>(graph.getStates());
        interior.remove(Integer.valueOf(source));
        interior.remove(Integer.valueOf(sink));

        int steps = 0;
        for (Integer state : interior) {
            eliminate(graph, state);
            steps++;
            listener.onSnapshot(STAGE_ELIMINATED + '-' + state, graph.snapshot());
        }

        Preconditions.checkState(graph.size() == 2 && graph.getNumTransitions() <= 1,
                                 "State elimination left %s states and %s transitions",
                                 graph.size(),
                                 graph.getNumTransitions());

        final List<Transition<Regex<I>>> remaining = graph.transitionsBetween(source, sink);
        if (remaining.isEmpty()) {
            LOGGER.debug("No transition between source and sink, the language is empty");
            return new ExtractionResult<>(null, report, interior.size(), steps);
        }

        final Regex<I> result = remaining.get(0).getLabel();
        LOGGER.debug("Extracted expression of size {} after {} elimination steps", result.size(), steps);
        return new ExtractionResult<>(result, report, interior.size(), steps);
    }

    private void eliminate(TransitionGraph<Regex<I>> graph, int state) {
        final List<Transition<Regex<I>>> incoming = new ArrayList<>();
        final List<Transition<Regex<I>>> outgoing = new ArrayList<>();
        @Nullable Regex<I> loop = null;

        for (Transition<Regex<I>> t : graph.incoming(state)) {
            if (t.isSelfLoop()) {
                loop = simplifier.star(t.getLabel());
            } else {
                incoming.add(t);
            }
        }
        for (Transition<Regex<I>> t : graph.outgoing(state)) {
            if (!t.isSelfLoop()) {
                outgoing.add(t);
            }
        }

        LOGGER.debug("Eliminating state {} ({} incoming, {} outgoing, loop: {})",
                     state,
                     incoming.size(),
                     outgoing.size(),
                     loop);

        for (Transition<Regex<I>> in : incoming) {
            for (Transition<Regex<I>> out : outgoing) {
                final Regex<I> tail = loop == null ? out.getLabel() : simplifier.concat(loop, out.getLabel());
                addOrMerge(graph, in.getSource(), simplifier.concat(in.getLabel(), tail), out.getTarget());
            }
        }

        for (Transition<Regex<I>> t : graph.incoming(state)) {
            graph.removeTransition(t);
        }
        for (Transition<Regex<I>> t : graph.outgoing(state)) {
            graph.removeTransition(t);
        }
        graph.removeState(state);
    }

    private void addOrMerge(TransitionGraph<Regex<I>> graph, int source, Regex<I> label, int target) {
        final @Nullable Transition<Regex<I>> existing = first(graph.transitionsBetween(source, target));
        if (existing == null) {
            graph.addTransition(source, label, target);
            return;
        }

        final Regex<I> combined = simplifier.union(existing.getLabel(), label);
        if (!combined.equals(existing.getLabel())) {
            graph.removeTransition(existing);
            graph.addTransition(source, combined, target);
        }
    }

    /**
     * Replaces all transitions sharing source and target by a single one, labelled with the union of their labels.
     */
    private void collapseParallelTransitions(TransitionGraph<Regex<I>> graph) {
        for (Integer state : graph.getStates()) {
            final Map<Integer, List<Transition<Regex<I>>>> byTarget = new LinkedHashMap<>();
            for (Transition<Regex<I>> t : graph.outgoing(state)) {
                byTarget.computeIfAbsent(t.getTarget(), k -> new ArrayList<>()).add(t);
            }

            for (List<Transition<Regex<I>>> parallel : byTarget.values()) {
                if (parallel.size() < 2) {
                    continue;
                }
                Regex<I> combined = parallel.get(0).getLabel();
                for (int i = 1; i < parallel.size(); i++) {
                    combined = simplifier.union(combined, parallel.get(i).getLabel());
                }
                for (Transition<Regex<I>> t : parallel) {
                    graph.removeTransition(t);
                }
                graph.addTransition(state, combined, parallel.get(0).getTarget());
            }
        }
    }

    private static <T> @Nullable T first(List<T> list) {
        return list.isEmpty() ? null : list.get(0);
    }
}
