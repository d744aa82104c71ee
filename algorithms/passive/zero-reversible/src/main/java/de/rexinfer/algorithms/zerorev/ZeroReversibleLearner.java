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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import de.learnlib.api.algorithm.PassiveLearningAlgorithm;
import de.learnlib.api.query.DefaultQuery;
import de.rexinfer.datastructure.graph.SnapshotListener;
import de.rexinfer.datastructure.graph.Transition;
import de.rexinfer.datastructure.graph.TransitionGraph;
import de.rexinfer.exception.LearnerInvariantException;
import net.automatalib.automata.fsa.DFA;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.commons.util.Pair;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.impl.ListAlphabet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Passive learner for 0-reversible languages, following Angluin's inference algorithm ("Inference of Reversible
 * Languages", JACM 1982).
 * <p>
 * The learner first builds a prefix tree acceptor from the positive samples. It then merges all accepting states and
 * keeps merging states until the automaton is both deterministic and reverse deterministic. The result is the smallest
 * 0-reversible language containing all samples.
 * <p>
 * Only positive samples are supported. Samples are retained, so further samples may be added after a model has been
 * computed; every call to {@link #computeGraph()} or {@link #computeModel()} starts over from the prefix tree.
 *
 * @param <I>
 *         input symbol type
 */
public class ZeroReversibleLearner<I> implements PassiveLearningAlgorithm<DFA<?, I>, I, Boolean> {

    public static final String STAGE_PREFIX_TREE = "prefix-tree";
    public static final String STAGE_ACCEPTING_MERGED = "accepting-merged";
    public static final String STAGE_ZERO_REVERSIBLE = "zero-reversible";

    private static final Logger LOGGER = LoggerFactory.getLogger(ZeroReversibleLearner.class);

    private final List<Word<I>> samples = new ArrayList<>();
    private final @Nullable Alphabet<I> alphabet;
    private final SnapshotListener<I> listener;

    public ZeroReversibleLearner() {
        this(SnapshotListener.ignore());
    }

    public ZeroReversibleLearner(SnapshotListener<I> listener) {
        this(null, listener);
    }

    public ZeroReversibleLearner(Alphabet<I> alphabet) {
        this(alphabet, SnapshotListener.ignore());
    }

    /**
     * @param alphabet
     *         the input alphabet of the computed model, or {@code null} to use the symbols occurring in the samples
     * @param listener
     *         receives a snapshot after prefix tree construction, after merging the accepting states, and of the final
     *         automaton
     */
    public ZeroReversibleLearner(@Nullable Alphabet<I> alphabet, SnapshotListener<I> listener) {
        this.alphabet = alphabet;
        this.listener = listener;
    }

    @Override
    public void addSamples(Collection<? extends DefaultQuery<I, Boolean>> samples) {
        for (DefaultQuery<I, Boolean> query : samples) {
            Preconditions.checkArgument(Boolean.TRUE.equals(query.getOutput()),
                                        "Only positive samples are supported, got %s",
                                        query);
            addSample(query.getInput());
        }
    }

    public void addPositiveSamples(Collection<? extends Word<I>> words) {
        for (Word<I> word : words) {
            addSample(word);
        }
    }

    private void addSample(Word<I> word) {
        if (alphabet != null) {
            for (I symbol : word) {
                Preconditions.checkArgument(alphabet.contains(symbol),
                                            "Symbol %s of sample %s is not contained in the alphabet",
                                            symbol,
                                            word);
            }
        }
        this.samples.add(word);
    }

    public List<Word<I>> getSamples() {
        return samples;
    }

    /**
     * Computes the 0-reversible automaton of the current samples.
     *
     * @throws LearnerInvariantException
     *         if the merge loop fails to reach a 0-reversible automaton
     */
    public TransitionGraph<I> computeGraph() {
        final TransitionGraph<I> graph = buildPrefixTree();
        LOGGER.debug("Prefix tree of {} samples has {} states", samples.size(), graph.size());
        listener.onSnapshot(STAGE_PREFIX_TREE, graph.snapshot());

        mergeAcceptingStates(graph);
        listener.onSnapshot(STAGE_ACCEPTING_MERGED, graph.snapshot());

        mergeClashes(graph);
        listener.onSnapshot(STAGE_ZERO_REVERSIBLE, graph.snapshot());

        return graph;
    }

    /**
     * Computes the 0-reversible automaton of the current samples as a partial DFA over the configured alphabet, or
     * over the symbols occurring in the samples if no alphabet was given. Words over symbols without a transition are
     * rejected.
     */
    @Override
    public CompactDFA<I> computeModel() {
        final TransitionGraph<I> graph = computeGraph();
        return alphabet == null ? toDFA(graph) : toDFA(graph, alphabet);
    }

    public static <I> CompactDFA<I> toDFA(TransitionGraph<I> graph) {
        final Set<I> symbols = new LinkedHashSet<>();
        for (Transition<I> t : graph.getTransitions()) {
            symbols.add(t.getLabel());
        }
        return toDFA(graph, new ListAlphabet<>(new ArrayList<>(symbols)));
    }

    public static <I> CompactDFA<I> toDFA(TransitionGraph<I> graph, Alphabet<I> alphabet) {
        final CompactDFA<I> dfa = new CompactDFA<>(alphabet);
        final Map<Integer, Integer> stateMap = new HashMap<>();

        for (Integer state : graph.getStates()) {
            final boolean accepting = graph.isAccepting(state);
            final Integer dfaState;
            if (state == graph.getInitialState()) {
                dfaState = dfa.addInitialState(accepting);
            } else {
                dfaState = dfa.addState(accepting);
            }
            stateMap.put(state, dfaState);
        }

        for (Transition<I> t : graph.getTransitions()) {
            dfa.setTransition(stateMap.get(t.getSource()), t.getLabel(), stateMap.get(t.getTarget()));
        }

        return dfa;
    }

    private TransitionGraph<I> buildPrefixTree() {
        final TransitionGraph<I> graph = new TransitionGraph<>();
        final int root = graph.addInitialState(false);
        final Map<Pair<Integer, I>, Integer> children = new HashMap<>();

        for (Word<I> sample : samples) {
            int state = root;
            for (I symbol : sample) {
                final Pair<Integer, I> key = Pair.of(state, symbol);
                Integer child = children.get(key);
                if (child == null) {
                    child = graph.addState(false);
                    graph.addTransition(state, symbol, child);
                    children.put(key, child);
                }
                state = child;
            }
            graph.setAccepting(state, true);
        }

        return graph;
    }

    private void mergeAcceptingStates(TransitionGraph<I> graph) {
        final List<Integer> accepting = graph.getAcceptingStates();
        if (accepting.isEmpty()) {
            LOGGER.warn("No accepting states, the learned language is empty");
            return;
        }

        int merged = accepting.get(0);
        for (int i = 1; i < accepting.size(); i++) {
            merged = graph.merge(merged, accepting.get(i));
        }
        LOGGER.debug("Merged {} accepting states into state {}", accepting.size(), merged);
    }

    /**
     * Merges clashing states until none remain. Every state whose incident transitions changed since it was last
     * examined is kept in the worklist, hence an empty worklist means no clash is left.
     */
    private void mergeClashes(TransitionGraph<I> graph) {
        final Set<Integer> worklist = new LinkedHashSet<>(graph.getStates());
        final int maxMerges = graph.size();
        int merges = 0;

        while (!worklist.isEmpty()) {
            final Iterator<Integer> iter = worklist.iterator();
            final int next = iter.next();
            iter.remove();

            final int state = graph.representative(next);
            final Clash<I> clash = ZeroReversibility.findClash(graph, state);
            if (clash == null) {
                continue;
            }

            if (++merges > maxMerges) {
                throw new LearnerInvariantException("Merge loop did not converge after " + maxMerges + " merges");
            }

            LOGGER.debug("Resolving {}", clash);
            final int survivor = graph.merge(clash.getFirst(), clash.getSecond());

            worklist.add(survivor);
            worklist.add(graph.representative(state));
            for (Transition<I> t : graph.outgoing(survivor)) {
                worklist.add(t.getTarget());
            }
            for (Transition<I> t : graph.incoming(survivor)) {
                worklist.add(t.getSource());
            }
        }

        final Clash<I> remaining = ZeroReversibility.findClash(graph);
        if (remaining != null) {
            throw new LearnerInvariantException("Automaton is not 0-reversible after merging: " + remaining);
        }
        LOGGER.debug("0-reversible automaton reached after {} merges, {} states left", merges, graph.size());
    }
}
