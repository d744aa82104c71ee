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
package de.rexinfer.inference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.google.common.base.Preconditions;
import de.rexinfer.algorithms.elimination.ExtractionResult;
import de.rexinfer.algorithms.elimination.StateEliminationExtractor;
import de.rexinfer.algorithms.zerorev.ZeroReversibleLearner;
import de.rexinfer.datastructure.graph.SnapshotListener;
import de.rexinfer.datastructure.graph.TransitionGraph;
import de.rexinfer.datastructure.regex.Regex;
import de.rexinfer.datastructure.regex.RegexSimplifier;
import de.rexinfer.datastructure.regex.RegexSimplifiers;
import net.automatalib.words.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Infers a regular expression from positive examples: a 0-reversible automaton is learned from the examples and
 * converted into an expression by state elimination.
 *
 * @param <I>
 *         symbol type
 */
public class RegexInference<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RegexInference.class);

    private final RegexSimplifier<I> simplifier;
    private final SnapshotListener<I> learnerListener;
    private final SnapshotListener<Regex<I>> extractorListener;

    public RegexInference() {
        this(RegexSimplifiers.nested());
    }

    public RegexInference(RegexSimplifier<I> simplifier) {
        this(simplifier, SnapshotListener.ignore(), SnapshotListener.ignore());
    }

    /**
     * @param simplifier
     *         the policy used for constructing the expression
     * @param learnerListener
     *         receives the automata of the learning stages
     * @param extractorListener
     *         receives the automata of the elimination stages
     */
    public RegexInference(RegexSimplifier<I> simplifier,
                          SnapshotListener<I> learnerListener,
                          SnapshotListener<Regex<I>> extractorListener) {
        this.simplifier = simplifier;
        this.learnerListener = learnerListener;
        this.extractorListener = extractorListener;
    }

    /**
     * Runs the whole pipeline on the given examples.
     *
     * @throws IllegalArgumentException
     *         if no example is given
     */
    public InferenceResult<I> infer(Collection<? extends Word<I>> examples) {
        Preconditions.checkArgument(!examples.isEmpty(), "At least one example is required");

        final ZeroReversibleLearner<I> learner = new ZeroReversibleLearner<>(learnerListener);
        learner.addPositiveSamples(examples);
        final TransitionGraph<I> automaton = learner.computeGraph();
        LOGGER.info("Learned 0-reversible automaton with {} states from {} examples",
                    automaton.size(),
                    examples.size());

        final StateEliminationExtractor<I> extractor = new StateEliminationExtractor<>(simplifier, extractorListener);
        final ExtractionResult<I> extraction = extractor.extractFromSymbols(automaton);
        LOGGER.info("Extracted expression after {} elimination steps", extraction.getEliminationSteps());

        return new InferenceResult<>(automaton.snapshot(), extraction);
    }

    /**
     * Infers an expression over the characters of the given strings. Every Unicode code point is one symbol, so
     * characters outside the Basic Multilingual Plane are never split into surrogate halves.
     */
    public static InferenceResult<String> forStrings(Collection<String> examples) {
        return forStrings(examples, RegexSimplifiers.nested());
    }

    public static InferenceResult<String> forStrings(Collection<String> examples, RegexSimplifier<String> simplifier) {
        return new RegexInference<>(simplifier).infer(toWords(examples));
    }

    /**
     * Splits each example into its code points, each represented by a string of one code point.
     */
    public static List<Word<String>> toWords(Collection<String> examples) {
        final List<Word<String>> words = new ArrayList<>(examples.size());
        for (String example : examples) {
            final List<String> symbols = new ArrayList<>(example.length());
            example.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
            words.add(Word.fromList(symbols));
        }
        return words;
    }
}
