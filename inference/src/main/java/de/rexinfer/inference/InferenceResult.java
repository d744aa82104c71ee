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

import de.rexinfer.algorithms.elimination.ExtractionResult;
import de.rexinfer.datastructure.graph.GraphSnapshot;
import de.rexinfer.datastructure.regex.Regex;
import de.rexinfer.datastructure.regex.RegexRenderer;

/**
 * The learned automaton together with the expression extracted from it.
 *
 * @param <I>
 *         symbol type
 */
public final class InferenceResult<I> {

    private final GraphSnapshot<I> automaton;
    private final ExtractionResult<I> extraction;

    InferenceResult(GraphSnapshot<I> automaton, ExtractionResult<I> extraction) {
        this.automaton = automaton;
        this.extraction = extraction;
    }

    public GraphSnapshot<I> getAutomaton() {
        return automaton;
    }

    public ExtractionResult<I> getExtraction() {
        return extraction;
    }

    public boolean isEmptyLanguage() {
        return extraction.isEmptyLanguage();
    }

    public Regex<I> getRegex() {
        return extraction.getRegex();
    }

    public String render(RegexRenderer<I> renderer) {
        return extraction.render(renderer);
    }

    @Override
    public String toString() {
        return extraction.toString();
    }
}
