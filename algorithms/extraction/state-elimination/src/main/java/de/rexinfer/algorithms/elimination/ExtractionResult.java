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

import de.rexinfer.datastructure.regex.Regex;
import de.rexinfer.datastructure.regex.RegexRenderer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of a state elimination run: either a regular expression or the explicit statement that the automaton accepts
 * no word at all.
 *
 * @param <I>
 *         symbol type
 */
public final class ExtractionResult<I> {

    private final @Nullable Regex<I> regex;
    private final UniformizationReport uniformization;
    private final int interiorStates;
    private final int eliminationSteps;

    ExtractionResult(@Nullable Regex<I> regex,
                     UniformizationReport uniformization,
                     int interiorStates,
                     int eliminationSteps) {
        this.regex = regex;
        this.uniformization = uniformization;
        this.interiorStates = interiorStates;
        this.eliminationSteps = eliminationSteps;
    }

    public boolean isEmptyLanguage() {
        return regex == null;
    }

    /**
     * @throws IllegalStateException
     *         if the language is empty
     */
    public Regex<I> getRegex() {
        if (regex == null) {
            throw new IllegalStateException("The language is empty");
        }
        return regex;
    }

    /**
     * Renders the expression, or the empty-language symbol of the renderer if the language is empty.
     */
    public String render(RegexRenderer<I> renderer) {
        return renderer.render(regex == null ? Regex.emptySet() : regex);
    }

    public UniformizationReport getUniformization() {
        return uniformization;
    }

    /**
     * @return the number of states between source and sink when elimination started
     */
    public int getInteriorStates() {
        return interiorStates;
    }

    public int getEliminationSteps() {
        return eliminationSteps;
    }

    @Override
    public String toString() {
        return render(RegexRenderer.defaults());
    }
}
