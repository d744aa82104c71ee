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
package de.rexinfer.datastructure.regex;

/**
 * Factory for the available {@link RegexSimplifier}s.
 */
public final class RegexSimplifiers {

    private RegexSimplifiers() {
        // prevent instantiation
    }

    /**
     * Returns a simplifier that builds exactly the requested nodes. Useful for inspecting the raw output of an
     * algorithm.
     */
    public static <I> RegexSimplifier<I> structural() {
        return new RegexSimplifier<I>() {

            @Override
            public Regex<I> union(Regex<I> left, Regex<I> right) {
                return Regex.union(left, right);
            }

            @Override
            public Regex<I> concat(Regex<I> left, Regex<I> right) {
                return Regex.concat(left, right);
            }

            @Override
            public Regex<I> star(Regex<I> operand) {
                return Regex.star(operand);
            }
        };
    }

    /**
     * Returns the nested-expression simplifier, see {@link NestedRegexSimplifier}.
     */
    public static <I> RegexSimplifier<I> nested() {
        return new NestedRegexSimplifier<>();
    }

    /**
     * Returns the nested-expression simplifier with its additional factoring rules enabled, see {@link
     * NestedRegexSimplifier}.
     */
    public static <I> RegexSimplifier<I> nestedExtended() {
        return new NestedRegexSimplifier<>(true);
    }
}
