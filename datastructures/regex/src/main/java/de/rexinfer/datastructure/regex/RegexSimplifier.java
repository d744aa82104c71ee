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
 * Policy for constructing compound expressions. Implementations may rewrite the requested node into a structurally
 * simpler expression, as long as the rewritten expression denotes the same language.
 *
 * @param <I>
 *         symbol type
 *
 * @see RegexSimplifiers
 */
public interface RegexSimplifier<I> {

    Regex<I> union(Regex<I> left, Regex<I> right);

    Regex<I> concat(Regex<I> left, Regex<I> right);

    Regex<I> star(Regex<I> operand);

    /**
     * Rebuilds the given expression bottom-up through {@link #union(Regex, Regex)}, {@link #concat(Regex, Regex)} and
     * {@link #star(Regex)}.
     */
    default Regex<I> simplify(Regex<I> regex) {
        switch (regex.getKind()) {
            case CONCAT:
                final Regex.Concat<I> concat = (Regex.Concat<I>) regex;
                return concat(simplify(concat.getLeft()), simplify(concat.getRight()));
            case UNION:
                final Regex.Union<I> union = (Regex.Union<I>) regex;
                return union(simplify(union.getLeft()), simplify(union.getRight()));
            case STAR:
                return star(simplify(((Regex.Star<I>) regex).getOperand()));
            default:
                return regex;
        }
    }
}
