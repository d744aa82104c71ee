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

import java.util.function.Function;

/**
 * Renders a {@link Regex} to its textual form. Star binds tighter than concatenation, concatenation binds tighter than
 * union; parentheses are only emitted where this precedence would otherwise be violated.
 *
 * @param <I>
 *         symbol type
 */
public class RegexRenderer<I> {

    private static final String JAVA_METACHARACTERS = "\\^$.|?*+()[]{}";

    private static final int UNION = 0;
    private static final int CONCAT = 1;
    private static final int STAR = 2;

    private final Function<? super I, String> symbolRenderer;
    private final String epsilon;
    private final String emptySet;

    public RegexRenderer(Function<? super I, String> symbolRenderer, String epsilon, String emptySet) {
        this.symbolRenderer = symbolRenderer;
        this.epsilon = epsilon;
        this.emptySet = emptySet;
    }

    /**
     * Renders symbols via {@link String#valueOf(Object)}, the empty word as {@code ε} and the empty language as
     * {@code ∅}.
     */
    public static <I> RegexRenderer<I> defaults() {
        return new RegexRenderer<I>(String::valueOf, "ε", "∅");
    }

    /**
     * Renders a string that {@link java.util.regex.Pattern} accepts and that denotes the same language: metacharacters
     * in symbols are escaped, the empty word becomes an empty group and the empty language a character class that
     * matches nothing.
     */
    public static <I> RegexRenderer<I> javaPattern() {
        return new RegexRenderer<I>(RegexRenderer::escape, "()", "[^\\s\\S]");
    }

    public String render(Regex<I> regex) {
        final StringBuilder sb = new StringBuilder();
        render(regex, UNION, sb);
        return sb.toString();
    }

    private void render(Regex<I> regex, int context, StringBuilder sb) {
        switch (regex.getKind()) {
            case EMPTY_SET:
                sb.append(emptySet);
                break;
            case EPSILON:
                sb.append(epsilon);
                break;
            case SYMBOL:
                final String symbol = symbolRenderer.apply(((Regex.Symbol<I>) regex).getSymbol());
                if (context == STAR && !isAtomic(symbol)) {
                    sb.append('(').append(symbol).append(')');
                } else {
                    sb.append(symbol);
                }
                break;
            case STAR:
                final Regex<I> operand = ((Regex.Star<I>) regex).getOperand();
                if (operand.getKind() == Regex.Kind.STAR) {
                    sb.append('(');
                    render(operand, STAR, sb);
                    sb.append(')');
                } else {
                    render(operand, STAR, sb);
                }
                sb.append('*');
                break;
            case CONCAT:
                final Regex.Concat<I> concat = (Regex.Concat<I>) regex;
                renderBinary(concat, CONCAT, "", context, sb);
                break;
            case UNION:
                final Regex.Union<I> union = (Regex.Union<I>) regex;
                renderBinary(union, UNION, "|", context, sb);
                break;
            default:
                throw new IllegalArgumentException("Unknown kind: " + regex.getKind());
        }
    }

    private void renderBinary(Regex.Binary<I> binary, int level, String operator, int context, StringBuilder sb) {
        // a star operand must be atomic, so any binary expression below a star is parenthesized as well
        final boolean parens = context > level;
        if (parens) {
            sb.append('(');
        }
        render(binary.getLeft(), level, sb);
        sb.append(operator);
        render(binary.getRight(), level, sb);
        if (parens) {
            sb.append(')');
        }
    }

    private static boolean isAtomic(String token) {
        return token.codePointCount(0, token.length()) == 1 || (token.length() == 2 && token.charAt(0) == '\\');
    }

    private static String escape(Object symbol) {
        final String raw = String.valueOf(symbol);
        final StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            final char c = raw.charAt(i);
            if (JAVA_METACHARACTERS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
