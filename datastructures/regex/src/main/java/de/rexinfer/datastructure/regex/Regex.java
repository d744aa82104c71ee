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

import java.util.Objects;

/**
 * A regular expression over symbols of type {@code I}. The hierarchy is closed: every instance is one of the nested
 * classes below, as reported by {@link #getKind()}.
 * <p>
 * The static factory methods construct nodes exactly as requested, without any rewriting. Simplification is the
 * responsibility of a {@link RegexSimplifier}. Equality is structural.
 *
 * @param <I>
 *         symbol type
 */
public abstract class Regex<I> {

    @SuppressWarnings("rawtypes")
    private static final Regex EMPTY_SET = new EmptySet();
    @SuppressWarnings("rawtypes")
    private static final Regex EPSILON = new Epsilon();

    public enum Kind {
        EMPTY_SET,
        EPSILON,
        SYMBOL,
        CONCAT,
        UNION,
        STAR
    }

    private final int hash;

    private Regex(int hash) {
        this.hash = hash;
    }

    @SuppressWarnings("unchecked")
    public static <I> Regex<I> emptySet() {
        return (Regex<I>) EMPTY_SET;
    }

    @SuppressWarnings("unchecked")
    public static <I> Regex<I> epsilon() {
        return (Regex<I>) EPSILON;
    }

    public static <I> Regex<I> symbol(I symbol) {
        return new Symbol<>(symbol);
    }

    public static <I> Regex<I> concat(Regex<I> left, Regex<I> right) {
        return new Concat<>(left, right);
    }

    public static <I> Regex<I> union(Regex<I> left, Regex<I> right) {
        return new Union<>(left, right);
    }

    public static <I> Regex<I> star(Regex<I> operand) {
        return new Star<>(operand);
    }

    public abstract Kind getKind();

    public boolean isEmptySet() {
        return getKind() == Kind.EMPTY_SET;
    }

    public boolean isEpsilon() {
        return getKind() == Kind.EPSILON;
    }

    /**
     * @return the number of nodes of this expression tree
     */
    public abstract int size();

    @Override
    public final int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return RegexRenderer.<I>defaults().render(this);
    }

    public static final class EmptySet<I> extends Regex<I> {

        private EmptySet() {
            super(Kind.EMPTY_SET.ordinal());
        }

        @Override
        public Kind getKind() {
            return Kind.EMPTY_SET;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof EmptySet;
        }
    }

    public static final class Epsilon<I> extends Regex<I> {

        private Epsilon() {
            super(Kind.EPSILON.ordinal());
        }

        @Override
        public Kind getKind() {
            return Kind.EPSILON;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Epsilon;
        }
    }

    public static final class Symbol<I> extends Regex<I> {

        private final I symbol;

        private Symbol(I symbol) {
            super(Objects.hash(Kind.SYMBOL.ordinal(), symbol));
            this.symbol = Objects.requireNonNull(symbol);
        }

        public I getSymbol() {
            return symbol;
        }

        @Override
        public Kind getKind() {
            return Kind.SYMBOL;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Symbol)) {
                return false;
            }
            return symbol.equals(((Symbol<?>) o).symbol);
        }
    }

    /**
     * Common base of the two binary operators.
     */
    public abstract static class Binary<I> extends Regex<I> {

        private final Regex<I> left;
        private final Regex<I> right;
        private final int size;

        private Binary(Kind kind, Regex<I> left, Regex<I> right) {
            super(Objects.hash(kind.ordinal(), left, right));
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
            this.size = 1 + left.size() + right.size();
        }

        public Regex<I> getLeft() {
            return left;
        }

        public Regex<I> getRight() {
            return right;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || o.getClass() != getClass()) {
                return false;
            }
            final Binary<?> that = (Binary<?>) o;
            return hashCode() == that.hashCode() && left.equals(that.left) && right.equals(that.right);
        }
    }

    public static final class Concat<I> extends Binary<I> {

        private Concat(Regex<I> left, Regex<I> right) {
            super(Kind.CONCAT, left, right);
        }

        @Override
        public Kind getKind() {
            return Kind.CONCAT;
        }
    }

    public static final class Union<I> extends Binary<I> {

        private Union(Regex<I> left, Regex<I> right) {
            super(Kind.UNION, left, right);
        }

        @Override
        public Kind getKind() {
            return Kind.UNION;
        }
    }

    public static final class Star<I> extends Regex<I> {

        private final Regex<I> operand;

        private Star(Regex<I> operand) {
            super(Objects.hash(Kind.STAR.ordinal(), operand));
            this.operand = Objects.requireNonNull(operand);
        }

        public Regex<I> getOperand() {
            return operand;
        }

        @Override
        public Kind getKind() {
            return Kind.STAR;
        }

        @Override
        public int size() {
            return 1 + operand.size();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Star)) {
                return false;
            }
            return operand.equals(((Star<?>) o).operand);
        }
    }
}
