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

import java.util.ArrayList;
import java.util.List;

/**
 * Simplifier that keeps intermediate expressions compact by purely syntactic rewriting.
 * <p>
 * Rules applied by every instance:
 * <ul>
 * <li>{@code ∅|x = x|∅ = x}, {@code x|x = x}</li>
 * <li>{@code εx = xε = x}, {@code ∅x = x∅ = ∅}</li>
 * <li>{@code ε* = ∅* = ε}</li>
 * <li>concatenations are kept right-nested, {@code (xy)z = x(yz)}</li>
 * <li>{@code px|py = p(x|y)} and {@code xs|ys = (x|y)s}</li>
 * </ul>
 * Additional rules of the {@link #NestedRegexSimplifier(boolean) extended} variant:
 * <ul>
 * <li>{@code (x*)* = x*}</li>
 * <li>{@code x|(y|x) = y|x} for an alternative {@code x} already present in a union chain</li>
 * <li>{@code p|py = p(ε|y)} and {@code s|ys = (ε|y)s}</li>
 * </ul>
 * This is a best-effort pass: it bounds the growth of expressions during state elimination, but does not compute
 * minimal expressions. No rule fires unless it obviously preserves the language. Since every rule is applied
 * deterministically to already simplified operands, {@link #simplify(Regex)} is idempotent.
 *
 * @param <I>
 *         symbol type
 */
public class NestedRegexSimplifier<I> implements RegexSimplifier<I> {

    private final boolean extended;

    public NestedRegexSimplifier() {
        this(false);
    }

    public NestedRegexSimplifier(boolean extended) {
        this.extended = extended;
    }

    @Override
    public Regex<I> union(Regex<I> left, Regex<I> right) {
        if (left.isEmptySet()) {
            return right;
        }
        if (right.isEmptySet() || left.equals(right)) {
            return left;
        }

        if (extended) {
            if (alternatives(left).contains(right)) {
                return left;
            }
            if (alternatives(right).contains(left)) {
                return right;
            }
        }

        final boolean leftConcat = left.getKind() == Regex.Kind.CONCAT;
        final boolean rightConcat = right.getKind() == Regex.Kind.CONCAT;

        if ((leftConcat && rightConcat) || (extended && (leftConcat || rightConcat))) {
            final Regex<I> head = head(left);
            if (head.equals(head(right))) {
                return concat(head, union(afterHead(left), afterHead(right)));
            }

            final List<Regex<I>> leftFactors = factors(left);
            final List<Regex<I>> rightFactors = factors(right);
            final Regex<I> last = leftFactors.get(leftFactors.size() - 1);
            if (last.equals(rightFactors.get(rightFactors.size() - 1))) {
                return concat(union(beforeLast(leftFactors), beforeLast(rightFactors)), last);
            }
        }

        return Regex.union(left, right);
    }

    @Override
    public Regex<I> concat(Regex<I> left, Regex<I> right) {
        if (left.isEmptySet() || right.isEmptySet()) {
            return Regex.emptySet();
        }
        if (left.isEpsilon()) {
            return right;
        }
        if (right.isEpsilon()) {
            return left;
        }
        if (left.getKind() == Regex.Kind.CONCAT) {
            final Regex.Concat<I> c = (Regex.Concat<I>) left;
            return concat(c.getLeft(), concat(c.getRight(), right));
        }
        return Regex.concat(left, right);
    }

    @Override
    public Regex<I> star(Regex<I> operand) {
        if (operand.isEpsilon() || operand.isEmptySet()) {
            return Regex.epsilon();
        }
        if (extended && operand.getKind() == Regex.Kind.STAR) {
            return operand;
        }
        return Regex.star(operand);
    }

    private Regex<I> head(Regex<I> regex) {
        if (regex.getKind() == Regex.Kind.CONCAT) {
            return ((Regex.Concat<I>) regex).getLeft();
        }
        return regex;
    }

    private Regex<I> afterHead(Regex<I> regex) {
        if (regex.getKind() == Regex.Kind.CONCAT) {
            return ((Regex.Concat<I>) regex).getRight();
        }
        return Regex.epsilon();
    }

    private Regex<I> beforeLast(List<Regex<I>> factors) {
        Regex<I> result = Regex.epsilon();
        for (int i = factors.size() - 2; i >= 0; i--) {
            result = concat(factors.get(i), result);
        }
        return result;
    }

    private static <I> List<Regex<I>> factors(Regex<I> regex) {
        final List<Regex<I>> result = new ArrayList<>();
        Regex<I> curr = regex;
        while (curr.getKind() == Regex.Kind.CONCAT) {
            final Regex.Concat<I> c = (Regex.Concat<I>) curr;
            result.add(c.getLeft());
            curr = c.getRight();
        }
        result.add(curr);
        return result;
    }

    private static <I> List<Regex<I>> alternatives(Regex<I> regex) {
        final List<Regex<I>> result = new ArrayList<>();
        collectAlternatives(regex, result);
        return result;
    }

    private static <I> void collectAlternatives(Regex<I> regex, List<Regex<I>> result) {
        if (regex.getKind() == Regex.Kind.UNION) {
            final Regex.Union<I> u = (Regex.Union<I>) regex;
            collectAlternatives(u.getLeft(), result);
            collectAlternatives(u.getRight(), result);
        } else {
            result.add(regex);
        }
    }
}
