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
package de.rexinfer.datastructure.graph;

import java.util.Objects;

/**
 * An immutable (source, label, target) triple. Two transitions are equal iff all three components are equal.
 *
 * @param <L>
 *         label type
 */
public final class Transition<L> {

    private final int source;
    private final L label;
    private final int target;

    public Transition(int source, L label, int target) {
        this.source = source;
        this.label = Objects.requireNonNull(label);
        this.target = target;
    }

    public int getSource() {
        return source;
    }

    public L getLabel() {
        return label;
    }

    public int getTarget() {
        return target;
    }

    public boolean isSelfLoop() {
        return source == target;
    }

    Transition<L> redirect(int from, int to) {
        int newSource = source == from ? to : source;
        int newTarget = target == from ? to : target;
        return new Transition<>(newSource, label, newTarget);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Transition)) {
            return false;
        }
        Transition<?> that = (Transition<?>) o;
        return source == that.source && target == that.target && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, label, target);
    }

    @Override
    public String toString() {
        return "(" + source + " -" + label + "-> " + target + ")";
    }
}
