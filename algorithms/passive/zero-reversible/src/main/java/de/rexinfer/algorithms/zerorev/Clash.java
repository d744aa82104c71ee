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

/**
 * A violation of (reverse) determinism: two distinct states that reach (respectively are reached from) the same pivot
 * state via transitions with the same label.
 *
 * @param <L>
 *         label type
 */
public final class Clash<L> {

    public enum Direction {
        /** The pivot has two outgoing transitions with the same label. */
        FORWARD,
        /** The pivot has two incoming transitions with the same label. */
        BACKWARD
    }

    private final Direction direction;
    private final int pivot;
    private final L label;
    private final int first;
    private final int second;

    Clash(Direction direction, int pivot, L label, int first, int second) {
        this.direction = direction;
        this.pivot = pivot;
        this.label = label;
        this.first = first;
        this.second = second;
    }

    public Direction getDirection() {
        return direction;
    }

    public int getPivot() {
        return pivot;
    }

    public L getLabel() {
        return label;
    }

    /**
     * @return the first of the two states that have to be merged
     */
    public int getFirst() {
        return first;
    }

    /**
     * @return the second of the two states that have to be merged
     */
    public int getSecond() {
        return second;
    }

    @Override
    public String toString() {
        return direction + " clash at " + pivot + " on '" + label + "': " + first + ", " + second;
    }
}
