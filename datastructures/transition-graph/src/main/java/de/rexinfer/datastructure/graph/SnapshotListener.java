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

/**
 * Receives read-only snapshots of a graph after the individual stages of a computation, e.g. for rendering.
 * Implementations must not retain assumptions about the graph beyond the snapshot itself.
 *
 * @param <L>
 *         label type
 */
@FunctionalInterface
public interface SnapshotListener<L> {

    void onSnapshot(String stage, GraphSnapshot<L> snapshot);

    static <L> SnapshotListener<L> ignore() {
        return (stage, snapshot) -> {};
    }
}
