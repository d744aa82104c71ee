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

import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link Uniformizer#uniformize(de.rexinfer.datastructure.graph.TransitionGraph)}.
 */
public final class UniformizationReport {

    private final int source;
    private final int sink;
    private final boolean sourceAdded;
    private final boolean sinkAdded;
    private final List<Integer> prunedStates;

    UniformizationReport(int source, int sink, boolean sourceAdded, boolean sinkAdded, List<Integer> prunedStates) {
        this.source = source;
        this.sink = sink;
        this.sourceAdded = sourceAdded;
        this.sinkAdded = sinkAdded;
        this.prunedStates = Collections.unmodifiableList(prunedStates);
    }

    public int getSource() {
        return source;
    }

    public int getSink() {
        return sink;
    }

    public boolean isSourceAdded() {
        return sourceAdded;
    }

    public boolean isSinkAdded() {
        return sinkAdded;
    }

    /**
     * @return the states that were removed because they are not reachable from the source or cannot reach the sink
     */
    public List<Integer> getPrunedStates() {
        return prunedStates;
    }

    @Override
    public String toString() {
        return "source=" + source + (sourceAdded ? " (added)" : "") + ", sink=" + sink + (sinkAdded ? " (added)" : "") +
               ", pruned=" + prunedStates;
    }
}
