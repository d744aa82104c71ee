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

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import net.automatalib.graphs.Graph;
import net.automatalib.serialization.dot.GraphDOT;
import net.automatalib.visualization.DefaultVisualizationHelper;
import net.automatalib.visualization.VisualizationHelper;

/**
 * Immutable copy of the structure of a {@link TransitionGraph} at a given point in time.
 *
 * @param <L>
 *         label type
 */
public final class GraphSnapshot<L> {

    private final List<Integer> states;
    private final int initialState;
    private final Set<Integer> acceptingStates;
    private final List<Transition<L>> transitions;

    GraphSnapshot(List<Integer> states,
                  int initialState,
                  Collection<Integer> acceptingStates,
                  List<Transition<L>> transitions) {
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
        this.initialState = initialState;
        this.acceptingStates = Collections.unmodifiableSet(new HashSet<>(acceptingStates));
        this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    }

    public List<Integer> getStates() {
        return states;
    }

    public boolean hasInitialState() {
        return initialState >= 0;
    }

    /**
     * @return the initial state, or a negative value if the graph had none
     */
    public int getInitialState() {
        return initialState;
    }

    public Set<Integer> getAcceptingStates() {
        return acceptingStates;
    }

    public boolean isAccepting(int state) {
        return acceptingStates.contains(state);
    }

    public List<Transition<L>> getTransitions() {
        return transitions;
    }

    public int size() {
        return states.size();
    }

    public Graph<Integer, Transition<L>> graphView() {
        return new GraphView();
    }

    public void writeDOT(Appendable a) throws IOException {
        GraphDOT.write(graphView(), a);
    }

    public String toDOT() {
        final StringWriter writer = new StringWriter();
        try {
            writeDOT(writer);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    @Override
    public String toString() {
        return "states=" + states + ", initial=" + initialState + ", accepting=" + acceptingStates + ", transitions=" +
               transitions;
    }

    private class GraphView implements Graph<Integer, Transition<L>> {

        @Override
        public Collection<Integer> getNodes() {
            return states;
        }

        @Override
        public Collection<Transition<L>> getOutgoingEdges(Integer node) {
            final List<Transition<L>> result = new ArrayList<>();
            for (Transition<L> t : transitions) {
                if (t.getSource() == node) {
                    result.add(t);
                }
            }
            return result;
        }

        @Override
        public Integer getTarget(Transition<L> edge) {
            return edge.getTarget();
        }

        @Override
        public VisualizationHelper<Integer, Transition<L>> getVisualizationHelper() {
            return new DefaultVisualizationHelper<Integer, Transition<L>>() {

                @Override
                public boolean getNodeProperties(Integer node, Map<String, String> properties) {
                    super.getNodeProperties(node, properties);
                    properties.put(NodeAttrs.LABEL, "q" + node);
                    properties.put(NodeAttrs.SHAPE,
                                   acceptingStates.contains(node) ? NodeShapes.DOUBLECIRCLE : NodeShapes.CIRCLE);
                    if (node == initialState) {
                        properties.put(NodeAttrs.STYLE, "bold");
                    }
                    return true;
                }

                @Override
                public boolean getEdgeProperties(Integer src,
                                                 Transition<L> edge,
                                                 Integer tgt,
                                                 Map<String, String> properties) {
                    properties.put(EdgeAttrs.LABEL, String.valueOf(edge.getLabel()));
                    return true;
                }
            };
        }
    }
}
