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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import com.google.common.base.Preconditions;
import de.rexinfer.exception.DuplicateTransitionException;
import de.rexinfer.exception.StateHasTransitionsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A mutable, labelled transition graph with a single initial state and a set of accepting states.
 * <p>
 * States are identified by small integers, assigned in creation order. The graph supports destructive rewriting:
 * states can be {@link #merge(int, int) merged} (all transitions of the eliminated state are redirected to the
 * surviving one) and {@link #removeState(int) removed}. Ids of merged-away states remain resolvable via {@link
 * #representative(int)}, so a stale id held by a caller always leads to the state that absorbed it.
 * <p>
 * The graph does not enforce determinism. Parallel transitions with different labels and transitions sharing a label
 * are allowed, only exact duplicates of a (source, label, target) triple are rejected. Iteration orders are insertion
 * orders, hence deterministic.
 *
 * @param <L>
 *         label type
 */
public class TransitionGraph<L> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransitionGraph.class);

    private static final int NO_STATE = -1;

    private final List<StateRecord<L>> states;
    private final List<Integer> representatives;
    private final Set<Transition<L>> transitions;
    private int initialState = NO_STATE;
    private int numStates;

    public TransitionGraph() {
        this.states = new ArrayList<>();
        this.representatives = new ArrayList<>();
        this.transitions = new LinkedHashSet<>();
    }

    public int addState(boolean accepting) {
        final int id = states.size();
        final StateRecord<L> rec = new StateRecord<>();
        rec.accepting = accepting;
        states.add(rec);
        representatives.add(id);
        numStates++;
        return id;
    }

    public int addInitialState(boolean accepting) {
        final int id = addState(accepting);
        setInitialState(id);
        return id;
    }

    /**
     * Adds the transition {@code (from, label, to)}.
     *
     * @return the added transition
     *
     * @throws DuplicateTransitionException
     *         if the exact same transition is already present
     */
    public Transition<L> addTransition(int from, L label, int to) {
        final StateRecord<L> src = record(from);
        final StateRecord<L> tgt = record(to);
        final Transition<L> t = new Transition<>(from, label, to);

        if (!transitions.add(t)) {
            throw new DuplicateTransitionException("Transition " + t + " already exists");
        }
        src.outgoing.add(t);
        tgt.incoming.add(t);
        return t;
    }

    public boolean removeTransition(Transition<L> t) {
        if (!transitions.remove(t)) {
            return false;
        }
        states.get(t.getSource()).outgoing.remove(t);
        states.get(t.getTarget()).incoming.remove(t);
        return true;
    }

    /**
     * Removes a state that has no incident transitions left.
     *
     * @throws StateHasTransitionsException
     *         if the state still has incoming or outgoing transitions
     */
    public void removeState(int state) {
        final StateRecord<L> rec = record(state);
        if (!rec.incoming.isEmpty() || !rec.outgoing.isEmpty()) {
            throw new StateHasTransitionsException("State " + state + " still has " + rec.incoming.size() +
                                                   " incoming and " + rec.outgoing.size() + " outgoing transitions");
        }
        states.set(state, null);
        numStates--;
        if (initialState == state) {
            initialState = NO_STATE;
        }
    }

    /**
     * Unifies two states. The state with the smaller id survives and becomes accepting if either state was accepting,
     * and initial if either state was initial. Every transition referring to the other state is redirected to the
     * survivor; transitions that become identical by this redirection collapse into one.
     * <p>
     * Ids that were merged before are resolved to their representatives first, hence merging two already merged ids
     * is a no-op.
     *
     * @return the id of the surviving state
     */
    public int merge(int a, int b) {
        final int ra = representative(a);
        final int rb = representative(b);
        if (ra == rb) {
            return ra;
        }

        final int survivor = Math.min(ra, rb);
        final int victim = Math.max(ra, rb);
        final StateRecord<L> survivorRec = record(survivor);
        final StateRecord<L> victimRec = record(victim);

        LOGGER.debug("Merging state {} into state {}", victim, survivor);

        survivorRec.accepting |= victimRec.accepting;
        if (initialState == victim) {
            initialState = survivor;
        }

        final Set<Transition<L>> incident = new LinkedHashSet<>(victimRec.outgoing);
        incident.addAll(victimRec.incoming);

        for (Transition<L> t : incident) {
            removeTransition(t);
        }
        for (Transition<L> t : incident) {
            final Transition<L> redirected = t.redirect(victim, survivor);
            if (transitions.add(redirected)) {
                states.get(redirected.getSource()).outgoing.add(redirected);
                states.get(redirected.getTarget()).incoming.add(redirected);
            }
        }

        states.set(victim, null);
        representatives.set(victim, survivor);
        numStates--;

        return survivor;
    }

    /**
     * Resolves a state id through all merges it took part in.
     */
    public int representative(int state) {
        Preconditions.checkElementIndex(state, representatives.size(), "state");
        int rep = state;
        while (representatives.get(rep) != rep) {
            rep = representatives.get(rep);
        }
        // path compression
        int curr = state;
        while (curr != rep) {
            final int next = representatives.get(curr);
            representatives.set(curr, rep);
            curr = next;
        }
        return rep;
    }

    public boolean containsState(int state) {
        return state >= 0 && state < states.size() && states.get(state) != null;
    }

    public int getInitialState() {
        Preconditions.checkState(initialState != NO_STATE, "No initial state");
        return initialState;
    }

    public void setInitialState(int state) {
        record(state);
        this.initialState = state;
    }

    public boolean isAccepting(int state) {
        return record(state).accepting;
    }

    public void setAccepting(int state, boolean accepting) {
        record(state).accepting = accepting;
    }

    /**
     * @return the ids of all present states, in ascending order
     */
    public List<Integer> getStates() {
        final List<Integer> result = new ArrayList<>(numStates);
        for (int i = 0; i < states.size(); i++) {
            if (states.get(i) != null) {
                result.add(i);
            }
        }
        return result;
    }

    public List<Integer> getAcceptingStates() {
        final List<Integer> result = new ArrayList<>();
        for (int i = 0; i < states.size(); i++) {
            final StateRecord<L> rec = states.get(i);
            if (rec != null && rec.accepting) {
                result.add(i);
            }
        }
        return result;
    }

    public int size() {
        return numStates;
    }

    public List<Transition<L>> getTransitions() {
        return Collections.unmodifiableList(new ArrayList<>(transitions));
    }

    public int getNumTransitions() {
        return transitions.size();
    }

    /**
     * @return a copy of the outgoing transitions of {@code state} (self-loops included), in insertion order
     */
    public List<Transition<L>> outgoing(int state) {
        return new ArrayList<>(record(state).outgoing);
    }

    /**
     * @return a copy of the incoming transitions of {@code state} (self-loops included), in insertion order
     */
    public List<Transition<L>> incoming(int state) {
        return new ArrayList<>(record(state).incoming);
    }

    public List<Transition<L>> transitionsBetween(int source, int target) {
        record(target);
        final List<Transition<L>> result = new ArrayList<>();
        for (Transition<L> t : record(source).outgoing) {
            if (t.getTarget() == target) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * Creates a copy of this graph with identical state ids, in which every label has been replaced by its image
     * under {@code mapping}. Transitions whose images coincide are only added once.
     */
    public <M> TransitionGraph<M> relabel(Function<? super L, ? extends M> mapping) {
        final TransitionGraph<M> result = new TransitionGraph<>();

        for (int i = 0; i < states.size(); i++) {
            final StateRecord<L> rec = states.get(i);
            if (rec == null) {
                result.states.add(null);
            } else {
                final StateRecord<M> copy = new StateRecord<>();
                copy.accepting = rec.accepting;
                result.states.add(copy);
            }
            result.representatives.add(representatives.get(i));
        }
        result.numStates = numStates;
        result.initialState = initialState;

        for (Transition<L> t : transitions) {
            final Transition<M> mapped = new Transition<>(t.getSource(), mapping.apply(t.getLabel()), t.getTarget());
            if (result.transitions.add(mapped)) {
                result.states.get(mapped.getSource()).outgoing.add(mapped);
                result.states.get(mapped.getTarget()).incoming.add(mapped);
            }
        }

        return result;
    }

    /**
     * Creates a read-only snapshot of the current structure. Later modifications of this graph do not affect the
     * snapshot.
     */
    public GraphSnapshot<L> snapshot() {
        return new GraphSnapshot<>(getStates(), initialState, getAcceptingStates(), getTransitions());
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }

    private StateRecord<L> record(int state) {
        Preconditions.checkArgument(containsState(state), "Unknown state %s", state);
        return states.get(state);
    }

    private static final class StateRecord<L> {

        boolean accepting;
        final Set<Transition<L>> outgoing = new LinkedHashSet<>();
        final Set<Transition<L>> incoming = new LinkedHashSet<>();
    }
}
