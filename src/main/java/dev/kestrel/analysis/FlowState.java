package dev.kestrel.analysis;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declared-state of every tracked binding at one program point.
 *
 * <p>Bindings without an entry are Initialized: globals seen from a function body, and anything
 * declared outside the function being analyzed. A dead state belongs to a path that ended in a
 * jump or trap and is ignored by {@link #meet}.</p>
 *
 * <p>Alongside the must-state, the set of bindings assigned on at least one path is kept; it is
 * joined by union. An immutable binding may only be assigned while it is outside that set.</p>
 */
final class FlowState {
    private final Map<Symbol, DeclState> states;
    private final Set<Symbol> maybeAssigned;
    private boolean dead;

    private FlowState(Map<Symbol, DeclState> states, Set<Symbol> maybeAssigned, boolean dead) {
        this.states = states;
        this.maybeAssigned = maybeAssigned;
        this.dead = dead;
    }

    static FlowState live() {
        return new FlowState(new HashMap<>(), new HashSet<>(), false);
    }

    FlowState copy() {
        return new FlowState(new HashMap<>(states), new HashSet<>(maybeAssigned), dead);
    }

    DeclState get(Symbol symbol) {
        return states.getOrDefault(symbol, DeclState.INITIALIZED);
    }

    void set(Symbol symbol, DeclState state) {
        states.put(symbol, state);
    }

    /** A fresh declaration without initializer: nothing has been assigned to it yet. */
    void declareUnassigned(Symbol symbol) {
        states.put(symbol, DeclState.UNINITIALIZED);
        maybeAssigned.remove(symbol);
    }

    void assign(Symbol symbol) {
        states.put(symbol, DeclState.INITIALIZED);
        maybeAssigned.add(symbol);
    }

    boolean mayBeAssigned(Symbol symbol) {
        return maybeAssigned.contains(symbol);
    }

    boolean isDead() {
        return dead;
    }

    void markDead() {
        dead = true;
    }

    static FlowState meet(List<FlowState> incoming) {
        FlowState result = null;
        for (FlowState s : incoming) {
            if (s.dead) {
                continue;
            }
            if (result == null) {
                result = s.copy();
                continue;
            }
            Set<Symbol> keys = new HashSet<>(result.states.keySet());
            keys.addAll(s.states.keySet());
            for (Symbol sym : keys) {
                result.states.put(sym, DeclState.meet(result.get(sym), s.get(sym)));
            }
            result.maybeAssigned.addAll(s.maybeAssigned);
        }
        if (result == null) {
            FlowState deadState = incoming.isEmpty() ? live() : incoming.get(0).copy();
            deadState.dead = true;
            return deadState;
        }
        return result;
    }

    boolean sameAs(FlowState other) {
        if (dead != other.dead || !maybeAssigned.equals(other.maybeAssigned)) {
            return false;
        }
        Set<Symbol> keys = new HashSet<>(states.keySet());
        keys.addAll(other.states.keySet());
        for (Symbol sym : keys) {
            if (get(sym) != other.get(sym)) {
                return false;
            }
        }
        return true;
    }
}
