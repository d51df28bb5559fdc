package max.chronochess.engine.evolution;

import max.chronochess.engine.common.Square;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Square to {@link PieceEvolutionState} map. Entries belong to the piece on the square and have to
 * be moved along with it.
 */
public final class EvolutionOverlay {
    private final TreeMap<Square, PieceEvolutionState> states = new TreeMap<>();

    public PieceEvolutionState get(Square square) {
        return states.get(square);
    }

    public void put(Square square, PieceEvolutionState state) {
        states.put(square, state);
    }

    public PieceEvolutionState remove(Square square) {
        return states.remove(square);
    }

    public boolean contains(Square square) {
        return states.containsKey(square);
    }

    /**
     * Moves the entry at {@code from} to {@code to}, dropping whatever was at {@code to} first.
     *
     * @return the migrated state, or null when {@code from} had none
     */
    public PieceEvolutionState migrate(Square from, Square to) {
        states.remove(to);
        PieceEvolutionState state = states.remove(from);
        if(state != null) {
            states.put(to, state);
        }
        return state;
    }

    public Set<Square> squares() {
        return Collections.unmodifiableSet(states.keySet());
    }

    public Map<Square, PieceEvolutionState> entries() {
        return Collections.unmodifiableMap(states);
    }

    public void clear() {
        states.clear();
    }

    public int size() {
        return states.size();
    }

    /** Deep copy of every entry. */
    public Map<Square, PieceEvolutionState> snapshot() {
        Map<Square, PieceEvolutionState> snapshot = new TreeMap<>();
        states.forEach((square, state) -> snapshot.put(square, state.copy()));
        return snapshot;
    }

    public void restore(Map<Square, PieceEvolutionState> snapshot) {
        states.clear();
        snapshot.forEach((square, state) -> states.put(square, state.copy()));
    }
}
