package max.chronochess.engine.evolution;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.game.board.Board;
import max.chronochess.engine.movegen.Move;

import java.util.function.ToIntFunction;

/**
 * Counts, per square, how many full rounds the piece standing there has not moved.
 */
public class StationaryTracker implements ToIntFunction<Square> {
    private final Object2IntOpenHashMap<Square> stationaryRounds = new Object2IntOpenHashMap<>();
    private final ObjectOpenHashSet<Square> movedThisRound = new ObjectOpenHashSet<>();

    public void recordMove(Move move) {
        stationaryRounds.removeInt(move.from());
        stationaryRounds.put(move.to(), 0);
        movedThisRound.remove(move.from());
        movedThisRound.add(move.to());
        if(move.hasFlag(Move.EN_PASSANT)) {
            stationaryRounds.removeInt(Square.of(move.to().file, move.from().rank));
        }
        if(move.isCastling()) {
            int rank = move.from().rank;
            Square rookFrom = Square.of(move.hasFlag(Move.KING_SIDE_CASTLE) ? 7 : 0, rank);
            Square rookTo = Square.of(move.hasFlag(Move.KING_SIDE_CASTLE) ? 5 : 3, rank);
            stationaryRounds.removeInt(rookFrom);
            stationaryRounds.put(rookTo, 0);
            movedThisRound.add(rookTo);
        }
    }

    /** Ends a full round: every piece that did not move gains one. */
    public void completeRound(Board board) {
        for(Square square : board.occupied()) {
            if(!movedThisRound.contains(square)) {
                stationaryRounds.addTo(square, 1);
            }
        }
        // Forget squares that were emptied without a recorded move, e.g. by a reload
        stationaryRounds.keySet().removeIf(board::isEmpty);
        movedThisRound.clear();
    }

    public int turnsStationary(Square square) {
        return stationaryRounds.getInt(square);
    }

    public void setTurnsStationary(Square square, int rounds) {
        stationaryRounds.put(square, rounds);
    }

    public void clear() {
        stationaryRounds.clear();
        movedThisRound.clear();
    }

    @Override
    public int applyAsInt(Square square) {
        return turnsStationary(square);
    }
}
