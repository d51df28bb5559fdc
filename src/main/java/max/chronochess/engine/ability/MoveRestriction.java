package max.chronochess.engine.ability;

import max.chronochess.engine.movegen.Move;

import java.util.ArrayList;
import java.util.List;

/**
 * Shrinks the move list of a dominated or decreed piece, keeping mostly non-captures.
 */
public final class MoveRestriction {
    private static final double NON_CAPTURE_SHARE = 0.8;

    private MoveRestriction() {
    }

    /**
     * Keeps {@code max(1, floor(n * share))} moves: up to 80% non-captures and up to 20% captures in
     * generation order, topped up from the leftovers when one kind runs short.
     */
    public static List<Move> restrict(List<Move> legalMoves, double share) {
        if(legalMoves.isEmpty()) {
            return List.of();
        }
        int count = Math.max(1, (int) Math.floor(legalMoves.size() * share));
        int nonCaptureQuota = (int) Math.floor(count * NON_CAPTURE_SHARE);
        int captureQuota = (int) Math.ceil(count * (1 - NON_CAPTURE_SHARE));

        List<Move> kept = new ArrayList<>(count);
        List<Move> leftovers = new ArrayList<>();
        int nonCaptures = 0;
        int captures = 0;
        for(Move move : legalMoves) {
            if(move.isCapture()) {
                if(captures < captureQuota) {
                    kept.add(move);
                    captures++;
                    continue;
                }
            } else if(nonCaptures < nonCaptureQuota) {
                kept.add(move);
                nonCaptures++;
                continue;
            }
            leftovers.add(move);
        }
        leftovers.sort((a, b) -> Boolean.compare(a.isCapture(), b.isCapture()));
        for(Move move : leftovers) {
            if(kept.size() >= count) {
                break;
            }
            kept.add(move);
        }
        if(kept.size() > count) {
            return new ArrayList<>(kept.subList(0, count));
        }
        return kept;
    }
}
