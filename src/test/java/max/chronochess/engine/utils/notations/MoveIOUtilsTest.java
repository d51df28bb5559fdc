package max.chronochess.engine.utils.notations;

import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.game.Game;
import max.chronochess.engine.movegen.Move;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MoveIOUtilsTest {

    private static String sanOf(Game game, String from, String to) {
        List<Move> legalMoves = game.getLegalMoves();
        for(Move move : legalMoves) {
            if(move.from() == Square.parse(from) && move.to() == Square.parse(to)
                    && (move.promotion() == null || move.promotion() == PieceType.QUEEN)) {
                return MoveIOUtils.writeAlgebraicNotation(game, move, legalMoves);
            }
        }
        return null;
    }

    @Test
    public void sanShouldCoverCastlingAndDisambiguation() {
        // Given
        Game game = FENUtils.getBoardFrom("r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1");

        // Then
        assertEquals("O-O", sanOf(game, "e1", "g1"));
        assertEquals("O-O-O", sanOf(game, "e1", "c1"));
        assertEquals("Qxf6", sanOf(game, "f3", "f6"));
        assertEquals("Nxd7", sanOf(game, "e5", "d7"));
        assertEquals("dxe6", sanOf(game, "d5", "e6"));
        assertEquals("Bxa6", sanOf(game, "e2", "a6"));
    }

    @Test
    public void sanShouldMarkChecksMatesAndPromotions() {
        // Given
        Game mate = FENUtils.getBoardFrom("6k1/5ppp/8/8/8/8/8/R5K1 w - - 0 1");
        Game promotion = FENUtils.getBoardFrom("4k3/P7/8/8/8/8/8/4K3 w - - 0 1");

        // Then
        assertEquals("Ra8#", sanOf(mate, "a1", "a8"));
        assertEquals("a8=Q+", sanOf(promotion, "a7", "a8"));
    }

    @Test
    public void sanShouldDisambiguateByFile() {
        // Given
        Game game = FENUtils.getBoardFrom("4k3/8/8/8/8/8/4K3/R6R w - - 0 1");

        // Then
        assertEquals("Rad1", sanOf(game, "a1", "d1"));
        assertEquals("Rhf1", sanOf(game, "h1", "f1"));
    }

    @Test
    public void enhancedNotationShouldSkipDisambiguation() {
        // Given
        Move dash = new Move(Square.parse("b1"), Square.parse("c5"), null, PieceType.KNIGHT, null, null, "n", "knight-dash", null, null);
        Move pawnCapture = new Move(Square.parse("e3"), Square.parse("f4"), null, PieceType.PAWN, PieceType.BISHOP, null, "c", "breakthrough", null, null);

        // Then
        assertEquals("Nc5", MoveIOUtils.writeEnhancedNotation(dash));
        assertEquals("exf4", MoveIOUtils.writeEnhancedNotation(pawnCapture));
    }

    @Test
    public void coordinateNotationShouldParse() {
        // When
        Move move = MoveIOUtils.parseCoordinateNotation("e7e8q");

        // Then
        assertEquals(Square.parse("e7"), move.from());
        assertEquals(Square.parse("e8"), move.to());
        assertEquals(PieceType.QUEEN, move.promotion());
        assertNull(MoveIOUtils.parseCoordinateNotation("e7e8k"));
        assertNull(MoveIOUtils.parseCoordinateNotation("Nf3"));
        assertNull(MoveIOUtils.parseCoordinateNotation("z2e4"));
    }

    @Test
    public void sanShouldNormalize() {
        assertEquals("Nf3", MoveIOUtils.normalizeAlgebraicNotation(" Nf3+ "));
        assertEquals("O-O", MoveIOUtils.normalizeAlgebraicNotation("0-0!"));
        assertEquals("exd6", MoveIOUtils.normalizeAlgebraicNotation("exd6 e.p."));
    }
}
