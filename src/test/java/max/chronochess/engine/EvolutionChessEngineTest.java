package max.chronochess.engine;

import max.chronochess.engine.ability.AbilityResult;
import max.chronochess.engine.ability.ActivityProvider;
import max.chronochess.engine.ability.CooldownStatus;
import max.chronochess.engine.ability.TriggerPolicy;
import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.evolution.AbilityIds;
import max.chronochess.engine.evolution.AbilityInstance;
import max.chronochess.engine.evolution.EvolutionData;
import max.chronochess.engine.evolution.PieceEvolutionState;
import max.chronochess.engine.evolution.Synergy;
import max.chronochess.engine.evolution.UpgradeSource;
import max.chronochess.engine.evolution.UpgradeState;
import max.chronochess.engine.game.StandardRulesOracle;
import max.chronochess.engine.movegen.Move;
import max.chronochess.engine.rules.CustomRule;
import max.chronochess.engine.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class EvolutionChessEngineTest {
    private static final long NOW = 1_000_000L;

    private static EvolutionChessEngine newEngine() {
        return new EvolutionChessEngine(EngineConfig.builder().clock(() -> NOW).build());
    }

    private static EvolutionChessEngine newEngine(String fen) {
        EvolutionChessEngine engine = newEngine();
        assertTrue(engine.loadFromFen(fen));
        return engine;
    }

    private static void evolve(EvolutionChessEngine engine, String square, String... abilityIds) {
        List<AbilityInstance> abilities = Arrays.stream(abilityIds)
                .map(id -> engine.getAbilityCatalog().createAbility(id))
                .collect(Collectors.toList());
        assertTrue(engine.applyEvolutionEffects(sq(square), new EvolutionData(2, abilities, Map.of())));
    }

    private static Square sq(String text) {
        return Square.parse(text);
    }

    private static Set<String> targets(List<Move> moves) {
        return moves.stream().map(move -> move.to().toString()).collect(Collectors.toSet());
    }

    private static Move moveTo(List<Move> moves, String to) {
        return moves.stream().filter(move -> move.to() == sq(to)).findFirst().orElse(null);
    }

    @Test
    public void standardMoveShouldBePlayedWithSanAndPassTheTurn() {
        // Given
        EvolutionChessEngine engine = newEngine();

        // When
        MoveResult result = engine.makeMove("e2", "e4");

        // Then
        assertTrue(result.success());
        assertEquals("e4", result.move().san());
        assertEquals(Color.BLACK, engine.getGameState().turn());
        assertEquals(1, engine.getPlyCount());
        assertEquals(1, engine.getMoveHistory().size());
        assertTrue(engine.getCurrentFen().startsWith("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq"));
    }

    @Test
    public void startingPositionShouldOffer20Moves() {
        // Given
        EvolutionChessEngine engine = newEngine();

        // When
        List<Move> moves = engine.getLegalMoves();

        // Then
        assertEquals(20, moves.size());
        assertTrue(moves.stream().noneMatch(Move::isEnhanced));
    }

    @Test
    public void knightDashShouldTagBaseMovesAndAddExtendedJumps() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/7p/8/8/8/8/7P/1N2K3 w - - 0 1");
        evolve(engine, "b1", AbilityIds.KNIGHT_DASH);

        // When
        List<Move> moves = engine.getLegalMoves(sq("b1"));

        // Then
        assertEquals(Set.of("a3", "c3", "d2", "e2", "c4", "a4", "e3", "d4", "f2", "c5", "a5"), targets(moves));
        assertTrue(moves.stream().allMatch(move -> AbilityIds.KNIGHT_DASH.equals(move.enhancedBy())));
        assertTrue(engine.isEnhancedMoveLegal(sq("b1"), sq("c5")));
        assertFalse(engine.isEnhancedMoveLegal(sq("b1"), sq("h8")));
    }

    @Test
    public void knightDashShouldOpenAWindowForOneFollowUpMove() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/7p/8/8/8/8/7P/1N2K3 w - - 0 1");
        evolve(engine, "b1", AbilityIds.KNIGHT_DASH);

        // When
        MoveResult dash = engine.makeMove("b1", "e3");

        // Then
        assertTrue(dash.success());
        assertEquals(sq("e3"), engine.getDashSquare());
        assertEquals(1, engine.getPlyCount());
        assertEquals(Color.BLACK, engine.getGameState().turn());
        assertTrue(dash.move().abilities().stream().anyMatch(r -> r.abilityId().equals(AbilityIds.KNIGHT_DASH) && r.success()));
        List<Move> followUps = engine.getLegalMoves(sq("e3"));
        assertFalse(followUps.isEmpty());
        assertNotNull(moveTo(followUps, "g4"));

        // When
        MoveResult followUp = engine.makeMove("e3", "g4");

        // Then
        assertTrue(followUp.success());
        assertNull(engine.getDashSquare());
        assertEquals(1, engine.getPlyCount());
        assertEquals(Color.BLACK, engine.getGameState().turn());
        assertNotNull(engine.getPieceEvolutionData(sq("g4")));
        assertTrue(engine.makeMove("e8", "d8").success());
        assertEquals(2, engine.getPlyCount());
    }

    @Test
    public void anyAcceptedMoveShouldCloseTheDashWindow() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/7p/8/8/8/8/7P/1N2K3 w - - 0 1");
        evolve(engine, "b1", AbilityIds.KNIGHT_DASH);
        assertTrue(engine.makeMove("b1", "e3").success());

        // When
        MoveResult blackMove = engine.makeMove("h7", "h6");

        // Then
        assertTrue(blackMove.success());
        assertNull(engine.getDashSquare());
        assertEquals(Color.WHITE, engine.getGameState().turn());
        // Dash still cooling down, only plain knight jumps remain
        assertEquals(Set.of("c2", "c4", "d1", "d5", "f1", "f5", "g2", "g4"), targets(engine.getLegalMoves(sq("e3"))));
    }

    @Test
    public void enhancedMarchShouldBeTaggedUntilItsSingleUseIsSpent() {
        // Given
        EvolutionChessEngine engine = new EvolutionChessEngine(EngineConfig.builder()
                .clock(() -> NOW)
                .enhancedMarchMaxUses(1)
                .enhancedMarchCooldownPlies(4)
                .build());
        assertTrue(engine.loadFromFen("4k3/8/8/8/8/8/4P3/4K3 w - - 0 1"));
        evolve(engine, "e2", AbilityIds.ENHANCED_MARCH);
        Move e4 = moveTo(engine.getLegalMoves(sq("e2")), "e4");
        assertEquals(AbilityIds.ENHANCED_MARCH, e4.enhancedBy());

        // When
        AbilityResult triggered = engine.triggerAbility(sq("e2"), AbilityIds.ENHANCED_MARCH);

        // Then
        assertTrue(triggered.success());
        List<Move> moves = engine.getLegalMoves(sq("e2"));
        assertEquals(Set.of("e3", "e4"), targets(moves));
        assertNull(moveTo(moves, "e4").enhancedBy());
        CooldownStatus status = engine.getAbilityCooldowns(sq("e2")).get(AbilityIds.ENHANCED_MARCH);
        assertEquals(0, status.usesLeft());
        assertFalse(status.isReady());
        assertFalse(engine.triggerAbility(sq("e2"), AbilityIds.ENHANCED_MARCH).success());
    }

    @Test
    public void enhancedMarchShouldMoveTwoSquaresOffTheStartRankAndCoolDown() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/8/8/8/8/4P3/8/4K3 w - - 0 1");
        evolve(engine, "e3", AbilityIds.ENHANCED_MARCH);
        assertEquals(Set.of("e4", "e5"), targets(engine.getLegalMoves(sq("e3"))));

        // When
        MoveResult result = engine.makeMove("e3", "e5");

        // Then
        assertTrue(result.success());
        assertEquals(AbilityIds.ENHANCED_MARCH, result.move().enhancedBy());
        assertEquals("4k3/8/8/4P3/8/8/8/4K3 b - - 0 1", engine.getCurrentFen());
        assertNull(engine.getPieceEvolutionData(sq("e3")));
        assertNotNull(engine.getPieceEvolutionData(sq("e5")));
        assertTrue(result.move().abilities().stream().anyMatch(r -> r.abilityId().equals(AbilityIds.ENHANCED_MARCH)));

        // When
        assertTrue(engine.makeMove("e8", "d8").success());

        // Then
        List<Move> moves = engine.getLegalMoves(sq("e5"));
        assertEquals(Set.of("e6"), targets(moves));
        assertFalse(moves.get(0).isEnhanced());
        assertEquals(3, engine.getAbilityCooldowns(sq("e5")).get(AbilityIds.ENHANCED_MARCH).remainingPlies());
    }

    @Test
    public void standardDoublePushTaggedByMarchShouldSpendTheMarch() {
        // Given
        EvolutionChessEngine engine = new EvolutionChessEngine(EngineConfig.builder()
                .clock(() -> NOW)
                .enhancedMarchMaxUses(1)
                .enhancedMarchCooldownPlies(4)
                .build());
        assertTrue(engine.loadFromFen("4k3/8/8/8/8/8/P7/7K w - - 0 1"));
        evolve(engine, "a2", AbilityIds.ENHANCED_MARCH);
        assertEquals(AbilityIds.ENHANCED_MARCH, moveTo(engine.getLegalMoves(sq("a2")), "a4").enhancedBy());

        // When
        MoveResult push = engine.makeMove("a2", "a4");

        // Then
        assertTrue(push.success());
        assertEquals(AbilityIds.ENHANCED_MARCH, push.move().enhancedBy());
        assertTrue(push.move().abilities().stream().anyMatch(r -> r.abilityId().equals(AbilityIds.ENHANCED_MARCH)));
        CooldownStatus status = engine.getAbilityCooldowns(sq("a4")).get(AbilityIds.ENHANCED_MARCH);
        assertEquals(0, status.usesLeft());
        assertFalse(status.isReady());

        // When
        assertTrue(engine.makeMove("e8", "d8").success());
        MoveResult step = engine.makeMove("a4", "a5");
        assertTrue(engine.makeMove("d8", "e8").success());

        // Then
        assertTrue(step.success());
        assertNull(step.move().enhancedBy());
        assertTrue(step.move().abilities().isEmpty());
        List<Move> moves = engine.getLegalMoves(sq("a5"));
        assertEquals(Set.of("a6"), targets(moves));
        assertFalse(moves.get(0).isEnhanced());
    }

    @Test
    public void marchWithoutUsesShouldLeaveStandardPushesUntagged() {
        // Given
        EvolutionChessEngine engine = new EvolutionChessEngine(EngineConfig.builder()
                .clock(() -> NOW)
                .enhancedMarchMaxUses(0)
                .build());
        assertTrue(engine.loadFromFen("4k3/8/8/8/8/8/4P3/4K3 w - - 0 1"));
        evolve(engine, "e2", AbilityIds.ENHANCED_MARCH);

        // When
        List<Move> moves = engine.getLegalMoves(sq("e2"));

        // Then
        assertEquals(Set.of("e3", "e4"), targets(moves));
        assertTrue(moves.stream().noneMatch(Move::isEnhanced));
        assertEquals(0, engine.getAbilityCooldowns(sq("e2")).get(AbilityIds.ENHANCED_MARCH).usesLeft());
        assertFalse(engine.triggerAbility(sq("e2"), AbilityIds.ENHANCED_MARCH).success());
    }

    @Test
    public void teleportShouldNotOfferAPawnItsOwnBackRank() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/8/8/8/8/8/P7/7K w - - 0 1");
        evolve(engine, "a2", AbilityIds.TELEPORT);
        assertTrue(engine.triggerAbility(sq("a2"), AbilityIds.TELEPORT).success());
        String fen = engine.getCurrentFen();

        // When
        List<Move> moves = engine.getLegalMoves(sq("a2"));
        MoveResult result = engine.makeMove("a2", "b1");

        // Then
        assertTrue(targets(moves).contains("d5"));
        assertTrue(moves.stream().noneMatch(move -> move.to().rank == 0));
        assertFalse(engine.isEnhancedMoveLegal(sq("a2"), sq("b1")));
        assertFalse(result.success());
        assertEquals(MoveError.ILLEGAL_MOVE, result.error());
        assertEquals(fen, engine.getCurrentFen());
        assertTrue(engine.makeMove("a2", "d5").success());
    }

    @Test
    public void positionsReachedThroughAbilityMovesShouldCountTowardRepetition() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/8/8/8/8/4P3/8/4K3 w - - 0 1");
        evolve(engine, "e3", AbilityIds.DIAGONAL_MOVE);

        // When
        for(int round = 0; round < 2; round++) {
            assertFalse(engine.getGameState().isGameOver());
            assertTrue(engine.makeMove("e3", "d4").success());
            assertTrue(engine.makeMove("e8", "d8").success());
            assertTrue(engine.makeMove("d4", "e3").success());
            assertTrue(engine.makeMove("d8", "e8").success());
        }

        // Then
        GameState state = engine.getGameState();
        assertTrue(state.isDraw());
        assertTrue(state.isGameOver());
        assertEquals(MoveError.GAME_OVER, engine.makeMove("e3", "e4").error());
    }

    @Test
    public void spentAbilityPatternShouldBeReportedAsUnavailable() {
        // Given
        EvolutionChessEngine engine = new EvolutionChessEngine(EngineConfig.builder()
                .clock(() -> NOW)
                .enhancedMarchMaxUses(1)
                .build());
        assertTrue(engine.loadFromFen("4k3/8/8/8/8/4P3/8/4K3 w - - 0 1"));
        evolve(engine, "e3", AbilityIds.ENHANCED_MARCH);
        assertTrue(engine.triggerAbility(sq("e3"), AbilityIds.ENHANCED_MARCH).success());
        String fen = engine.getCurrentFen();

        // When
        MoveResult result = engine.makeMove("e3", "e5");

        // Then
        assertFalse(result.success());
        assertEquals(MoveError.ABILITY_UNAVAILABLE, result.error());
        assertEquals(fen, engine.getCurrentFen());
    }

    @Test
    public void movesOntoAKingShouldNeverBeOfferedNorAccepted() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/4p3/8/8/8/8/8/4RK2 w - - 0 1");
        evolve(engine, "e1", AbilityIds.ROOK_ENTRENCH);
        assertEquals(1, engine.checkStationaryTriggers(square -> 3).size());
        String fen = engine.getCurrentFen();

        // When
        List<Move> moves = engine.getLegalMoves(sq("e1"));
        MoveResult result = engine.makeMove("e1", "e8");

        // Then
        assertTrue(targets(moves).contains("e7"));
        assertFalse(targets(moves).contains("e8"));
        assertFalse(result.success());
        assertEquals(MoveError.TARGETS_KING, result.error());
        assertEquals(fen, engine.getCurrentFen());
    }

    @Test
    public void rookStandingStillForThreeRoundsShouldEntrench() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/8/8/8/8/8/8/R3K3 w - - 0 1");
        evolve(engine, "a1", AbilityIds.ROOK_ENTRENCH);

        // When
        List<AbilityResult> results = engine.checkStationaryTriggers(square -> 3);

        // Then
        assertEquals(1, results.size());
        assertTrue(results.get(0).success());
        PieceEvolutionState rook = engine.getPieceEvolutionData(sq("a1"));
        assertTrue(rook.isEntrenched);
        assertEquals(2.5, rook.defensiveBonus, 1e-9);
        List<Move> moves = engine.getLegalMoves(sq("a1"));
        assertTrue(targets(moves).containsAll(Set.of("a8", "d1", "f1", "h1")));
        assertEquals(AbilityIds.ROOK_ENTRENCH, moveTo(moves, "h1").enhancedBy());
        // Already entrenched rooks do not fire again
        assertTrue(engine.checkStationaryTriggers(square -> 10).isEmpty());
    }

    @Test
    public void stationaryTrackerShouldCountFullRounds() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/8/8/8/8/8/8/R3K3 w - - 0 1");
        evolve(engine, "a1", AbilityIds.ROOK_ENTRENCH);
        String[] moves = {"e1d1", "e8d8", "d1e1", "d8e8"};
        for(String move : moves) {
            assertTrue(engine.makeMoveFromNotation(move).success());
        }
        assertEquals(2, engine.getStationaryTracker().turnsStationary(sq("a1")));
        assertTrue(engine.checkStationaryTriggers().isEmpty());

        // When
        assertTrue(engine.makeMoveFromNotation("e1d1").success());
        assertTrue(engine.makeMoveFromNotation("e8d8").success());

        // Then
        assertEquals(3, engine.getStationaryTracker().turnsStationary(sq("a1")));
        List<AbilityResult> results = engine.checkStationaryTriggers();
        assertEquals(1, results.size());
        assertEquals(AbilityIds.ROOK_ENTRENCH, results.get(0).abilityId());
    }

    @Test
    public void entrenchmentShouldEndWhenTheRookMoves() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/8/8/8/8/8/8/R3K3 w - - 0 1");
        evolve(engine, "a1", AbilityIds.ROOK_ENTRENCH);
        engine.checkStationaryTriggers(square -> 3);

        // When
        assertTrue(engine.makeMove("a1", "a5").success());

        // Then
        PieceEvolutionState rook = engine.getPieceEvolutionData(sq("a5"));
        assertFalse(rook.isEntrenched);
        assertEquals(2.5, rook.defensiveBonus, 1e-9);
        assertTrue(rook.cachedModifiedMoves.isEmpty());
    }

    @Test
    public void invalidFenShouldBeRejectedWithoutChangingAnything() {
        // Given
        EvolutionChessEngine engine = newEngine();
        evolve(engine, "b1", AbilityIds.KNIGHT_DASH);
        String fen = engine.getCurrentFen();

        // When
        boolean loaded = engine.loadFromFen("not-a-fen");

        // Then
        assertFalse(loaded);
        assertEquals(fen, engine.getCurrentFen());
        assertNotNull(engine.getPieceEvolutionData(sq("b1")));
        assertEquals(20 + 6, engine.getLegalMoves().size());
    }

    @Test
    public void reloadingShouldKeepEntriesOfUnchangedPiecesOnly() {
        // Given
        EvolutionChessEngine engine = newEngine();
        evolve(engine, "b1", AbilityIds.KNIGHT_DASH);
        evolve(engine, "e2", AbilityIds.ENHANCED_MARCH);

        // When
        assertTrue(engine.loadFromFen("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq - 0 1"));

        // Then
        assertNotNull(engine.getPieceEvolutionData(sq("b1")));
        assertNull(engine.getPieceEvolutionData(sq("e2")));
        assertNull(engine.getPieceEvolutionData(sq("e4")));
        assertEquals(Set.of(sq("b1")), engine.getEvolutionSnapshot().keySet());
    }

    @Test
    public void fenRoundTripShouldPreserveEvolutions() {
        // Given
        EvolutionChessEngine engine = newEngine();
        evolve(engine, "b1", AbilityIds.KNIGHT_DASH);
        Map<Square, PieceEvolutionState> before = engine.getEvolutionSnapshot();

        // When
        assertTrue(engine.loadFromFen(engine.getCurrentFen()));

        // Then
        assertEquals(FENUtils.STANDARD_GAME, engine.getCurrentFen());
        assertEquals(before, engine.getEvolutionSnapshot());
    }

    @Test
    public void capturedPieceShouldLoseItsEvolution() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/8/8/3p4/4P3/8/8/4K3 w - - 0 1");
        evolve(engine, "d5", AbilityIds.BREAKTHROUGH);

        // When
        MoveResult result = engine.makeMove("e4", "d5");

        // Then
        assertTrue(result.success());
        assertTrue(result.move().isCapture());
        assertNull(engine.getPieceEvolutionData(sq("d5")));
        assertTrue(engine.getEvolutionSnapshot().isEmpty());
    }

    @Test
    public void queenDominanceShouldRestrictNearbyEnemiesForOnePly() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/8/8/8/3r4/8/8/3QK3 w - - 0 1");
        evolve(engine, "d1", AbilityIds.QUEEN_DOMINANCE);

        // When
        MoveResult result = engine.makeMove("d1", "d2");

        // Then
        assertTrue(result.success());
        PieceEvolutionState rook = engine.getPieceEvolutionData(sq("d4"));
        assertNotNull(rook);
        assertTrue(rook.isDominated);
        assertTrue(rook.isMoveRestricted);
        assertEquals(2, rook.restrictionExpiresAtPly);
        List<Move> restricted = engine.getLegalMoves(sq("d4"));
        assertEquals(6, restricted.size());
        assertTrue(restricted.stream().allMatch(move -> Move.MODIFIED_TAG.equals(move.enhancedBy())));
        assertTrue(targets(restricted).stream().allMatch(to -> rook.cachedModifiedMoves.contains(sq(to))));

        // When
        assertTrue(engine.makeMove("e8", "f8").success());

        // Then
        PieceEvolutionState lifted = engine.getPieceEvolutionData(sq("d4"));
        assertFalse(lifted.isMoveRestricted);
        assertEquals(PieceEvolutionState.NO_RESTRICTION, lifted.restrictionExpiresAtPly);
        assertEquals(0.6, lifted.dominancePenalty, 1e-9);
    }

    @Test
    public void wrongInputsShouldBeReportedWithTheirError() {
        // Given
        EvolutionChessEngine engine = newEngine();

        // When / Then
        assertEquals(MoveError.INVALID_SQUARE, engine.makeMove("z9", "e4").error());
        assertEquals(MoveError.EMPTY_SOURCE, engine.makeMove("e4", "e5").error());
        assertEquals(MoveError.WRONG_SIDE_TO_MOVE, engine.makeMove("e7", "e5").error());
        assertEquals(MoveError.ILLEGAL_MOVE, engine.makeMove("e2", "e5").error());
        assertEquals(MoveError.INVALID_NOTATION, engine.makeMoveFromNotation("Qh9").error());
        assertEquals(FENUtils.STANDARD_GAME, engine.getCurrentFen());
        assertEquals(0, engine.getPlyCount());
    }

    @Test
    public void pinnedPieceShouldNotExposeItsKing() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/4r3/8/8/8/8/4B3/4K3 w - - 0 1");

        // When
        MoveResult result = engine.makeMove("e2", "d3");

        // Then
        assertEquals(MoveError.LEAVES_KING_IN_CHECK, result.error());
        assertTrue(engine.getLegalMoves(sq("e2")).isEmpty());
    }

    @Test
    public void finishedGameShouldRefuseMoves() {
        // Given
        // Fool's mate
        EvolutionChessEngine engine = newEngine("rnb1kbnr/pppp1ppp/8/4p3/6Pq/5P2/PPPPP2P/RNBQKBNR w KQkq - 1 3");

        // When
        GameState state = engine.getGameState();
        MoveResult result = engine.makeMove("e2", "e4");

        // Then
        assertTrue(state.inCheckmate());
        assertTrue(state.isGameOver());
        assertTrue(engine.getLegalMoves().isEmpty());
        assertEquals(MoveError.GAME_OVER, result.error());
    }

    @Test
    public void promotionShouldDefaultToQueen() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/P7/8/8/8/8/8/4K3 w - - 0 1");

        // When
        MoveResult result = engine.makeMove("a7", "a8");

        // Then
        assertTrue(result.success());
        assertEquals(PieceType.QUEEN, result.move().promotion());
        assertEquals(PieceType.QUEEN, engine.getBoard().get(sq("a8")).type());
    }

    @Test
    public void notationShouldAcceptSanAndCoordinates() {
        // Given
        EvolutionChessEngine engine = newEngine();

        // When
        MoveResult first = engine.makeMoveFromNotation("Nf3");
        MoveResult second = engine.makeMoveFromNotation("e7e5");

        // Then
        assertTrue(first.success());
        assertEquals("Nf3", first.move().san());
        assertTrue(second.success());
        assertEquals("e5", second.move().san());
        assertEquals(2, engine.getGameState().moveHistory().size());
    }

    @Test
    public void customRulesShouldRejectMovesByPriority() {
        // Given
        EvolutionChessEngine engine = newEngine();
        engine.addCustomRule(new CustomRule("no-pawns", "No pawn moves", null, 10,
                (move, state) -> move.pieceType() != PieceType.PAWN));
        engine.addCustomRule(new CustomRule("anything", null, null, 1, (move, state) -> true));

        // When
        MoveResult pawnMove = engine.makeMove("e2", "e4");
        MoveResult knightMove = engine.makeMove("g1", "f3");

        // Then
        assertEquals(MoveError.CUSTOM_RULE_VIOLATION, pawnMove.error());
        assertTrue(knightMove.success());
        assertEquals("no-pawns", engine.getCustomRules().get(0).id());
        assertTrue(engine.removeCustomRule("no-pawns"));
        assertFalse(engine.removeCustomRule("no-pawns"));
        assertTrue(engine.makeMove("e7", "e5").success());
    }

    @Test
    public void sameInputsShouldGiveSameMoves() {
        // Given
        EvolutionChessEngine first = newEngine("4k3/7p/8/8/8/4P3/7P/1N2K3 w - - 0 1");
        EvolutionChessEngine second = newEngine("4k3/7p/8/8/8/4P3/7P/1N2K3 w - - 0 1");
        for(EvolutionChessEngine engine : List.of(first, second)) {
            evolve(engine, "b1", AbilityIds.KNIGHT_DASH);
            evolve(engine, "e3", AbilityIds.ENHANCED_MARCH, AbilityIds.BREAKTHROUGH);
        }

        // When / Then
        assertEquals(first.getLegalMoves(), second.getLegalMoves());
        assertEquals(first.makeMove("e3", "f4").move(), second.makeMove("e3", "f4").move());
        assertEquals(first.getCurrentFen(), second.getCurrentFen());
        assertEquals(first.getEvolutionSnapshot(), second.getEvolutionSnapshot());
    }

    @Test
    public void evolutionsShouldOnlyAttachToOccupiedSquares() {
        // Given
        EvolutionChessEngine engine = newEngine();

        // When
        boolean onEmpty = engine.applyEvolutionEffects(sq("e4"), new EvolutionData(3, List.of(), Map.of()));
        boolean mismatched = engine.setPieceEvolution(sq("e2"), new PieceEvolutionState(PieceType.KNIGHT, Color.WHITE));
        boolean matching = engine.setPieceEvolution(sq("e2"), new PieceEvolutionState(PieceType.PAWN, Color.WHITE));

        // Then
        assertFalse(onEmpty);
        assertFalse(mismatched);
        assertTrue(matching);
        assertEquals(Set.of(sq("e2")), engine.getEvolutionSnapshot().keySet());
    }

    @Test
    public void attributesShouldSetMultipliers() {
        // Given
        EvolutionChessEngine engine = newEngine();

        // When
        engine.applyEvolutionEffects(sq("d1"), new EvolutionData(4, List.of(),
                Map.of(EvolutionData.ATTACK_POWER, 1.5, EvolutionData.DEFENSE, 2.0)));

        // Then
        PieceEvolutionState queen = engine.getPieceEvolutionData(sq("d1"));
        assertEquals(4, queen.evolutionLevel);
        assertEquals(1.5, queen.captureBonus, 1e-9);
        assertEquals(2.0, queen.defensiveBonus, 1e-9);
        assertEquals(1.0, queen.allyBonus, 1e-9);
        // Returned states are copies
        queen.captureBonus = 9;
        assertEquals(1.5, engine.getPieceEvolutionData(sq("d1")).captureBonus, 1e-9);
    }

    @Test
    public void resetShouldClearEverything() {
        // Given
        EvolutionChessEngine engine = newEngine();
        evolve(engine, "b1", AbilityIds.KNIGHT_DASH);
        engine.makeMove("e2", "e4");

        // When
        engine.reset();

        // Then
        assertEquals(FENUtils.STANDARD_GAME, engine.getCurrentFen());
        assertEquals(0, engine.getPlyCount());
        assertTrue(engine.getMoveHistory().isEmpty());
        assertTrue(engine.getEvolutionSnapshot().isEmpty());
    }

    @Test
    public void cooldownsShouldBeResettable() {
        // Given
        EvolutionChessEngine engine = newEngine();
        evolve(engine, "b1", AbilityIds.KNIGHT_DASH);
        assertTrue(engine.triggerAbility(sq("b1"), AbilityIds.KNIGHT_DASH).success());
        assertEquals(3.0, engine.getAbilityCooldowns(sq("b1")).get(AbilityIds.KNIGHT_DASH).remainingSeconds(), 1e-9);

        // When
        boolean reset = engine.resetAbilityCooldowns(sq("b1"));

        // Then
        assertTrue(reset);
        assertTrue(engine.getAbilityCooldowns(sq("b1")).get(AbilityIds.KNIGHT_DASH).isReady());
        assertFalse(engine.resetAbilityCooldowns(sq("e4")));
    }

    @Test
    public void backRankMateShouldScoreHigh() {
        // Given
        EvolutionChessEngine engine = newEngine("6k1/5ppp/8/8/8/8/8/R5K1 w - - 0 1");

        // When
        MoveResult result = engine.makeMove("a1", "a8");

        // Then
        assertTrue(result.success());
        assertEquals("Ra8#", result.move().san());
        assertEquals(100, result.move().eleganceScore().intValue());
        assertTrue(engine.getGameState().inCheckmate());
    }

    @Test
    public void autoPromotionShouldNeedLevelAndTime() {
        // Given
        EvolutionChessEngine engine = newEngine();
        engine.applyEvolutionEffects(sq("e2"), new EvolutionData(10, List.of(), Map.of()));
        long halfAnHour = 30 * 60 * 1000L;

        // When / Then
        assertTrue(engine.checkPieceAutoPromotion(sq("e2"), halfAnHour));
        assertFalse(engine.checkPieceAutoPromotion(sq("e2"), halfAnHour - 1));
        assertFalse(engine.checkPieceAutoPromotion(sq("d2"), halfAnHour));
    }

    @Test
    public void syncShouldBuildEvolutionsFromUpgrades() {
        // Given
        UpgradeState pawnUpgrades = UpgradeState.NONE
                .with(UpgradeState.MARCH_SPEED, 2.0)
                .with(UpgradeState.RESILIENCE, 1.0);
        UpgradeSource upgrades = (pieceType, color) ->
                pieceType == PieceType.PAWN && color == Color.WHITE ? pawnUpgrades : UpgradeState.NONE;
        EvolutionChessEngine engine = new EvolutionChessEngine(EngineConfig.builder().clock(() -> NOW).build(),
                new StandardRulesOracle(), ActivityProvider.fromUpgrades(), upgrades, TriggerPolicy.ALWAYS);
        assertTrue(engine.loadFromFen("4k3/8/8/8/8/4P3/8/4K3 w - - 0 1"));

        // When
        int created = engine.syncPieceEvolutionsWithBoard();

        // Then
        assertEquals(3, created);
        assertEquals(0, engine.syncPieceEvolutionsWithBoard());
        PieceEvolutionState pawn = engine.getPieceEvolutionData(sq("e3"));
        assertEquals(3, pawn.evolutionLevel);
        assertTrue(pawn.hasAbility(AbilityIds.ENHANCED_MARCH));
        assertTrue(pawn.hasAbility(AbilityIds.BREAKTHROUGH));
        assertTrue(engine.getPieceEvolutionData(sq("e1")).abilities.isEmpty());
        assertEquals(Set.of("e4", "e5", "d4", "f4"), targets(engine.getLegalMoves(sq("e3"))));
    }

    @Test
    public void synergiesShouldFollowTheOverlay() {
        // Given
        EvolutionChessEngine engine = newEngine("4k3/8/8/8/8/4P3/8/4K3 w - - 0 1");
        engine.applyEvolutionEffects(sq("e3"), new EvolutionData(3, List.of(), Map.of()));
        engine.applyEvolutionEffects(sq("e1"), new EvolutionData(1, List.of(), Map.of()));
        assertTrue(engine.calculateBoardSynergies().isEmpty());

        // When
        engine.applyEvolutionEffects(sq("e1"), new EvolutionData(7, List.of(), Map.of()));
        List<Synergy> synergies = engine.calculateBoardSynergies();

        // Then
        assertEquals(1, synergies.size());
        assertEquals(Color.WHITE, synergies.get(0).color());
        assertEquals(0.1, synergies.get(0).bonus(), 1e-9);
    }
}
