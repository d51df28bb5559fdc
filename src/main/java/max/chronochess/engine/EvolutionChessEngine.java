package max.chronochess.engine;

import max.chronochess.engine.ability.AbilityEffectExecutor;
import max.chronochess.engine.ability.AbilityLifecycleManager;
import max.chronochess.engine.ability.AbilityResult;
import max.chronochess.engine.ability.ActivityProvider;
import max.chronochess.engine.ability.CooldownStatus;
import max.chronochess.engine.ability.EffectContext;
import max.chronochess.engine.ability.TriggerContext;
import max.chronochess.engine.ability.TriggerPolicy;
import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.elegance.EleganceScorer;
import max.chronochess.engine.evolution.AbilityCatalog;
import max.chronochess.engine.evolution.AbilityCategory;
import max.chronochess.engine.evolution.AbilityIds;
import max.chronochess.engine.evolution.AbilityInstance;
import max.chronochess.engine.evolution.EvolutionData;
import max.chronochess.engine.evolution.EvolutionOverlay;
import max.chronochess.engine.evolution.PieceEvolutionState;
import max.chronochess.engine.evolution.StationaryTracker;
import max.chronochess.engine.evolution.Synergy;
import max.chronochess.engine.evolution.SynergyCalculator;
import max.chronochess.engine.evolution.UpgradeSource;
import max.chronochess.engine.evolution.UpgradeState;
import max.chronochess.engine.game.MoveApplier;
import max.chronochess.engine.game.RulesOracle;
import max.chronochess.engine.game.StandardRulesOracle;
import max.chronochess.engine.game.board.Board;
import max.chronochess.engine.movegen.Move;
import max.chronochess.engine.movegen.MoveGenerator;
import max.chronochess.engine.movegen.enhanced.EnhancedMoveGenerator;
import max.chronochess.engine.movegen.enhanced.StandingOptions;
import max.chronochess.engine.rules.CustomRule;
import max.chronochess.engine.utils.notations.FENUtils;
import max.chronochess.engine.utils.notations.MoveIOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Chess with evolved pieces. Standard rules come from a {@link RulesOracle}; abilities, cooldowns
 * and the per-square evolution overlay are handled here.
 * <p>
 * Not thread safe.
 */
public class EvolutionChessEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(EvolutionChessEngine.class);

    private final EngineConfig config;
    private final RulesOracle oracle;
    private final ActivityProvider activity;
    private final UpgradeSource upgrades;
    private final TriggerPolicy triggerPolicy;

    private final EvolutionOverlay overlay = new EvolutionOverlay();
    private final AbilityLifecycleManager lifecycle = new AbilityLifecycleManager();
    private final AbilityEffectExecutor executor;
    private final AbilityCatalog catalog;
    private final EnhancedMoveGenerator generator;
    private final MoveApplier applier;
    private final StationaryTracker stationaryTracker = new StationaryTracker();

    private final List<CustomRule> customRules = new ArrayList<>();
    private final List<Move> moveHistory = new ArrayList<>();
    private int plyCount;
    private long gameStartedAt;

    public EvolutionChessEngine() {
        this(EngineConfig.defaults());
    }

    public EvolutionChessEngine(EngineConfig config) {
        this(config, new StandardRulesOracle(), ActivityProvider.ALL_ACTIVE, UpgradeSource.NONE, TriggerPolicy.ALWAYS);
    }

    public EvolutionChessEngine(EngineConfig config, RulesOracle oracle, ActivityProvider activity,
                                UpgradeSource upgrades, TriggerPolicy triggerPolicy) {
        this.config = Objects.requireNonNull(config);
        this.oracle = Objects.requireNonNull(oracle);
        this.activity = Objects.requireNonNull(activity);
        this.upgrades = Objects.requireNonNull(upgrades);
        this.triggerPolicy = Objects.requireNonNull(triggerPolicy);
        this.executor = new AbilityEffectExecutor(config);
        this.catalog = new AbilityCatalog(config);
        this.generator = new EnhancedMoveGenerator(oracle, overlay, activity, upgrades, lifecycle, config.clock, () -> plyCount);
        this.applier = new MoveApplier(oracle, overlay, generator);
        this.gameStartedAt = config.clock.getAsLong();
    }

    // Position

    /**
     * Loads a position. Overlay entries survive when the same piece type and color still stands on
     * their square. The ply counter is kept.
     *
     * @return false when the FEN is rejected; nothing changes in that case
     */
    public boolean loadFromFen(String fen) {
        if(!oracle.load(fen)) {
            return false;
        }
        generator.closeDashWindow();
        stationaryTracker.clear();
        pruneOverlay(oracle.board());
        refreshStandingOptions();
        LOGGER.info("Loaded position {}", fen);
        return true;
    }

    /** Back to the initial position with no evolutions, no history and a zero ply counter. */
    public void reset() {
        oracle.load(FENUtils.STANDARD_GAME);
        overlay.clear();
        moveHistory.clear();
        stationaryTracker.clear();
        generator.closeDashWindow();
        plyCount = 0;
        gameStartedAt = config.clock.getAsLong();
    }

    public String getCurrentFen() {
        return oracle.fen();
    }

    public GameState getGameState() {
        return new GameState(oracle.fen(), oracle.turn(), oracle.inCheck(), oracle.isCheckmate(),
                oracle.isStalemate(), oracle.isDraw(), oracle.isGameOver(), plyCount, moveHistory);
    }

    // Moves

    public List<Move> getLegalMoves() {
        if(oracle.isGameOver()) {
            return new ArrayList<>();
        }
        return generator.legalMoves();
    }

    public List<Move> getLegalMoves(Square square) {
        if(square == null || oracle.isGameOver()) {
            return new ArrayList<>();
        }
        return generator.legalMoves(square);
    }

    public boolean isEnhancedMoveLegal(Square from, Square to) {
        for(Move move : getLegalMoves(from)) {
            if(move.to() == to) {
                return true;
            }
        }
        return false;
    }

    public MoveResult makeMove(String from, String to) {
        Square fromSquare = Square.parse(from);
        Square toSquare = Square.parse(to);
        if(fromSquare == null || toSquare == null) {
            return MoveResult.failure(MoveError.INVALID_SQUARE, "Invalid square in " + from + "-" + to);
        }
        return makeMove(fromSquare, toSquare);
    }

    public MoveResult makeMove(Square from, Square to) {
        return makeMove(from, to, null);
    }

    public MoveResult makeMove(Square from, Square to, PieceType promotion) {
        return makeMove(from, to, promotion, triggerPolicy);
    }

    /**
     * Validates and plays a move, then fires the abilities of the moved piece that {@code policy}
     * lets through.
     */
    public MoveResult makeMove(Square from, Square to, PieceType promotion, TriggerPolicy policy) {
        if(from == null || to == null) {
            return MoveResult.failure(MoveError.INVALID_SQUARE, "Missing square");
        }
        Board before = oracle.board();
        int historySize = moveHistory.size();
        boolean previousWasCapture = historySize > 0 && moveHistory.get(historySize - 1).isCapture();
        boolean anyCaptureYet = moveHistory.stream().anyMatch(Move::isCapture);

        MoveApplier.Outcome outcome = applier.apply(from, to, promotion, customRules, this::getGameState);
        MoveResult result = outcome.result();
        if(!result.success()) {
            LOGGER.warn("Move {}-{} rejected: {}", from, to, result);
            return result;
        }

        Move played = result.move();
        if(played.san() == null) {
            played = played.withSan(MoveIOUtils.writeEnhancedNotation(played));
        }
        if(!outcome.dash()) {
            plyCount++;
        }
        generator.closeDashWindow();

        Board after = oracle.board();
        List<AbilityResult> abilityResults = triggerMoveAbilities(played, after, outcome, policy,
                played.isCapture() && !anyCaptureYet, previousWasCapture, historySize + 1);
        expireRestrictions();
        pruneOverlay(after);
        stationaryTracker.recordMove(played);
        if(!outcome.dash() && after.get(played.to()).color() == Color.BLACK) {
            stationaryTracker.completeRound(after);
        }
        refreshStandingOptions();

        played = played.withAbilities(abilityResults)
                .withEleganceScore(EleganceScorer.score(before, played, after, historySize));
        moveHistory.add(played);
        LOGGER.debug("Played {} at ply {}", played, plyCount);
        return MoveResult.ok(played);
    }

    public MoveResult makeMoveFromNotation(String notation) {
        if(notation == null || notation.isBlank()) {
            return MoveResult.failure(MoveError.INVALID_NOTATION, "Empty notation");
        }
        Move coordinates = MoveIOUtils.parseCoordinateNotation(notation);
        if(coordinates != null) {
            return makeMove(coordinates.from(), coordinates.to(), coordinates.promotion());
        }
        String wanted = MoveIOUtils.normalizeAlgebraicNotation(notation);
        for(Move move : getLegalMoves()) {
            if(move.san() != null && MoveIOUtils.normalizeAlgebraicNotation(move.san()).equals(wanted)) {
                return makeMove(move.from(), move.to(), move.promotion());
            }
        }
        return MoveResult.failure(MoveError.INVALID_NOTATION, "No legal move matches " + notation);
    }

    private List<AbilityResult> triggerMoveAbilities(Move move, Board after, MoveApplier.Outcome outcome, TriggerPolicy policy,
                                                     boolean firstCapture, boolean previousWasCapture, int moveCount) {
        List<AbilityResult> results = new ArrayList<>();
        Square square = move.to();
        PieceEvolutionState state = overlay.get(square);
        if(state == null) {
            return results;
        }
        UpgradeState pieceUpgrades = upgrades.upgradesFor(state.pieceType, state.color);
        TriggerContext triggerContext = triggerContext(square, after, moveCount);
        EffectContext effectContext = new EffectContext(after, overlay, oracle, config, square, plyCount,
                firstCapture, previousWasCapture);

        for(AbilityInstance ability : new ArrayList<>(state.abilities)) {
            if(!firesOnMove(ability, move)
                    || !activity.isAbilityActive(ability.id, state.pieceType, pieceUpgrades)
                    || !lifecycle.canTrigger(ability, triggerContext)
                    || !policy.fires(ability.id, square)) {
                continue;
            }
            lifecycle.stamp(ability, triggerContext);
            AbilityResult result = executor.execute(ability, move, effectContext);
            results.add(result);
            LOGGER.info("{} triggered on {}: {}", ability.id, square, result.description());
            // A dash follow-up never opens another window
            if(AbilityIds.KNIGHT_DASH.equals(ability.id) && result.success() && !outcome.dash()) {
                generator.openDashWindow(square);
            }
        }
        return results;
    }

    /** Movement abilities fire on the moves tagged with them, standard geometry included. */
    private static boolean firesOnMove(AbilityInstance ability, Move move) {
        if(AbilityIds.STATIONARY.contains(ability.id)) {
            return false;
        }
        return switch (ability.category) {
            case MOVEMENT -> ability.id.equals(move.enhancedBy());
            case CAPTURE -> move.isCapture();
            case SPECIAL, PASSIVE -> true;
        };
    }

    // Evolutions

    /** A copy of the evolution state on {@code square}, or null. */
    public PieceEvolutionState getPieceEvolutionData(Square square) {
        PieceEvolutionState state = overlay.get(square);
        return state == null ? null : state.copy();
    }

    /**
     * Attaches {@code state} to the piece on {@code square}.
     *
     * @return false when the square is empty or holds another piece than the state describes
     */
    public boolean setPieceEvolution(Square square, PieceEvolutionState state) {
        Piece piece = oracle.get(square);
        if(piece == null || piece.type() != state.pieceType || piece.color() != state.color) {
            return false;
        }
        overlay.put(square, state.copy());
        refreshStandingOptions();
        return true;
    }

    /**
     * Sets the level, abilities and multipliers of the piece on {@code square}, creating its entry if
     * needed. Does nothing on an empty square.
     */
    public boolean applyEvolutionEffects(Square square, EvolutionData data) {
        Piece piece = oracle.get(square);
        if(piece == null) {
            return false;
        }
        PieceEvolutionState state = overlay.get(square);
        if(state == null || state.pieceType != piece.type() || state.color != piece.color()) {
            state = new PieceEvolutionState(piece.type(), piece.color());
            overlay.put(square, state);
        }
        state.evolutionLevel = data.evolutionLevel();
        state.abilities.clear();
        for(AbilityInstance ability : data.abilities()) {
            state.abilities.add(ability.copy());
        }
        Map<String, Double> attributes = data.attributes();
        state.captureBonus = attributes.getOrDefault(EvolutionData.ATTACK_POWER, state.captureBonus);
        state.defensiveBonus = attributes.getOrDefault(EvolutionData.DEFENSE, state.defensiveBonus);
        state.breakthroughBonus = attributes.getOrDefault(EvolutionData.BREAKTHROUGH, state.breakthroughBonus);
        state.allyBonus = attributes.getOrDefault(EvolutionData.ALLY_BONUS, state.allyBonus);
        state.authorityBonus = attributes.getOrDefault(EvolutionData.AUTHORITY, state.authorityBonus);
        refreshStandingOptions();
        return true;
    }

    /**
     * Gives every piece without a matching entry one built from its upgrades. Existing matching
     * entries are kept as they are.
     *
     * @return the number of entries created
     */
    public int syncPieceEvolutionsWithBoard() {
        Board board = oracle.board();
        pruneOverlay(board);
        int created = 0;
        for(Square square : board.occupied()) {
            if(overlay.contains(square)) {
                continue;
            }
            Piece piece = board.get(square);
            UpgradeState pieceUpgrades = upgrades.upgradesFor(piece.type(), piece.color());
            PieceEvolutionState state = new PieceEvolutionState(piece.type(), piece.color());
            state.evolutionLevel = AbilityCatalog.calculateEvolutionLevel(piece.type(), pieceUpgrades);
            state.abilities.addAll(catalog.generateAbilitiesFromEvolution(piece.type(), pieceUpgrades));
            overlay.put(square, state);
            created++;
        }
        refreshStandingOptions();
        return created;
    }

    public AbilityCatalog getAbilityCatalog() {
        return catalog;
    }

    /** Deep copy of the whole overlay. */
    public Map<Square, PieceEvolutionState> getEvolutionSnapshot() {
        return overlay.snapshot();
    }

    // Abilities

    public List<AbilityResult> checkStationaryTriggers() {
        return checkStationaryTriggers(stationaryTracker);
    }

    /**
     * Fires rook entrenchment and bishop consecration for pieces that stood still long enough.
     *
     * @param turnsStationary full rounds each square's piece has not moved
     */
    public List<AbilityResult> checkStationaryTriggers(ToIntFunction<Square> turnsStationary) {
        List<AbilityResult> results = new ArrayList<>();
        Board board = oracle.board();
        for(Square square : new ArrayList<>(overlay.squares())) {
            PieceEvolutionState state = overlay.get(square);
            String abilityId = switch (state.pieceType) {
                case ROOK -> state.isEntrenched ? null : AbilityIds.ROOK_ENTRENCH;
                case BISHOP -> state.isConsecratedSource ? null : AbilityIds.BISHOP_CONSECRATE;
                default -> null;
            };
            if(abilityId == null || !state.hasAbility(abilityId)) {
                continue;
            }
            AbilityInstance ability = state.getAbility(abilityId).get();
            UpgradeState pieceUpgrades = upgrades.upgradesFor(state.pieceType, state.color);
            if(!activity.isAbilityActive(abilityId, state.pieceType, pieceUpgrades)
                    || turnsStationary.applyAsInt(square) < catalog.stationaryThreshold(abilityId, pieceUpgrades)) {
                continue;
            }
            TriggerContext context = triggerContext(square, board, moveHistory.size());
            if(!lifecycle.canTrigger(ability, context)) {
                continue;
            }
            lifecycle.stamp(ability, context);
            AbilityResult result = executor.execute(ability, stationaryMove(square, state), effectContext(board, square));
            results.add(result);
            LOGGER.info("{} triggered on {} after {} stationary rounds", abilityId, square, turnsStationary.applyAsInt(square));
        }
        if(!results.isEmpty()) {
            refreshStandingOptions();
        }
        return results;
    }

    /**
     * Fires one ability of the piece on {@code square} outside of a move. Cooldowns, use caps and
     * conditions apply; capture abilities cannot be fired this way.
     */
    public AbilityResult triggerAbility(Square square, String abilityId) {
        PieceEvolutionState state = overlay.get(square);
        if(state == null || !state.hasAbility(abilityId)) {
            return AbilityResult.failure(abilityId, "No ability " + abilityId + " on " + square);
        }
        AbilityInstance ability = state.getAbility(abilityId).get();
        if(ability.category == AbilityCategory.CAPTURE) {
            return AbilityResult.failure(abilityId, "Capture abilities only fire on captures");
        }
        if(!activity.isAbilityActive(abilityId, state.pieceType, upgrades.upgradesFor(state.pieceType, state.color))) {
            return AbilityResult.failure(abilityId, abilityId + " is not active");
        }
        Board board = oracle.board();
        TriggerContext context = triggerContext(square, board, moveHistory.size());
        if(!lifecycle.canTrigger(ability, context)) {
            return AbilityResult.failure(abilityId, abilityId + " cannot trigger now");
        }
        lifecycle.stamp(ability, context);
        AbilityResult result = executor.execute(ability, stationaryMove(square, state), effectContext(board, square));
        refreshStandingOptions();
        LOGGER.info("{} triggered on {}: {}", abilityId, square, result.description());
        return result;
    }

    public Map<String, CooldownStatus> getAbilityCooldowns(Square square) {
        PieceEvolutionState state = overlay.get(square);
        if(state == null) {
            return new LinkedHashMap<>();
        }
        return lifecycle.getCooldowns(state, config.clock.getAsLong(), plyCount);
    }

    public boolean resetAbilityCooldowns(Square square) {
        PieceEvolutionState state = overlay.get(square);
        if(state == null) {
            return false;
        }
        lifecycle.resetCooldowns(state);
        return true;
    }

    // Scoring and rules

    /** Elegance of {@code move} played from the current position. */
    public int calculateEleganceScore(Move move) {
        Board before = oracle.board();
        if(before.get(move.from()) == null) {
            return 0;
        }
        Board after = MoveGenerator.boardAfter(before, move);
        return EleganceScorer.score(before, move, after, moveHistory.size());
    }

    /** Adds the rule, replacing any rule with the same id. */
    public void addCustomRule(CustomRule rule) {
        removeCustomRule(rule.id());
        customRules.add(rule);
        customRules.sort(CustomRule.BY_PRIORITY);
    }

    public boolean removeCustomRule(String ruleId) {
        return customRules.removeIf(rule -> rule.id().equals(ruleId));
    }

    public List<CustomRule> getCustomRules() {
        return Collections.unmodifiableList(customRules);
    }

    public List<Synergy> calculateBoardSynergies() {
        return SynergyCalculator.calculateBoardSynergies(overlay);
    }

    /** Whether the piece on {@code square} has evolved far enough to be promoted automatically. */
    public boolean checkPieceAutoPromotion(Square square, long timeInvestedMillis) {
        PieceEvolutionState state = overlay.get(square);
        return state != null
                && timeInvestedMillis >= config.autoPromotionMinMillis
                && state.evolutionLevel >= config.autoPromotionMinLevel;
    }

    // History

    public List<Move> getMoveHistory() {
        return Collections.unmodifiableList(moveHistory);
    }

    public int getPlyCount() {
        return plyCount;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public StationaryTracker getStationaryTracker() {
        return stationaryTracker;
    }

    public Square getDashSquare() {
        return generator.dashSquare();
    }

    public Board getBoard() {
        return oracle.board();
    }

    // Internals

    private TriggerContext triggerContext(Square square, Board board, int moveCount) {
        long now = config.clock.getAsLong();
        return new TriggerContext(square, now, plyCount, moveCount, board.pieceCount(), (now - gameStartedAt) / 1000.0);
    }

    private EffectContext effectContext(Board board, Square square) {
        boolean previousWasCapture = !moveHistory.isEmpty() && moveHistory.get(moveHistory.size() - 1).isCapture();
        return new EffectContext(board, overlay, oracle, config, square, plyCount, false, previousWasCapture);
    }

    private static Move stationaryMove(Square square, PieceEvolutionState state) {
        return Move.standard(square, square, null, state.pieceType, null, String.valueOf(Move.NORMAL));
    }

    private void expireRestrictions() {
        for(PieceEvolutionState state : overlay.entries().values()) {
            if(state.restrictionExpiresAtPly != PieceEvolutionState.NO_RESTRICTION && plyCount >= state.restrictionExpiresAtPly) {
                state.liftRestriction();
            }
        }
    }

    // Entries only live on squares holding the piece they describe
    private void pruneOverlay(Board board) {
        for(Square square : new ArrayList<>(overlay.squares())) {
            Piece piece = board.get(square);
            PieceEvolutionState state = overlay.get(square);
            if(piece == null || piece.type() != state.pieceType || piece.color() != state.color) {
                LOGGER.debug("Dropping evolution of {} on {}", state.pieceType, square);
                overlay.remove(square);
            }
        }
    }

    private void refreshStandingOptions() {
        StandingOptions.refresh(oracle.board(), overlay, generator.dashSquare());
    }
}
