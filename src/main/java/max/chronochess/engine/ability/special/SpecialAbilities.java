package max.chronochess.engine.ability.special;

import max.chronochess.engine.EngineConfig;
import max.chronochess.engine.ability.AbilityResult;
import max.chronochess.engine.ability.EffectContext;
import max.chronochess.engine.ability.MoveRestriction;
import max.chronochess.engine.ability.SpecialAbilityHandler;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.evolution.PieceEvolutionState;
import max.chronochess.engine.movegen.Move;
import max.chronochess.engine.movegen.enhanced.EnhancedPatterns;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static max.chronochess.engine.evolution.AbilityIds.*;

/**
 * Dispatch table of the special abilities. Radii are Chebyshev distances from the acting piece.
 */
public final class SpecialAbilities {
    private SpecialAbilities() {
    }

    public static Map<String, SpecialAbilityHandler> defaultHandlers(EngineConfig config) {
        Map<String, SpecialAbilityHandler> handlers = new LinkedHashMap<>();

        handlers.put(KNIGHT_DASH, (ability, state, move, ctx) -> {
            List<Square> dashTargets = EnhancedPatterns.getKnightDashTargets(ctx.square());
            state.cachedModifiedMoves.clear();
            state.cachedModifiedMoves.addAll(dashTargets);
            return AbilityResult.success(ability.id, "Knight may dash again from " + ctx.square(),
                    Map.of("dashSquare", ctx.square().toString(), "dashMoves", dashTargets.size()));
        });

        handlers.put(ROOK_ENTRENCH, (ability, state, move, ctx) -> {
            state.isEntrenched = true;
            state.defensiveBonus = config.entrenchDefensiveBonus;
            List<Square> lines = EnhancedPatterns.getEntrenchedRookTargets(ctx.square());
            state.territoryControl.clear();
            state.territoryControl.addAll(lines);
            state.cachedModifiedMoves.addAll(lines);
            return AbilityResult.success(ability.id, "Rook entrenched on " + ctx.square(),
                    Map.of("defensiveBonus", state.defensiveBonus, "territory", lines.size()));
        });

        handlers.put(BISHOP_CONSECRATE, (ability, state, move, ctx) -> {
            state.isConsecratedSource = true;
            state.consecrationRadius = config.consecrationRadius;
            state.allyBonus = config.consecrationAllyBonus;
            state.cachedModifiedMoves.addAll(EnhancedPatterns.getConsecratedBishopTargets(ctx.square()));
            int blessed = forEach(ctx, config.consecrationRadius, true, ally -> {
                ally.state().consecrationBonus = config.consecrationAllyBonus;
                ally.state().isReceivingConsecration = true;
                ally.state().cachedModifiedMoves.addAll(EnhancedPatterns.getConsecrationBonusTargets(ctx.board(), ally.square(), 2));
            });
            return AbilityResult.success(ability.id, "Consecrated " + blessed + " allies",
                    Map.of("allies", blessed, "radius", config.consecrationRadius));
        });

        handlers.put(QUEEN_DOMINANCE, (ability, state, move, ctx) -> {
            state.authorityBonus = 1.4;
            state.dominanceRadius = config.dominanceRadius;
            int dominated = forEach(ctx, config.dominanceRadius, false, enemy -> {
                enemy.state().dominancePenalty = config.dominancePenalty;
                enemy.state().isDominated = true;
                restrict(enemy, ctx, config);
            });
            return AbilityResult.success(ability.id, "Dominated " + dominated + " enemies",
                    Map.of("enemies", dominated, "radius", config.dominanceRadius));
        });

        handlers.put(ROYAL_DECREE, (ability, state, move, ctx) -> {
            state.authorityBonus *= 1.5;
            int decreed = forEach(ctx, config.decreeRadius, false, enemy -> restrict(enemy, ctx, config));
            return AbilityResult.success(ability.id, "Decree restricts " + decreed + " enemies",
                    Map.of("enemies", decreed, "radius", config.decreeRadius));
        });

        handlers.put(LAST_STAND, (ability, state, move, ctx) -> {
            state.defensiveBonus *= 3.0;
            state.captureBonus *= 1.5;
            return multiplierResult(ability.id, "Last stand", state);
        });

        handlers.put(TELEPORT, (ability, state, move, ctx) -> {
            List<Square> targets = EnhancedPatterns.getTeleportTargets(ctx.board(), state.pieceType, state.color);
            state.teleportCharged = true;
            state.cachedModifiedMoves.addAll(targets);
            return AbilityResult.success(ability.id, "Teleport charged",
                    Map.of("teleportOptions", targets.size()));
        });

        handlers.put(ZONE_CONTROL, territory(2, 1.5));
        handlers.put(BATTLEFIELD_COMMAND, territory(4, 2.0));
        handlers.put(DIVINE_AUTHORITY, territory(5, 3.0));

        handlers.put(PROTECTIVE_AURA, allyAura(1, ally -> ally.defensiveBonus *= 1.3));
        handlers.put(HEAL_ALLIES, allyAura(2, ally -> ally.allyBonus *= 1.2));
        handlers.put(TIME_WARD, allyAura(4, ally -> ally.defensiveBonus *= 1.4));
        handlers.put(COMMAND_AURA, allyAura(3, ally -> ally.allyBonus *= 1.5));

        handlers.put(AREA_STRIKE, (ability, state, move, ctx) -> {
            int struck = forEach(ctx, 1, false, enemy -> enemy.state().dominancePenalty *= 0.7);
            return AbilityResult.success(ability.id, "Area strike hit " + struck + " enemies", Map.of("enemies", struck));
        });

        handlers.put(PHASE_THROUGH, (ability, state, move, ctx) -> {
            state.canMoveThrough = true;
            List<Square> targets = EnhancedPatterns.getBreakthroughTargets(ctx.board(), ctx.square(), state.color);
            state.cachedModifiedMoves.addAll(targets);
            return AbilityResult.success(ability.id, "Phase through", Map.of("phaseMoves", targets.size()));
        });

        handlers.put(IMMOBILIZE_RESIST, self((state) -> state.defensiveBonus *= 1.5));
        handlers.put(BERSERKER_RAGE, self((state) -> state.captureBonus *= 2.0));
        handlers.put(BACKSTAB, self((state) -> state.captureBonus *= 1.8));
        handlers.put(PREDICT_MOVES, self((state) -> state.allyBonus *= 1.3));
        handlers.put(ENHANCED_VISION, self((state) -> state.allyBonus *= 1.2));
        handlers.put(RESILIENT_STANCE, self((state) -> state.defensiveBonus *= 2.0));
        handlers.put(STEALTH_MODE, self((state) -> state.defensiveBonus *= 1.8));
        handlers.put(DIVINE_INTERVENTION, self((state) -> state.allyBonus *= 3.0));
        handlers.put(IMPERIAL_GUARD, self((state) -> state.defensiveBonus *= 2.5));
        handlers.put(DIVINE_PROTECTION, self((state) -> state.defensiveBonus *= 10.0));

        return Collections.unmodifiableMap(handlers);
    }

    private record Target(Square square, PieceEvolutionState state) {
    }

    private static int forEach(EffectContext ctx, int radius, boolean allies, Consumer<Target> action) {
        List<Square> squares = ctx.piecesWithin(radius, allies);
        for(Square square : squares) {
            action.accept(new Target(square, ctx.stateAt(square)));
        }
        return squares.size();
    }

    private static void restrict(Target enemy, EffectContext ctx, EngineConfig config) {
        List<Move> kept = MoveRestriction.restrict(ctx.oracle().movesFor(enemy.square()), config.restrictionShare);
        PieceEvolutionState state = enemy.state();
        state.isMoveRestricted = true;
        state.restrictionExpiresAtPly = ctx.currentPly() + 1;
        state.cachedModifiedMoves.clear();
        for(Move move : kept) {
            state.cachedModifiedMoves.add(move.to());
        }
    }

    private static SpecialAbilityHandler self(Consumer<PieceEvolutionState> effect) {
        return (ability, state, move, ctx) -> {
            effect.accept(state);
            return multiplierResult(ability.id, ability.name, state);
        };
    }

    private static SpecialAbilityHandler allyAura(int radius, Consumer<PieceEvolutionState> effect) {
        return (ability, state, move, ctx) -> {
            int allies = forEach(ctx, radius, true, ally -> effect.accept(ally.state()));
            return AbilityResult.success(ability.id, ability.name + " reached " + allies + " allies",
                    Map.of("allies", allies, "radius", radius));
        };
    }

    private static SpecialAbilityHandler territory(int radius, double authorityMultiplier) {
        return (ability, state, move, ctx) -> {
            List<Square> zone = new ArrayList<>();
            for(Square square : Square.ALL) {
                if(square.chebyshevDistance(ctx.square()) <= radius) {
                    zone.add(square);
                }
            }
            state.territoryControl.addAll(zone);
            state.authorityBonus *= authorityMultiplier;
            return AbilityResult.success(ability.id, ability.name + " controls " + zone.size() + " squares",
                    Map.of("territory", zone.size(), "authorityBonus", state.authorityBonus));
        };
    }

    private static AbilityResult multiplierResult(String abilityId, String description, PieceEvolutionState state) {
        return AbilityResult.success(abilityId, description, Map.of(
                "captureBonus", state.captureBonus,
                "defensiveBonus", state.defensiveBonus,
                "allyBonus", state.allyBonus));
    }
}
