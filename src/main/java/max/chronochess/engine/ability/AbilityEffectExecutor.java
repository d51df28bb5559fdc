package max.chronochess.engine.ability;

import max.chronochess.engine.EngineConfig;
import max.chronochess.engine.ability.special.SpecialAbilities;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.evolution.AbilityIds;
import max.chronochess.engine.evolution.AbilityInstance;
import max.chronochess.engine.evolution.PieceEvolutionState;
import max.chronochess.engine.movegen.Move;
import max.chronochess.engine.movegen.enhanced.EnhancedPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Applies the effect of a triggered ability to the overlay. Bonuses compound multiplicatively.
 */
public final class AbilityEffectExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbilityEffectExecutor.class);

    private final Map<String, SpecialAbilityHandler> specialHandlers;

    public AbilityEffectExecutor(EngineConfig config) {
        this(SpecialAbilities.defaultHandlers(config));
    }

    public AbilityEffectExecutor(Map<String, SpecialAbilityHandler> specialHandlers) {
        this.specialHandlers = new HashMap<>(Objects.requireNonNull(specialHandlers));
    }

    public AbilityResult execute(AbilityInstance ability, Move move, EffectContext context) {
        PieceEvolutionState state = context.overlay().get(context.square());
        if(state == null) {
            return AbilityResult.failure(ability.id, "No evolution on " + context.square());
        }
        AbilityResult result = switch (ability.category) {
            case MOVEMENT -> executeMovement(ability, state, context);
            case CAPTURE -> executeCapture(ability, state, move, context);
            case SPECIAL -> executeSpecial(ability, state, move, context);
            case PASSIVE -> AbilityResult.success(ability.id, ability.name, Map.of("passiveBonus", 1.0));
        };
        LOGGER.debug("{} on {} -> {}", ability.id, context.square(), result);
        return result;
    }

    private AbilityResult executeMovement(AbilityInstance ability, PieceEvolutionState state, EffectContext context) {
        Piece mover = context.board().get(context.square());
        TreeSet<Square> destinations = new TreeSet<>();
        for(Square target : EnhancedPatterns.getCandidates(context.board(), context.square(), ability.id, state)) {
            Piece occupant = context.board().get(target);
            if(occupant == null || (occupant.color() != mover.color() && occupant.type() != PieceType.KING)) {
                destinations.add(target);
            }
        }
        state.abilityDestinations.put(ability.id, destinations);
        return AbilityResult.success(ability.id, ability.name, Map.of("destinations", destinations.size()));
    }

    private AbilityResult executeCapture(AbilityInstance ability, PieceEvolutionState state, Move move, EffectContext context) {
        if(!move.isCapture()) {
            return AbilityResult.failure(ability.id, "Not a capture");
        }
        double bonus = switch (ability.id) {
            case AbilityIds.ENHANCED_CAPTURE -> 1.5;
            case AbilityIds.GIANT_SLAYER -> 1 + capturedValue(move) / 10.0;
            case AbilityIds.FIRST_STRIKE -> context.firstCapture() ? 2.0 : 1.2;
            case AbilityIds.CHAIN_CAPTURE -> context.previousMoveWasCapture() ? 1.8 : 1.0;
            default -> 1.0;
        };
        state.captureBonus *= bonus;
        return AbilityResult.success(ability.id, ability.name,
                Map.of("bonus", bonus, "captureBonus", state.captureBonus));
    }

    private AbilityResult executeSpecial(AbilityInstance ability, PieceEvolutionState state, Move move, EffectContext context) {
        SpecialAbilityHandler handler = specialHandlers.get(ability.id);
        if(handler == null) {
            return AbilityResult.success(ability.id, ability.name, Map.of());
        }
        return handler.apply(ability, state, move, context);
    }

    private static int capturedValue(Move move) {
        if(move.captured() != null) {
            return move.captured().value;
        }
        // En passant moves may not carry the victim type
        return move.hasFlag(Move.EN_PASSANT) ? PieceType.PAWN.value : 0;
    }
}
