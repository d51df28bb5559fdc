package max.chronochess.engine.ability;

import max.chronochess.engine.evolution.AbilityInstance;
import max.chronochess.engine.evolution.PieceEvolutionState;
import max.chronochess.engine.movegen.Move;

@FunctionalInterface
public interface SpecialAbilityHandler {
    AbilityResult apply(AbilityInstance ability, PieceEvolutionState state, Move move, EffectContext context);
}
