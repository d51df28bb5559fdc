package max.chronochess.engine.rules;

import max.chronochess.engine.GameState;
import max.chronochess.engine.movegen.Move;

import java.util.Comparator;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Extra validation run before a move is resolved. Rules run highest priority first and the first one
 * whose validator returns false rejects the move.
 */
public record CustomRule(String id, String name, String description, int priority,
                         BiPredicate<Move, GameState> validator) {
    public static final Comparator<CustomRule> BY_PRIORITY = Comparator.comparingInt(CustomRule::priority).reversed();

    public CustomRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(validator, "validator");
        if(name == null) {
            name = id;
        }
        if(description == null) {
            description = "";
        }
    }

    public boolean allows(Move move, GameState state) {
        return validator.test(move, state);
    }
}
