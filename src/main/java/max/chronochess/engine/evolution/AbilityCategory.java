package max.chronochess.engine.evolution;

public enum AbilityCategory {
    MOVEMENT, CAPTURE, SPECIAL, PASSIVE
}
