package max.chronochess.engine.evolution;

import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Evolution data of the piece standing on a square: its abilities, stat multipliers, aura flags and
 * the standing destinations granted by effects that already fired.
 */
public final class PieceEvolutionState {
    public static final int NO_RESTRICTION = -1;

    public PieceType pieceType;
    public final Color color;
    public int evolutionLevel = 1;
    public final List<AbilityInstance> abilities = new ArrayList<>();

    public double captureBonus = 1.0;
    public double defensiveBonus = 1.0;
    public double consecrationBonus = 1.0;
    public double breakthroughBonus = 1.0;
    public double allyBonus = 1.0;
    public double authorityBonus = 1.0;
    public double dominancePenalty = 1.0;

    public boolean isEntrenched;
    public boolean isConsecratedSource;
    public boolean isReceivingConsecration;
    public boolean isDominated;
    public boolean isMoveRestricted;
    public boolean canMoveThrough;
    // Set by teleport, cleared once a teleport destination is used
    public boolean teleportCharged;

    public int consecrationRadius;
    public int dominanceRadius;
    public int restrictionExpiresAtPly = NO_RESTRICTION;

    public final Set<Square> territoryControl = new TreeSet<>();
    public final Set<Square> cachedModifiedMoves = new TreeSet<>();
    // Last destinations computed by each movement effect, for reporting
    public final Map<String, Set<Square>> abilityDestinations = new LinkedHashMap<>();

    public PieceEvolutionState(PieceType pieceType, Color color) {
        this.pieceType = Objects.requireNonNull(pieceType);
        this.color = Objects.requireNonNull(color);
    }

    public Optional<AbilityInstance> getAbility(String abilityId) {
        for(AbilityInstance ability : abilities) {
            if(ability.id.equals(abilityId)) {
                return Optional.of(ability);
            }
        }
        return Optional.empty();
    }

    public boolean hasAbility(String abilityId) {
        return getAbility(abilityId).isPresent();
    }

    /** Adds the ability, or replaces the one with the same id keeping its position. */
    public void putAbility(AbilityInstance ability) {
        for(int i = 0; i < abilities.size(); i++) {
            if(abilities.get(i).id.equals(ability.id)) {
                abilities.set(i, ability);
                return;
            }
        }
        abilities.add(ability);
    }

    public void liftRestriction() {
        isMoveRestricted = false;
        isDominated = false;
        restrictionExpiresAtPly = NO_RESTRICTION;
        cachedModifiedMoves.clear();
    }

    public PieceEvolutionState copy() {
        PieceEvolutionState copy = new PieceEvolutionState(pieceType, color);
        copy.evolutionLevel = evolutionLevel;
        for(AbilityInstance ability : abilities) {
            copy.abilities.add(ability.copy());
        }
        copy.captureBonus = captureBonus;
        copy.defensiveBonus = defensiveBonus;
        copy.consecrationBonus = consecrationBonus;
        copy.breakthroughBonus = breakthroughBonus;
        copy.allyBonus = allyBonus;
        copy.authorityBonus = authorityBonus;
        copy.dominancePenalty = dominancePenalty;
        copy.isEntrenched = isEntrenched;
        copy.isConsecratedSource = isConsecratedSource;
        copy.isReceivingConsecration = isReceivingConsecration;
        copy.isDominated = isDominated;
        copy.isMoveRestricted = isMoveRestricted;
        copy.canMoveThrough = canMoveThrough;
        copy.teleportCharged = teleportCharged;
        copy.consecrationRadius = consecrationRadius;
        copy.dominanceRadius = dominanceRadius;
        copy.restrictionExpiresAtPly = restrictionExpiresAtPly;
        copy.territoryControl.addAll(territoryControl);
        copy.cachedModifiedMoves.addAll(cachedModifiedMoves);
        abilityDestinations.forEach((id, squares) -> copy.abilityDestinations.put(id, new TreeSet<>(squares)));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PieceEvolutionState that)) return false;
        return evolutionLevel == that.evolutionLevel
                && Double.compare(that.captureBonus, captureBonus) == 0
                && Double.compare(that.defensiveBonus, defensiveBonus) == 0
                && Double.compare(that.consecrationBonus, consecrationBonus) == 0
                && Double.compare(that.breakthroughBonus, breakthroughBonus) == 0
                && Double.compare(that.allyBonus, allyBonus) == 0
                && Double.compare(that.authorityBonus, authorityBonus) == 0
                && Double.compare(that.dominancePenalty, dominancePenalty) == 0
                && isEntrenched == that.isEntrenched
                && isConsecratedSource == that.isConsecratedSource
                && isReceivingConsecration == that.isReceivingConsecration
                && isDominated == that.isDominated
                && isMoveRestricted == that.isMoveRestricted
                && canMoveThrough == that.canMoveThrough
                && teleportCharged == that.teleportCharged
                && consecrationRadius == that.consecrationRadius
                && dominanceRadius == that.dominanceRadius
                && restrictionExpiresAtPly == that.restrictionExpiresAtPly
                && pieceType == that.pieceType
                && color == that.color
                && abilities.equals(that.abilities)
                && territoryControl.equals(that.territoryControl)
                && cachedModifiedMoves.equals(that.cachedModifiedMoves)
                && abilityDestinations.equals(that.abilityDestinations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pieceType, color, evolutionLevel, abilities);
    }

    @Override
    public String toString() {
        return "PieceEvolutionState{" + color + " " + pieceType
                + ", level=" + evolutionLevel
                + ", abilities=" + abilities
                + ", capture=" + captureBonus
                + ", defense=" + defensiveBonus
                + (isEntrenched ? ", entrenched" : "")
                + (isConsecratedSource ? ", consecrated" : "")
                + (isMoveRestricted ? ", restricted" : "")
                + ", cached=" + cachedModifiedMoves
                + '}';
    }
}
