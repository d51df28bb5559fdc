package max.chronochess.engine.evolution;

import java.util.List;
import java.util.Objects;

/**
 * An ability attached to an evolved piece. The definition part is fixed at construction; the
 * usage part (uses so far and the last-used stamps) changes every time the ability triggers.
 */
public final class AbilityInstance {
    public static final int UNLIMITED_USES = -1;
    public static final long NEVER_USED = -1L;
    public static final int NEVER_USED_PLY = -1;

    public final String id;
    public final String name;
    public final String description;
    public final AbilityCategory category;
    // 0 means no wall-clock cooldown
    public final double cooldownSeconds;
    // 0 means no ply cooldown
    public final int moveCooldownPlies;
    public final int maxUses;
    public final List<AbilityCondition> conditions;

    private int usesSoFar;
    private long lastUsedAt;
    private int lastUsedAtPly;

    private AbilityInstance(Builder b) {
        this.id = b.id;
        this.name = b.name == null ? b.id : b.name;
        this.description = b.description == null ? "" : b.description;
        this.category = b.category;
        this.cooldownSeconds = b.cooldownSeconds;
        this.moveCooldownPlies = b.moveCooldownPlies;
        this.maxUses = b.maxUses;
        this.conditions = List.copyOf(b.conditions);
        this.usesSoFar = b.usesSoFar;
        this.lastUsedAt = b.lastUsedAt;
        this.lastUsedAtPly = b.lastUsedAtPly;
    }

    public static Builder builder(String id, AbilityCategory category) {
        return new Builder(id, category);
    }

    public AbilityInstance copy() {
        return toBuilder().build();
    }

    public Builder toBuilder() {
        return new Builder(id, category)
                .name(name)
                .description(description)
                .cooldownSeconds(cooldownSeconds)
                .moveCooldownPlies(moveCooldownPlies)
                .maxUses(maxUses)
                .conditions(conditions)
                .usage(usesSoFar, lastUsedAt, lastUsedAtPly);
    }

    public boolean hasWallClockCooldown() {
        return cooldownSeconds > 0;
    }

    public boolean hasPlyCooldown() {
        return moveCooldownPlies > 0;
    }

    public boolean isCapped() {
        return maxUses != UNLIMITED_USES;
    }

    public boolean isExhausted() {
        return isCapped() && usesSoFar >= maxUses;
    }

    public int usesSoFar() {
        return usesSoFar;
    }

    public long lastUsedAt() {
        return lastUsedAt;
    }

    public int lastUsedAtPly() {
        return lastUsedAtPly;
    }

    /** Records one trigger. */
    public void stamp(long now, int currentPly) {
        usesSoFar++;
        lastUsedAt = now;
        lastUsedAtPly = currentPly;
    }

    public void resetUsage() {
        usesSoFar = 0;
        lastUsedAt = NEVER_USED;
        lastUsedAtPly = NEVER_USED_PLY;
    }

    /** Clears the cooldown stamps but keeps the use count, so capped abilities stay capped. */
    public void resetCooldown() {
        lastUsedAt = NEVER_USED;
        lastUsedAtPly = NEVER_USED_PLY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AbilityInstance that)) return false;
        return Double.compare(that.cooldownSeconds, cooldownSeconds) == 0
                && moveCooldownPlies == that.moveCooldownPlies
                && maxUses == that.maxUses
                && usesSoFar == that.usesSoFar
                && lastUsedAt == that.lastUsedAt
                && lastUsedAtPly == that.lastUsedAtPly
                && id.equals(that.id)
                && category == that.category
                && conditions.equals(that.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, category, usesSoFar, lastUsedAtPly);
    }

    @Override
    public String toString() {
        return id + "(" + category.name().toLowerCase() + ", uses=" + usesSoFar
                + (isCapped() ? "/" + maxUses : "") + ")";
    }

    public static final class Builder {
        private final String id;
        private final AbilityCategory category;
        private String name;
        private String description;
        private double cooldownSeconds = 0;
        private int moveCooldownPlies = 0;
        private int maxUses = UNLIMITED_USES;
        private List<AbilityCondition> conditions = List.of();
        private int usesSoFar = 0;
        private long lastUsedAt = NEVER_USED;
        private int lastUsedAtPly = NEVER_USED_PLY;

        private Builder(String id, AbilityCategory category) {
            this.id = id;
            this.category = category;
        }

        public Builder name(String v) { this.name = v; return this; }
        public Builder description(String v) { this.description = v; return this; }
        public Builder cooldownSeconds(double v) { this.cooldownSeconds = v; return this; }
        public Builder moveCooldownPlies(int v) { this.moveCooldownPlies = v; return this; }
        public Builder maxUses(int v) { this.maxUses = v; return this; }
        public Builder conditions(List<AbilityCondition> v) { this.conditions = v; return this; }

        public Builder usage(int uses, long lastUsedAtMillis, int lastUsedPly) {
            this.usesSoFar = uses;
            this.lastUsedAt = lastUsedAtMillis;
            this.lastUsedAtPly = lastUsedPly;
            return this;
        }

        public AbilityInstance build() {
            if(id == null || id.isBlank()) {
                throw new IllegalArgumentException("Ability id is required");
            }
            if(category == null) {
                throw new IllegalArgumentException("Ability " + id + " has no category");
            }
            if(cooldownSeconds < 0 || moveCooldownPlies < 0) {
                throw new IllegalArgumentException("Ability " + id + " has a negative cooldown");
            }
            // Zero uses is a valid cap: the ability exists but never fires
            if(maxUses != UNLIMITED_USES && maxUses < 0) {
                throw new IllegalArgumentException("Ability " + id + " has a negative use cap");
            }
            if(conditions == null) {
                conditions = List.of();
            }
            return new AbilityInstance(this);
        }
    }
}
