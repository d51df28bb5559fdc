package max.chronochess.engine;

import java.util.function.LongSupplier;

public final class EngineConfig {

    public final boolean debug;

    // Stationary triggers
    public final int stationaryThreshold;

    // Enhanced march
    public final int enhancedMarchCooldownPlies;
    public final int enhancedMarchMaxUses;

    // Wall-clock cooldowns, in seconds
    public final double knightDashCooldownSeconds;
    public final double queenDominanceCooldownSeconds;

    // Aura radii, Chebyshev distance
    public final int dominanceRadius;
    public final int consecrationRadius;
    public final int decreeRadius;

    // Effect multipliers
    public final double entrenchDefensiveBonus;
    public final double consecrationAllyBonus;
    public final double dominancePenalty;
    // Share of its moves a restricted piece keeps
    public final double restrictionShare;

    // Auto promotion
    public final long autoPromotionMinMillis;
    public final int autoPromotionMinLevel;

    public final LongSupplier clock;

    private EngineConfig(Builder b) {
        this.debug = b.debug;
        this.stationaryThreshold = b.stationaryThreshold;
        this.enhancedMarchCooldownPlies = b.enhancedMarchCooldownPlies;
        this.enhancedMarchMaxUses = b.enhancedMarchMaxUses;
        this.knightDashCooldownSeconds = b.knightDashCooldownSeconds;
        this.queenDominanceCooldownSeconds = b.queenDominanceCooldownSeconds;
        this.dominanceRadius = b.dominanceRadius;
        this.consecrationRadius = b.consecrationRadius;
        this.decreeRadius = b.decreeRadius;
        this.entrenchDefensiveBonus = b.entrenchDefensiveBonus;
        this.consecrationAllyBonus = b.consecrationAllyBonus;
        this.dominancePenalty = b.dominancePenalty;
        this.restrictionShare = b.restrictionShare;
        this.autoPromotionMinMillis = b.autoPromotionMinMillis;
        this.autoPromotionMinLevel = b.autoPromotionMinLevel;
        this.clock = b.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineConfig defaults() {
        return new Builder().build();
    }

    /** Defaults overridden by -Dchronochess.* system properties. */
    public static EngineConfig fromSystemProperties() {
        return new Builder()
                .debug(Boolean.parseBoolean(System.getProperty("chronochess.debug", "false")))
                .stationaryThreshold(Integer.parseInt(System.getProperty("chronochess.stationaryThreshold", "3")))
                .enhancedMarchCooldownPlies(Integer.parseInt(System.getProperty("chronochess.enhancedMarchCooldownPlies", "4")))
                .enhancedMarchMaxUses(Integer.parseInt(System.getProperty("chronochess.enhancedMarchMaxUses", "3")))
                .knightDashCooldownSeconds(Double.parseDouble(System.getProperty("chronochess.knightDashCooldownSeconds", "3")))
                .queenDominanceCooldownSeconds(Double.parseDouble(System.getProperty("chronochess.queenDominanceCooldownSeconds", "5")))
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .debug(debug)
                .stationaryThreshold(stationaryThreshold)
                .enhancedMarchCooldownPlies(enhancedMarchCooldownPlies)
                .enhancedMarchMaxUses(enhancedMarchMaxUses)
                .knightDashCooldownSeconds(knightDashCooldownSeconds)
                .queenDominanceCooldownSeconds(queenDominanceCooldownSeconds)
                .dominanceRadius(dominanceRadius)
                .consecrationRadius(consecrationRadius)
                .decreeRadius(decreeRadius)
                .entrenchDefensiveBonus(entrenchDefensiveBonus)
                .consecrationAllyBonus(consecrationAllyBonus)
                .dominancePenalty(dominancePenalty)
                .restrictionShare(restrictionShare)
                .autoPromotionMinMillis(autoPromotionMinMillis)
                .autoPromotionMinLevel(autoPromotionMinLevel)
                .clock(clock);
    }

    public static final class Builder {
        private boolean debug = false;
        private int stationaryThreshold = 3;
        private int enhancedMarchCooldownPlies = 4;
        private int enhancedMarchMaxUses = 3;
        private double knightDashCooldownSeconds = 3;
        private double queenDominanceCooldownSeconds = 5;
        private int dominanceRadius = 3;
        private int consecrationRadius = 2;
        private int decreeRadius = 2;
        private double entrenchDefensiveBonus = 2.5;
        private double consecrationAllyBonus = 1.3;
        private double dominancePenalty = 0.6;
        private double restrictionShare = 0.5;
        private long autoPromotionMinMillis = 30 * 60 * 1000L;
        private int autoPromotionMinLevel = 10;
        private LongSupplier clock = System::currentTimeMillis;

        public Builder debug(boolean v) { this.debug = v; return this; }
        public Builder stationaryThreshold(int v) { this.stationaryThreshold = v; return this; }
        public Builder enhancedMarchCooldownPlies(int v) { this.enhancedMarchCooldownPlies = v; return this; }
        public Builder enhancedMarchMaxUses(int v) { this.enhancedMarchMaxUses = v; return this; }
        public Builder knightDashCooldownSeconds(double v) { this.knightDashCooldownSeconds = v; return this; }
        public Builder queenDominanceCooldownSeconds(double v) { this.queenDominanceCooldownSeconds = v; return this; }
        public Builder dominanceRadius(int v) { this.dominanceRadius = v; return this; }
        public Builder consecrationRadius(int v) { this.consecrationRadius = v; return this; }
        public Builder decreeRadius(int v) { this.decreeRadius = v; return this; }
        public Builder entrenchDefensiveBonus(double v) { this.entrenchDefensiveBonus = v; return this; }
        public Builder consecrationAllyBonus(double v) { this.consecrationAllyBonus = v; return this; }
        public Builder dominancePenalty(double v) { this.dominancePenalty = v; return this; }
        public Builder restrictionShare(double v) { this.restrictionShare = v; return this; }
        public Builder autoPromotionMinMillis(long v) { this.autoPromotionMinMillis = v; return this; }
        public Builder autoPromotionMinLevel(int v) { this.autoPromotionMinLevel = v; return this; }
        public Builder clock(LongSupplier v) { this.clock = v; return this; }

        /**
         * Sets a field from its textual name, as sent by a "setoption" command.
         *
         * @throws IllegalArgumentException on an unknown name or unparsable value
         */
        public Builder option(String name, String value) {
            try {
                switch (name.trim().toLowerCase()) {
                    case "debug" -> debug(Boolean.parseBoolean(value));
                    case "stationarythreshold" -> stationaryThreshold(Integer.parseInt(value));
                    case "enhancedmarchcooldownplies" -> enhancedMarchCooldownPlies(Integer.parseInt(value));
                    case "enhancedmarchmaxuses" -> enhancedMarchMaxUses(Integer.parseInt(value));
                    case "knightdashcooldownseconds" -> knightDashCooldownSeconds(Double.parseDouble(value));
                    case "queendominancecooldownseconds" -> queenDominanceCooldownSeconds(Double.parseDouble(value));
                    case "dominanceradius" -> dominanceRadius(Integer.parseInt(value));
                    case "consecrationradius" -> consecrationRadius(Integer.parseInt(value));
                    case "decreeradius" -> decreeRadius(Integer.parseInt(value));
                    case "entrenchdefensivebonus" -> entrenchDefensiveBonus(Double.parseDouble(value));
                    case "consecrationallybonus" -> consecrationAllyBonus(Double.parseDouble(value));
                    case "dominancepenalty" -> dominancePenalty(Double.parseDouble(value));
                    case "restrictionshare" -> restrictionShare(Double.parseDouble(value));
                    default -> throw new IllegalArgumentException("Unknown option " + name);
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Bad value '" + value + "' for option " + name, e);
            }
            return this;
        }

        public EngineConfig build() {
            if(stationaryThreshold < 1) {
                throw new IllegalArgumentException("stationaryThreshold must be at least 1");
            }
            if(restrictionShare <= 0 || restrictionShare > 1) {
                throw new IllegalArgumentException("restrictionShare must be in (0, 1]");
            }
            return new EngineConfig(this);
        }
    }
}
