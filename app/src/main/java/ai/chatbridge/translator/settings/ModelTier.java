package ai.chatbridge.translator.settings;

/**
 * Backend model classes with independent quota limits.
 */
public enum ModelTier {
    FAST("flash"),
    STRONG("pro");

    private final String id;

    ModelTier(String id) {
        this.id = id;
    }

    /** Identifier used in counter keys and in the model-tag table. */
    public String id() {
        return id;
    }

    public static ModelTier fromId(String id) {
        for (ModelTier tier : values()) {
            if (tier.id.equalsIgnoreCase(id)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown model tier: " + id);
    }
}
