package com.clawd.core.model;

import java.util.Locale;

/**
 * Capability/cost class a caller asks for. Each tier maps to an ordered provider list.
 */
public enum ProviderTier {
    /**
     * Cheap and quick: lookups, short replies.
     */
    FAST,

    /**
     * General conversation.
     */
    BALANCED,

    /**
     * Complex analysis and reasoning.
     */
    DEEP;

    /**
     * Resolve a tier name, accepting the bot's legacy aliases ("auto", "smart").
     *
     * @param value tier name or alias, case-insensitive; null means {@link #BALANCED}
     * @return matching tier
     * @throws IllegalArgumentException for unknown names
     */
    public static ProviderTier fromAlias(String value) {
        if (value == null || value.isBlank()) {
            return BALANCED;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "fast", "haiku" -> FAST;
            case "balanced", "auto", "default", "sonnet" -> BALANCED;
            case "deep", "smart", "opus" -> DEEP;
            default -> throw new IllegalArgumentException("Unknown provider tier: " + value);
        };
    }
}
