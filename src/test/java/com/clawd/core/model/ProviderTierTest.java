package com.clawd.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProviderTierTest {

    @Test
    void testCanonicalNames() {
        assertEquals(ProviderTier.FAST, ProviderTier.fromAlias("fast"));
        assertEquals(ProviderTier.BALANCED, ProviderTier.fromAlias("BALANCED"));
        assertEquals(ProviderTier.DEEP, ProviderTier.fromAlias(" deep "));
    }

    @Test
    void testLegacyAliases() {
        assertEquals(ProviderTier.BALANCED, ProviderTier.fromAlias("auto"));
        assertEquals(ProviderTier.DEEP, ProviderTier.fromAlias("smart"));
        assertEquals(ProviderTier.FAST, ProviderTier.fromAlias("haiku"));
    }

    @Test
    void testMissingTierDefaultsToBalanced() {
        assertEquals(ProviderTier.BALANCED, ProviderTier.fromAlias(null));
        assertEquals(ProviderTier.BALANCED, ProviderTier.fromAlias(""));
    }

    @Test
    void testUnknownTierRejected() {
        assertThrows(IllegalArgumentException.class, () -> ProviderTier.fromAlias("turbo"));
    }
}
