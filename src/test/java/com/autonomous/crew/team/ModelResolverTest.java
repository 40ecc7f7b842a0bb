package com.autonomous.crew.team;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelResolverTest {

    private final ModelResolver resolver = new ModelResolver("opus", "sonnet", "haiku");

    @Test
    void shouldResolveOperationsThroughTheirTier() {
        assertEquals("opus", resolver.resolve("soul:evolve"));
        assertEquals("opus", resolver.resolve("code:improve"));
        assertEquals("sonnet", resolver.resolve("self:reflect"));
        assertEquals("haiku", resolver.resolve("inbox:parse"));
    }

    @Test
    void shouldFallBackToAnalyticalTierForUnknownOperations() {
        assertEquals(ModelTier.ANALYTICAL, resolver.tierFor("something:new"));
        assertEquals("sonnet", resolver.resolve("something:new"));
    }
}
