package com.funnelcore.analytics.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class BuildMetadataTest {

    @Test
    void missingResourceFallsBackToDevIdentity() {
        BuildMetadata metadata = BuildMetadata.load("does-not-exist.properties");
        assertEquals("dev+unknown", metadata.identity());
    }

    @Test
    void blankValuesAreNormalized() {
        BuildMetadata metadata = new BuildMetadata(" ", null);
        assertEquals("dev", metadata.version());
        assertEquals("unknown", metadata.gitCommit());
    }

    @Test
    void currentIdentityIsNeverBlank() {
        assertFalse(StringSemantics.isBlank(BuildMetadata.current().identity()));
    }
}
