package com.pcat.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginDescriptorTest {

    private static final String SPEC = "kind: plugin\ntype: step\nname: docker\n";

    @Test
    void nullFieldsNormalizeToEmpty() {
        PluginDescriptor p = new PluginDescriptor(" docker ", null, null, null, SPEC, null);

        assertEquals("docker", p.getIdentifier());
        assertEquals("", p.getType());
        assertEquals("", p.getDescription());
        assertEquals("", p.getVersion());
        assertEquals("", p.getLogo());
        assertFalse(p.hasLogo());
        assertTrue(p.matches(new PluginDescriptor("docker", "", "", "", SPEC, "")));
    }

    @Test
    void blankIdentifierIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PluginDescriptor("  ", "step", "", "", SPEC, ""));
        assertThrows(NullPointerException.class, () -> new PluginDescriptor(null, "step", "", "", SPEC, ""));
    }

    @Test
    void matches_isExactOnContentFields() {
        PluginDescriptor base = new PluginDescriptor("docker", "step", "Docker", "1", SPEC, "<svg/>");

        assertTrue(base.matches(new PluginDescriptor("docker", "step", "Docker", "1", SPEC, "<svg/>")));
        assertFalse(base.matches(new PluginDescriptor("docker", "stage", "Docker", "1", SPEC, "<svg/>")));
        assertFalse(base.matches(new PluginDescriptor("docker", "step", "Docker!", "1", SPEC, "<svg/>")));
        assertFalse(base.matches(new PluginDescriptor("docker", "step", "Docker", "1", SPEC + " ", "<svg/>")));
        assertFalse(base.matches(new PluginDescriptor("docker", "step", "Docker", "1", SPEC, "")));
        assertFalse(base.matches(new PluginDescriptor("kaniko", "step", "Docker", "1", SPEC, "<svg/>")));
        assertFalse(base.matches(null));
    }

    @Test
    void versionIsNotContentIdentityButIsEquality() {
        PluginDescriptor v1 = new PluginDescriptor("docker", "step", "Docker", "1", SPEC, "");
        PluginDescriptor v2 = new PluginDescriptor("docker", "step", "Docker", "2", SPEC, "");

        assertTrue(v1.matches(v2));
        assertNotEquals(v1, v2);
    }
}
