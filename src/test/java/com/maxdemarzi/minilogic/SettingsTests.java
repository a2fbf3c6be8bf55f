package com.maxdemarzi.minilogic;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

public class SettingsTests {

    @Test
    void shouldLoadBundledDefaults() {
        Settings settings = Settings.defaults();

        assertEquals(" ", settings.getPrintSeparator());
        assertFalse(settings.isInlineFunctions());
        assertEquals(1000, settings.getMaxCallDepth());
    }

    @Test
    void shouldOverrideFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(Settings.PRINT_SEPARATOR, "\t");
        properties.setProperty(Settings.INLINE_FUNCTIONS, "yes");
        properties.setProperty(Settings.MAX_CALL_DEPTH, " 64 ");

        Settings settings = Settings.from(properties);

        assertEquals("\t", settings.getPrintSeparator());
        assertTrue(settings.isInlineFunctions());
        assertEquals(64, settings.getMaxCallDepth());
    }

    @Test
    void shouldFallBackForMissingKeys() {
        Settings settings = Settings.from(new Properties());

        assertEquals(" ", settings.getPrintSeparator());
        assertFalse(settings.isInlineFunctions());
        assertEquals(1000, settings.getMaxCallDepth());
        assertTrue(settings.withInlineFunctions(true).isInlineFunctions());
        assertEquals(1000, settings.withInlineFunctions(true).getMaxCallDepth());
    }

    @Test
    void shouldRejectInvalidDepth() {
        Properties properties = new Properties();
        properties.setProperty(Settings.MAX_CALL_DEPTH, "deep");

        assertThatThrownBy(() -> Settings.from(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(Settings.MAX_CALL_DEPTH);
        assertThatThrownBy(() -> new Settings(" ", false, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
