package org.be.activityservice.config;

import org.be.activityservice.model.StateWindow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ActivityPropertiesTest {

    @Test
    void validate_defaultsAreValid() {
        ActivityProperties properties = new ActivityProperties();

        assertDoesNotThrow(properties::validate);
        assertArrayEquals(new double[]{0.70, 0.85, 0.92, 0.98}, properties.quantileLevelArray());
    }

    @Test
    void validate_rejectsUnorderedLevels() {
        ActivityProperties properties = new ActivityProperties();
        properties.setQuantileLevels(new ArrayList<>(List.of(0.70, 0.92, 0.85, 0.98)));

        assertThrows(IllegalArgumentException.class, properties::validate);
    }

    @Test
    void validate_stateNamesMustMatchLevels() {
        ActivityProperties properties = new ActivityProperties();
        properties.setQuantileLevels(new ArrayList<>(List.of(0.70, 0.85, 0.92)));

        assertThrows(IllegalArgumentException.class, properties::validate);
    }

    @Test
    void validate_rejectsDuplicateWindowLabels() {
        ActivityProperties properties = new ActivityProperties();
        properties.setWindows(new ArrayList<>(List.of(new StateWindow(14, "w"), new StateWindow(60, "w"))));

        assertThrows(IllegalArgumentException.class, properties::validate);
    }

    @Test
    void validate_rejectsNonPositiveExpandingWindow() {
        ActivityProperties properties = new ActivityProperties();
        properties.setExpandingWindow(0);

        assertThrows(IllegalArgumentException.class, properties::validate);
    }
}
