package org.caureq.caureqalertdesk.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetadataValueTest {

    @Test
    @DisplayName("booleans are truthy only when true")
    void booleans() {
        assertThat(MetadataValue.ofBoolean(true).isTruthy()).isTrue();
        assertThat(MetadataValue.ofBoolean(false).isTruthy()).isFalse();
    }

    @Test
    @DisplayName("numbers are truthy when non-zero")
    void numbers() {
        assertThat(MetadataValue.ofNumber(0).isTruthy()).isFalse();
        assertThat(MetadataValue.ofNumber(-1.5).isTruthy()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "false", "FALSE", "0"})
    @DisplayName("blank, false and 0 strings are not truthy")
    void falsyStrings(String s) {
        assertThat(MetadataValue.ofString(s).isTruthy()).isFalse();
    }

    @Test
    void truthyString() {
        assertThat(MetadataValue.ofString("renewed").isTruthy()).isTrue();
    }

    @Test
    @DisplayName("fromMap drops nulls and rejects nested values")
    void fromMap() {
        var raw = new HashMap<String, Object>();
        raw.put("driver_id", "DRV001");
        raw.put("speed", 85.5);
        raw.put("ignored", null);

        var values = MetadataValue.fromMap(raw);
        assertThat(values).containsOnlyKeys("driver_id", "speed");
        assertThat(values.get("speed").getKind()).isEqualTo(MetadataValue.Kind.NUMBER);

        assertThatThrownBy(() -> MetadataValue.fromMap(Map.of("nested", List.of(1, 2))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nested");
    }

    @Test
    @DisplayName("whole numbers come back as longs")
    void toObject() {
        assertThat(MetadataValue.ofNumber(3).toObject()).isEqualTo(3L);
        assertThat(MetadataValue.ofNumber(2.5).toObject()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("strings and keys are bounded by the column sizes")
    void lengthLimits() {
        assertThat(MetadataValue.of("note", "y".repeat(MetadataValue.MAX_TEXT_LENGTH)).getKind())
                .isEqualTo(MetadataValue.Kind.STRING);

        assertThatThrownBy(() -> MetadataValue.of("note", "y".repeat(MetadataValue.MAX_TEXT_LENGTH + 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("note");
        assertThatThrownBy(() -> MetadataValue.of("k".repeat(MetadataValue.MAX_KEY_LENGTH + 1), true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MetadataValue.fromMap(Map.of(" ", 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("blank");
    }
}
