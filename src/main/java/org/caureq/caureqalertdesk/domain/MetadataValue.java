package org.caureq.caureqalertdesk.domain;

import jakarta.persistence.*;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single value of the alert metadata bag. Only strings, numbers and booleans
 * are accepted; producers sending nested objects or arrays are rejected.
 */
@Embeddable
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class MetadataValue {

    public enum Kind { STRING, NUMBER, BOOLEAN }

    public static final int MAX_KEY_LENGTH = 128;    // alert_metadata.meta_key
    public static final int MAX_TEXT_LENGTH = 1024;  // alert_metadata.text_value

    @Enumerated(EnumType.STRING)
    @Column(name = "value_kind", nullable = false, length = 8)
    private Kind kind;

    @Column(name = "text_value", length = 1024)
    private String text;

    @Column(name = "number_value")
    private Double number;

    @Column(name = "bool_value")
    private Boolean flag;

    public static MetadataValue ofString(String s) { return new MetadataValue(Kind.STRING, s, null, null); }
    public static MetadataValue ofNumber(double d) { return new MetadataValue(Kind.NUMBER, null, d, null); }
    public static MetadataValue ofBoolean(boolean b) { return new MetadataValue(Kind.BOOLEAN, null, null, b); }

    /** @throws IllegalArgumentException for unsupported kinds, blank or oversized keys and oversized strings */
    public static MetadataValue of(String key, Object raw) {
        checkKey(key);
        if (raw instanceof Boolean b) return ofBoolean(b);
        if (raw instanceof Number n) return ofNumber(n.doubleValue());
        if (raw instanceof String s) {
            if (s.length() > MAX_TEXT_LENGTH) {
                throw new IllegalArgumentException("metadata '" + key + "' exceeds " + MAX_TEXT_LENGTH + " characters");
            }
            return ofString(s);
        }
        throw new IllegalArgumentException("metadata '" + key + "' must be a string, number or boolean");
    }

    /** Converts a JSON-ish map into typed values. Null entries are dropped. */
    public static Map<String, MetadataValue> fromMap(Map<String, ?> raw) {
        Map<String, MetadataValue> out = new LinkedHashMap<>();
        if (raw == null) return out;
        raw.forEach((k, v) -> {
            checkKey(k);
            if (v != null) out.put(k, of(k, v));
        });
        return out;
    }

    public static void checkKey(String key) {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("metadata keys must not be blank");
        if (key.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("metadata key exceeds " + MAX_KEY_LENGTH + " characters");
        }
    }

    public static Map<String, Object> toMap(Map<String, MetadataValue> values) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (values != null) values.forEach((k, v) -> out.put(k, v.toObject()));
        return out;
    }

    public Object toObject() {
        return switch (kind) {
            case STRING -> text;
            case BOOLEAN -> flag;
            case NUMBER -> (number != null && number % 1 == 0 && Math.abs(number) < 1e15)
                    ? (Object) number.longValue() : number;
        };
    }

    /**
     * true, any non-zero number, or a non-blank string other than "false"/"0".
     */
    public boolean isTruthy() {
        return switch (kind) {
            case BOOLEAN -> Boolean.TRUE.equals(flag);
            case NUMBER -> number != null && number != 0.0 && !number.isNaN();
            case STRING -> text != null && !text.isBlank()
                    && !"false".equalsIgnoreCase(text.trim()) && !"0".equals(text.trim());
        };
    }
}
