package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Value of the {@code @change} editorial marker.
 */
public enum ChangeType {
    INS("ins"),
    DEL("del"),
    OFF("off"),
    ALT("alt");

    private final String value;

    ChangeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ChangeType fromAttribute(String value) {
        if (value == null) {
            return null;
        }
        for (ChangeType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
