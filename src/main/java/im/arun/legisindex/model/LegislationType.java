package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LegislationType {
    ACT("act"),
    REGULATION("regulation");

    private final String value;

    LegislationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static LegislationType fromValue(String value) {
        for (LegislationType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown legislation type: " + value);
    }
}
