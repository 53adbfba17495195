package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScopeType {
    ACT("act"),
    REGULATION("regulation"),
    PART("part"),
    SECTION("section");

    private final String value;

    ScopeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ScopeType forDocument(LegislationType type) {
        return type == LegislationType.ACT ? ACT : REGULATION;
    }
}
