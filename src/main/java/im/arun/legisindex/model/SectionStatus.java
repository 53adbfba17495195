package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SectionStatus {
    IN_FORCE("in-force"),
    REPEALED("repealed"),
    NOT_IN_FORCE("not-in-force");

    private final String value;

    SectionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
