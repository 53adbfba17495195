package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of record emitted by the document walk. The value is also the type segment of
 * the canonical section id.
 */
public enum SectionType {
    SECTION("section"),
    SCHEDULE("schedule"),
    PROVISION("provision"),
    HEADING("heading"),
    AMENDING("amending"),
    PREAMBLE("preamble"),
    ENACTS("enacts"),
    FORM("form");

    private final String value;

    SectionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
