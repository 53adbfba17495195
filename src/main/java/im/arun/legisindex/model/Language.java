package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Official language of a document version.
 */
public enum Language {
    EN("en"),
    FR("fr");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Language other() {
        return this == EN ? FR : EN;
    }

    /**
     * Resolves an {@code xml:lang} style value. Anything starting with "fr" is French,
     * everything else (including null) is English.
     */
    public static Language fromCode(String code) {
        if (code != null && code.trim().toLowerCase().startsWith("fr")) {
            return FR;
        }
        return EN;
    }
}
