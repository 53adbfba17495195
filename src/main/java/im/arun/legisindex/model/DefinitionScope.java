package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.List;

/**
 * Resolved applicability of a definition. {@code sections} is only set for
 * {@link ScopeType#SECTION}; decimal ranges are represented by their two endpoints.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DefinitionScope {
    ScopeType scopeType;
    List<String> sections;
    String rawText;

    public static DefinitionScope of(ScopeType scopeType, String rawText) {
        return new DefinitionScope(scopeType, null, rawText);
    }

    public static DefinitionScope ofSections(List<String> sections, String rawText) {
        return new DefinitionScope(ScopeType.SECTION, List.copyOf(sections), rawText);
    }
}
