package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of parsing one legislation file in one language.
 *
 * <p>{@code sections} and {@code contentTrees} are parallel: entry {@code i} of each
 * describes the same source element. {@code finalSectionOrder} is the last value of the
 * section-order counter, which excludes the enacting clause (order 0).
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedDocument {
    LegislationType type;
    Language language;
    ParsedAct act;
    ParsedRegulation regulation;
    List<ParsedSection> sections;
    List<SectionContentTree> contentTrees;
    List<ParsedDefinedTerm> definedTerms;
    List<ParsedCrossReference> crossReferences;
    int finalSectionOrder;

    /**
     * @return the act id or normalized regulation id
     */
    @JsonIgnore
    public String getDocumentId() {
        return act != null ? act.getActId() : regulation.getRegulationId();
    }
}
