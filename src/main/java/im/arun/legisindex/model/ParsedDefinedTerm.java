package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One defined term in one language. {@code pairedTerm} is the equivalent term in the
 * other official language when it could be resolved.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedDefinedTerm {
    Language language;
    String term;
    String termNormalized;
    String pairedTerm;
    String definition;
    String actId;
    String regulationId;
    String sectionLabel;
    Integer definitionOrder;
    ScopeType scopeType;
    List<String> scopeSections;
    String scopeRawText;
    LimsMetadata limsMetadata;
}
