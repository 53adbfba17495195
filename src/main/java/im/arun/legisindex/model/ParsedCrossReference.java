package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * A reference from a section to another statute or regulation.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedCrossReference {
    String sourceActId;
    String sourceRegulationId;
    String sourceSectionLabel;
    String targetType;
    String targetRef;
    String referenceText;
}
