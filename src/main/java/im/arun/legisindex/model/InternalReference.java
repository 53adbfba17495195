package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * A reference to another location in the same document ({@code XRefInternal}).
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InternalReference {
    String targetLabel;
    String targetId;
    String referenceText;
}
