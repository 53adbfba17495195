package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The order text that precedes the body of a regulation ("His Excellency ... makes ...").
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnablingAuthorityOrder {
    String text;
    List<Footnote> footnotes;
    LimsMetadata limsMetadata;
}
