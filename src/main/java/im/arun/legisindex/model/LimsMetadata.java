package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Publisher tracking attributes ({@code lims:*}) carried by a source element.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LimsMetadata {
    String fid;
    String id;
    String enactedDate;
    String enactId;
    String pitDate;
    String currentDate;
    String inForceStartDate;
}
