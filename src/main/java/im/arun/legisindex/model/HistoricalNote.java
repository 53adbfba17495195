package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HistoricalNote {
    String text;
    String type;
    String enactedDate;
    String inForceStartDate;
    String enactId;
}
