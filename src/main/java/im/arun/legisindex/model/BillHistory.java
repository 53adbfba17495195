package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Parliamentary history from the statute's Identification block.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BillHistory {
    String billNumber;
    String billOrigin;
    String billType;
    Parliament parliament;
    List<Stage> stages;
    String refNumber;
    String refDateTime;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Parliament {
        String session;
        String number;
        String years;
        String regnalYear;
        String monarch;
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Stage {
        String stage;
        String date;
    }
}
