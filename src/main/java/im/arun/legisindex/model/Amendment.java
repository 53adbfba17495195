package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Entry of the RecentAmendments list.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Amendment {
    String citation;
    String date;
    String link;
}
