package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A convention, agreement or treaty reproduced inside a statute or regulation.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TreatyContent {
    String title;
    List<Heading> sections;
    List<Definition> definitions;
    String text;

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Heading {
        int level;
        String label;
        String title;
    }

    @Value
    public static class Definition {
        String term;
        String definition;
    }
}
