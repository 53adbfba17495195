package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Recommendation or Notice block attached to a regulation.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PublicationItem {
    String type;
    String content;
    String publicationRequirement;
    List<String> sourceSections;
    LimsMetadata limsMetadata;
    List<Footnote> footnotes;
}
