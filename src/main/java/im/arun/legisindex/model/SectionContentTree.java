package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import im.arun.legisindex.model.content.ContentNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Joins a section to its ordered content tree.
 *
 * <p>{@code joinKey} is the publisher's {@code lims:id} when the element carries one,
 * otherwise {@code pos:<sectionOrder>}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SectionContentTree {
    String joinKey;
    String limsId;
    int sectionOrder;
    String canonicalSectionId;
    String sectionLabel;
    List<String> hierarchyPath;
    List<ContentNode> contentTree;

    public static String joinKeyFor(String limsId, int sectionOrder) {
        return limsId != null ? limsId : "pos:" + sectionOrder;
    }
}
