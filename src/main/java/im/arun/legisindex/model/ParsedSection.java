package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One section, provision, schedule item, heading or enacting clause of a document.
 *
 * <p>{@code canonicalSectionId} is unique within one document and language; it embeds
 * the section type and order so repeated labels (for example several "16" in related
 * provisions) stay distinct.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedSection {
    String canonicalSectionId;
    String sectionLabel;
    int sectionOrder;
    Language language;
    SectionType sectionType;
    List<String> hierarchyPath;
    String marginalNote;
    String content;
    SectionStatus status;

    String xmlType;
    String xmlTarget;
    ChangeType changeType;
    String inForceStartDate;
    String lastAmendedDate;
    String enactedDate;
    LimsMetadata limsMetadata;

    List<HistoricalNote> historicalNotes;
    List<Footnote> footnotes;
    ContentFlags contentFlags;
    FormattingAttributes formattingAttributes;
    ProvisionHeading provisionHeading;
    List<InternalReference> internalReferences;

    String scheduleId;
    String scheduleBilingual;
    String scheduleSpanLanguages;
    String scheduleOriginatingRef;

    String actId;
    String regulationId;
}
