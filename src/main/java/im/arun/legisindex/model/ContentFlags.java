package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Presence markers for content kinds found anywhere under a section element.
 * Flags that are not set are left null so they drop out of the JSON.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentFlags {
    Boolean hasTable;
    Boolean hasFormula;
    Boolean hasImage;
    List<String> imageSources;
    Boolean hasRepealed;
    Boolean hasEditorialNote;
    Boolean hasReserved;
    Boolean hasExplanatoryNote;
    Boolean hasSignatureBlock;
    Boolean hasBilingualGroup;
    Boolean hasQuotedText;
    Boolean hasReadAsText;
    Boolean hasAmendedText;
    Boolean hasAlternateText;
    List<String> alternateTextContent;
    Boolean hasFormGroup;
    Boolean hasOath;
    Boolean hasCaption;
    Boolean hasLeader;
    List<String> leaderTypes;
    Boolean hasLineBreak;
    Boolean hasPageBreak;
    Boolean hasFormBlank;
    List<String> formBlankWidths;
    Boolean hasSeparator;
    Boolean hasFraction;
    Boolean hasIns;
    Boolean hasDel;
}
