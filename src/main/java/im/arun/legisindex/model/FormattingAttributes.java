package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Layout hints copied from the element attributes. Only present values are kept.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FormattingAttributes {
    Integer indentLevel;
    String firstLineIndent;
    String subsequentLineIndent;
    String justification;
    Boolean hyphenation;
    Integer pointSize;
    Boolean keepWithNext;
    Boolean keepWithPrevious;
    String topMarginSpacing;
    String bottomMarginSpacing;
    String formatRef;
    Boolean listItem;
    Boolean languageAlign;
    String fontStyle;
}
