package im.arun.legisindex.model.content;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Element kinds that carry no attributes of interest, only ordered children.
 * CALS table parts are looked up case-insensitively ({@code row} / {@code Row}).
 */
public enum BlockKind {
    DEFINED_TERM_EN("DefinedTermEn"),
    DEFINED_TERM_FR("DefinedTermFr"),
    DEFINITION_REF("DefinitionRef"),
    REPEALED("Repealed"),
    SUP("Sup"),
    SUB("Sub"),
    SUPERSCRIPT("Superscript"),
    SUBSCRIPT("Subscript"),
    LINE_BREAK("LineBreak"),
    PAGE_BREAK("PageBreak"),
    FRACTION("Fraction"),
    NUMERATOR("Numerator"),
    DENOMINATOR("Denominator"),
    BASE("Base"),
    SEPARATOR("Separator"),
    LABEL("Label"),
    TEXT("Text"),
    SUBSECTION("Subsection"),
    PARAGRAPH("Paragraph"),
    SUBPARAGRAPH("Subparagraph"),
    CLAUSE("Clause"),
    SUBCLAUSE("Subclause"),
    SUBSUBCLAUSE("Subsubclause"),
    DEFINITION("Definition"),
    DEFINITION_EN_ONLY("DefinitionEnOnly"),
    DEFINITION_FR_ONLY("DefinitionFrOnly"),
    CONTINUED("Continued"),
    CONTINUED_SECTION_SUBSECTION("ContinuedSectionSubsection"),
    CONTINUED_PARAGRAPH("ContinuedParagraph"),
    CONTINUED_SUBPARAGRAPH("ContinuedSubparagraph"),
    CONTINUED_CLAUSE("ContinuedClause"),
    CONTINUED_SUBCLAUSE("ContinuedSubclause"),
    CONTINUED_DEFINITION("ContinuedDefinition"),
    CONTINUED_FORMULA_PARAGRAPH("ContinuedFormulaParagraph"),
    ITEM("Item"),
    TABLE_GROUP("TableGroup"),
    THEAD("THead", true),
    TBODY("TBody", true),
    TFOOT("TFoot", true),
    ROW("Row", true),
    FORMULA_GROUP("FormulaGroup"),
    FORMULA("Formula"),
    FORMULA_TEXT("FormulaText"),
    FORMULA_CONNECTOR("FormulaConnector"),
    FORMULA_DEFINITION("FormulaDefinition"),
    FORMULA_TERM("FormulaTerm"),
    FORMULA_PARAGRAPH("FormulaParagraph"),
    IMAGE_GROUP("ImageGroup"),
    CAPTION("Caption"),
    BILINGUAL_GROUP("BilingualGroup"),
    BILINGUAL_ITEM_EN("BilingualItemEn"),
    BILINGUAL_ITEM_FR("BilingualItemFr"),
    QUOTED_TEXT("QuotedText"),
    CENTERED_TEXT("CenteredText"),
    FORM_GROUP("FormGroup"),
    OATH("Oath"),
    READ_AS_TEXT("ReadAsText"),
    SCHEDULE_FORM_HEADING("ScheduleFormHeading"),
    LEADER_RIGHT_JUSTIFIED("LeaderRightJustified"),
    SECTION_PIECE("SectionPiece"),
    AMENDED_TEXT("AmendedText"),
    AMENDED_CONTENT("AmendedContent"),
    RESERVED("Reserved"),
    PROVISION("Provision"),
    ORDER("Order"),
    RECOMMENDATION("Recommendation"),
    NOTICE("Notice");

    private static final Map<String, BlockKind> BY_TAG = new HashMap<>();
    private static final Map<String, BlockKind> BY_LOWER_TAG = new HashMap<>();

    static {
        for (BlockKind kind : values()) {
            BY_TAG.put(kind.tag, kind);
            if (kind.caseInsensitive) {
                BY_LOWER_TAG.put(kind.tag.toLowerCase(Locale.ROOT), kind);
            }
        }
    }

    private final String tag;
    private final boolean caseInsensitive;

    BlockKind(String tag) {
        this(tag, false);
    }

    BlockKind(String tag, boolean caseInsensitive) {
        this.tag = tag;
        this.caseInsensitive = caseInsensitive;
    }

    public String getTag() {
        return tag;
    }

    /**
     * @return the kind for an element name, or null when the name is not a plain block
     */
    public static BlockKind fromTag(String tag) {
        BlockKind kind = BY_TAG.get(tag);
        if (kind != null) {
            return kind;
        }
        return BY_LOWER_TAG.get(tag.toLowerCase(Locale.ROOT));
    }
}
