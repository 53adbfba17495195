package im.arun.legisindex.extract;

import im.arun.legisindex.model.ChangeType;
import im.arun.legisindex.model.Footnote;
import im.arun.legisindex.model.FormattingAttributes;
import im.arun.legisindex.model.HistoricalNote;
import im.arun.legisindex.model.LimsMetadata;
import im.arun.legisindex.model.ProvisionHeading;
import im.arun.legisindex.model.SectionStatus;
import im.arun.legisindex.util.Dates;
import im.arun.legisindex.xml.Elements;
import im.arun.legisindex.xml.TextExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import static im.arun.legisindex.xml.Elements.attr;

/**
 * Element-level metadata: LIMS tracking attributes, change markers, status, layout
 * attributes, historical notes, footnotes and provision headings.
 */
public final class MetadataExtractor {

    private static final Pattern REPEALED_NOTICE = Pattern.compile("^\\[Repealed.*\\]$|^\\[Abrogé.*\\]$");
    private static final Set<String> JUSTIFICATIONS = Set.of("left", "right", "center", "justified");

    private MetadataExtractor() {}

    public static LimsMetadata lims(Element el) {
        String fid = attr(el, "lims:fid");
        String id = attr(el, "lims:id");
        String enactedDate = Dates.parseDate(attr(el, "lims:enacted-date"));
        String enactId = attr(el, "lims:enactId");
        String pitDate = Dates.parseDate(attr(el, "lims:pit-date"));
        String currentDate = Dates.parseDate(attr(el, "lims:current-date"));
        String inForceStartDate = Dates.parseDate(attr(el, "lims:inforce-start-date"));
        if (fid == null && id == null && enactedDate == null && enactId == null
                && pitDate == null && currentDate == null && inForceStartDate == null) {
            return null;
        }
        return LimsMetadata.builder()
                .fid(fid)
                .id(id)
                .enactedDate(enactedDate)
                .enactId(enactId)
                .pitDate(pitDate)
                .currentDate(currentDate)
                .inForceStartDate(inForceStartDate)
                .build();
    }

    public static String limsId(Element el) {
        return attr(el, "lims:id");
    }

    public static ChangeType changeType(Element el) {
        return ChangeType.fromAttribute(attr(el, "change"));
    }

    /**
     * Document or element status from {@code @in-force} alone.
     */
    public static SectionStatus status(Element el) {
        return "no".equals(attr(el, "in-force")) ? SectionStatus.NOT_IN_FORCE : SectionStatus.IN_FORCE;
    }

    /**
     * A section is repealed when it carries a direct {@code Repealed} child, when its
     * {@code Text} holds nothing but a {@code Repealed} element, or when its whole text is
     * a bracketed repeal notice. A {@code Repealed} deeper down only repeals a part.
     */
    public static boolean isRepealed(Element section, String content) {
        if (Elements.child(section, "Repealed") != null) {
            return true;
        }
        Element text = Elements.child(section, "Text");
        if (text != null) {
            List<Element> children = Elements.children(text);
            if (children.size() == 1 && Elements.is(children.get(0), "Repealed")) {
                return true;
            }
        }
        return content != null && REPEALED_NOTICE.matcher(content.trim()).matches();
    }

    public static SectionStatus sectionStatus(Element section, String content) {
        if (isRepealed(section, content)) {
            return SectionStatus.REPEALED;
        }
        return status(section);
    }

    public static FormattingAttributes formatting(Element el) {
        String justification = attr(el, "justification");
        if (justification != null) {
            justification = justification.toLowerCase(Locale.ROOT);
            if (!JUSTIFICATIONS.contains(justification)) {
                justification = null;
            }
        }
        FormattingAttributes attrs = FormattingAttributes.builder()
                .indentLevel(Elements.intAttr(el, "indent-level"))
                .firstLineIndent(attr(el, "first-line-indent"))
                .subsequentLineIndent(attr(el, "subsequent-line-indent"))
                .justification(justification)
                .hyphenation(Elements.yesNoAttr(el, "hyphenation"))
                .pointSize(Elements.intAttr(el, "pointsize"))
                .keepWithNext(Elements.yesNoAttr(el, "keep-with-next"))
                .keepWithPrevious(Elements.yesNoAttr(el, "keep-with-previous"))
                .topMarginSpacing(attr(el, "topmarginspacing"))
                .bottomMarginSpacing(attr(el, "bottommarginspacing"))
                .formatRef(attr(el, "format-ref"))
                .listItem(Elements.yesNoAttr(el, "list-item"))
                .languageAlign(Elements.yesNoAttr(el, "language-align"))
                .fontStyle(attr(el, "font-style"))
                .build();
        return attrs.equals(FormattingAttributes.builder().build()) ? null : attrs;
    }

    /**
     * Historical notes attached directly to an element. Each sub-item becomes one note;
     * a note without sub-items becomes a single note of its whole text.
     */
    public static List<HistoricalNote> historicalNotes(Element el) {
        Element note = Elements.child(el, "HistoricalNote");
        if (note == null) {
            return List.of();
        }
        List<HistoricalNote> notes = new ArrayList<>();
        for (Element item : Elements.children(note, "HistoricalNoteSubItem")) {
            String text = TextExtractor.innerText(item);
            if (!text.isEmpty()) {
                notes.add(HistoricalNote.builder()
                        .text(text)
                        .type(attr(item, "type"))
                        .enactedDate(Dates.parseDate(attr(item, "lims:enacted-date")))
                        .inForceStartDate(Dates.parseDate(attr(item, "lims:inforce-start-date")))
                        .enactId(attr(item, "lims:enactId"))
                        .build());
            }
        }
        if (notes.isEmpty()) {
            String text = TextExtractor.innerText(note);
            if (!text.isEmpty()) {
                notes.add(HistoricalNote.builder().text(text).build());
            }
        }
        return notes;
    }

    /**
     * Footnotes anywhere under an element. Footnotes without an id are ignored.
     */
    public static List<Footnote> footnotes(Element el) {
        List<Footnote> footnotes = new ArrayList<>();
        collectFootnotes(el, footnotes);
        return footnotes;
    }

    private static void collectFootnotes(Element parent, List<Footnote> out) {
        for (Element child : Elements.children(parent)) {
            if (Elements.is(child, "Footnote")) {
                String id = attr(child, "id");
                if (id != null) {
                    Element label = Elements.child(child, "Label");
                    Element text = Elements.child(child, "Text");
                    out.add(Footnote.builder()
                            .id(id)
                            .label(label != null ? TextExtractor.textOrNull(label) : null)
                            .text(text != null ? TextExtractor.text(text) : TextExtractor.text(child))
                            .placement(attr(child, "placement"))
                            .status(attr(child, "status"))
                            .build());
                }
            } else {
                collectFootnotes(child, out);
            }
        }
    }

    public static ProvisionHeading provisionHeading(Element provision) {
        Element heading = Elements.child(provision, "ProvisionHeading");
        if (heading == null) {
            return null;
        }
        String text = TextExtractor.text(heading);
        if (text.isEmpty()) {
            return null;
        }
        return ProvisionHeading.builder()
                .text(text)
                .formatRef(attr(heading, "format-ref"))
                .limsMetadata(lims(heading))
                .build();
    }

    /**
     * {@code "<Label> <TitleText>"} of a heading-like element, skipping missing parts.
     */
    public static String headingText(Element heading) {
        String label = TextExtractor.textOrNull(Elements.child(heading, "Label"));
        String title = TextExtractor.textOrNull(Elements.child(heading, "TitleText"));
        if (label != null && title != null) {
            return label + " " + title;
        }
        return label != null ? label : (title != null ? title : "");
    }
}
