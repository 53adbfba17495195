package im.arun.legisindex.walk;

import im.arun.legisindex.model.Language;
import im.arun.legisindex.model.SectionType;
import im.arun.legisindex.xml.Elements;
import im.arun.legisindex.xml.TextExtractor;
import lombok.Value;
import org.w3c.dom.Element;

import java.util.Locale;

/**
 * Attributes of the schedule that encloses the element being walked.
 */
@Value
public class ScheduleContext {
    String id;
    String bilingual;
    String spanLanguages;
    String label;
    String title;
    String originatingRef;
    String headingType;

    /**
     * Reads the context of a {@code Schedule} element. The label falls back to the
     * schedule id, then to the generic word for schedule in the document language.
     */
    public static ScheduleContext of(Element schedule, Language language) {
        String id = Elements.attr(schedule, "id");
        Element heading = Elements.child(schedule, "ScheduleFormHeading");
        String label = null;
        String title = null;
        String originatingRef = null;
        String headingType = null;
        if (heading != null) {
            label = TextExtractor.textOrNull(Elements.child(heading, "Label"));
            title = TextExtractor.textOrNull(Elements.child(heading, "TitleText"));
            originatingRef = TextExtractor.textOrNull(Elements.child(heading, "OriginatingRef"));
            headingType = Elements.attr(heading, "type");
        }
        if (label == null) {
            label = id != null ? id : (language == Language.FR ? "Annexe" : "Schedule");
        }
        return new ScheduleContext(id, Elements.attr(schedule, "bilingual"),
                Elements.attr(schedule, "spanlanguages"), label, title, originatingRef, headingType);
    }

    /**
     * Not-in-force schedules hold amending provisions rather than schedule content.
     */
    public SectionType sectionType() {
        return "NifProvs".equals(id) || "amending".equals(headingType) ? SectionType.AMENDING : SectionType.SCHEDULE;
    }

    /**
     * Label as used inside canonical ids: {@code "Schedule I"} becomes {@code "schedule-i"}.
     */
    public String slug() {
        return label.replaceAll("\\s+", "-").toLowerCase(Locale.ROOT);
    }
}
