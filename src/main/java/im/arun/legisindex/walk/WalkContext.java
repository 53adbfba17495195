package im.arun.legisindex.walk;

import im.arun.legisindex.model.DefinitionScope;
import im.arun.legisindex.model.Language;
import im.arun.legisindex.model.LegislationType;
import im.arun.legisindex.model.ParsedCrossReference;
import im.arun.legisindex.model.ParsedDefinedTerm;
import im.arun.legisindex.model.ParsedSection;
import im.arun.legisindex.model.ScopeType;
import im.arun.legisindex.model.SectionContentTree;
import im.arun.legisindex.model.TreatyContent;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one document walk. Created per parse and never shared between
 * threads.
 *
 * <p>{@code sections} and {@code contentTrees} grow in lock step; the enacting clause
 * is always placed first in both.
 */
@Getter
public class WalkContext {
    private final LegislationType type;
    private final Language language;
    private final String actId;
    private final String regulationId;

    private final List<ParsedSection> sections = new ArrayList<>();
    private final List<SectionContentTree> contentTrees = new ArrayList<>();
    private final List<ParsedDefinedTerm> definedTerms = new ArrayList<>();
    private final List<ParsedCrossReference> crossReferences = new ArrayList<>();
    private final List<TreatyContent> treaties = new ArrayList<>();

    private int sectionOrder;
    private int definitionOrder;
    private List<String> hierarchy = new ArrayList<>();
    private ScheduleContext schedule;

    public WalkContext(LegislationType type, Language language, String actId, String regulationId) {
        this.type = type;
        this.language = language;
        this.actId = actId;
        this.regulationId = regulationId;
    }

    public String idBase() {
        return actId != null ? actId : regulationId;
    }

    /**
     * Prefix shared by every canonical id of this document: {@code <id>/<lang>}.
     */
    public String idPrefix() {
        return idBase() + "/" + language.getCode();
    }

    public int nextSectionOrder() {
        return ++sectionOrder;
    }

    public int nextDefinitionOrder() {
        return ++definitionOrder;
    }

    public DefinitionScope documentScope() {
        return DefinitionScope.of(ScopeType.forDocument(type), null);
    }

    public List<String> hierarchySnapshot() {
        return List.copyOf(hierarchy);
    }

    /**
     * Applies a heading: drops every entry at or below its level, then adds its text.
     */
    public void enterHeading(int level, String headingText) {
        while (hierarchy.size() >= level && !hierarchy.isEmpty()) {
            hierarchy.remove(hierarchy.size() - 1);
        }
        if (!headingText.isEmpty()) {
            hierarchy.add(headingText);
        }
    }

    /**
     * Enters a schedule and returns the state to hand back to {@link #leaveSchedule}.
     */
    public Saved enterSchedule(ScheduleContext context) {
        Saved saved = new Saved(new ArrayList<>(hierarchy), schedule);
        hierarchy.add(context.getLabel());
        schedule = context;
        return saved;
    }

    public void leaveSchedule(Saved saved) {
        hierarchy = saved.hierarchy;
        schedule = saved.schedule;
    }

    public void add(ParsedSection section, SectionContentTree tree) {
        sections.add(section);
        contentTrees.add(tree);
    }

    public void addFirst(ParsedSection section, SectionContentTree tree) {
        sections.add(0, section);
        contentTrees.add(0, tree);
    }

    /**
     * Hierarchy and schedule in force before a schedule was entered.
     */
    public static final class Saved {
        private final List<String> hierarchy;
        private final ScheduleContext schedule;

        private Saved(List<String> hierarchy, ScheduleContext schedule) {
            this.hierarchy = hierarchy;
            this.schedule = schedule;
        }
    }
}
