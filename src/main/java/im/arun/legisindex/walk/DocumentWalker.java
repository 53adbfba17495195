package im.arun.legisindex.walk;

import im.arun.legisindex.content.ContentTreeBuilder;
import im.arun.legisindex.definitions.DefinedTermExtractor;
import im.arun.legisindex.definitions.ScopeResolver;
import im.arun.legisindex.definitions.TermOwner;
import im.arun.legisindex.extract.ContentFlagsExtractor;
import im.arun.legisindex.extract.MetadataExtractor;
import im.arun.legisindex.extract.ReferenceExtractor;
import im.arun.legisindex.extract.TreatyExtractor;
import im.arun.legisindex.model.ContentFlags;
import im.arun.legisindex.model.DefinitionScope;
import im.arun.legisindex.model.Footnote;
import im.arun.legisindex.model.HistoricalNote;
import im.arun.legisindex.model.InternalReference;
import im.arun.legisindex.model.Language;
import im.arun.legisindex.model.LegislationType;
import im.arun.legisindex.model.ParsedSection;
import im.arun.legisindex.model.SectionContentTree;
import im.arun.legisindex.model.SectionStatus;
import im.arun.legisindex.model.SectionType;
import im.arun.legisindex.model.TreatyContent;
import im.arun.legisindex.model.content.ContentNode;
import im.arun.legisindex.util.Dates;
import im.arun.legisindex.xml.Elements;
import im.arun.legisindex.xml.TextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static im.arun.legisindex.xml.Elements.attr;
import static im.arun.legisindex.xml.Elements.child;
import static im.arun.legisindex.xml.Elements.children;

/**
 * Walks a document once and emits, for every section, provision, schedule item,
 * heading and enacting clause, both its {@link ParsedSection} and its
 * {@link SectionContentTree}. Defined terms, cross-references and treaties are
 * collected on the same visit.
 *
 * <p>Both records of a pair are built from the same list of child nodes, so the
 * rendered content tree always equals the section content.
 */
public class DocumentWalker {
    private static final Logger logger = LoggerFactory.getLogger(DocumentWalker.class);

    /**
     * Children kept out of a record's body; label and marginal note have their own fields.
     */
    private static final Set<String> METADATA_CHILDREN =
            Set.of("Label", "MarginalNote", "HistoricalNote", "HistoricalNoteSubItem");

    /**
     * Document parts described by the metadata record instead of by sections.
     */
    private static final Set<String> NOT_WALKED = Set.of(
            "Identification", "TableOfProvisions", "RecentAmendments", "Recommendation", "Notice",
            "ScheduleFormHeading");

    private final ContentTreeBuilder treeBuilder = new ContentTreeBuilder();
    private final ReferenceExtractor references;
    private final DefinedTermExtractor terms;
    private final boolean headingRecords;

    public DocumentWalker(ReferenceExtractor references, DefinedTermExtractor terms, boolean headingRecords) {
        this.references = references;
        this.terms = terms;
        this.headingRecords = headingRecords;
    }

    /**
     * Walks the children of a {@code Statute} or {@code Regulation} root.
     *
     * @return the finished context holding every record produced
     */
    public WalkContext walk(Element root, LegislationType type, Language language, String actId,
                            String regulationId) {
        WalkContext ctx = new WalkContext(type, language, actId, regulationId);
        visitChildren(root, ctx);
        logger.debug("Walked {} ({}): {} records, {} defined terms, {} cross-references",
                ctx.idBase(), language.getCode(), ctx.getSections().size(),
                ctx.getDefinedTerms().size(), ctx.getCrossReferences().size());
        return ctx;
    }

    private void visitChildren(Element parent, WalkContext ctx) {
        for (Element child : children(parent)) {
            visit(child, ctx);
        }
    }

    private void visit(Element el, WalkContext ctx) {
        String tag = Elements.localName(el);
        if (NOT_WALKED.contains(tag)) {
            return;
        }
        if (TreatyExtractor.isTreaty(el)) {
            TreatyContent treaty = TreatyExtractor.extract(el);
            if (treaty != null) {
                ctx.getTreaties().add(treaty);
            }
            return;
        }
        boolean inSchedule = ctx.getSchedule() != null;
        switch (tag) {
            case "Heading":
                heading(el, ctx);
                break;
            case "Enacts":
                enacts(el, ctx);
                break;
            case "Preamble":
                preamble(el, ctx);
                break;
            case "Section":
                section(el, ctx);
                break;
            case "Provision":
                provision(el, ctx);
                break;
            case "Schedule":
                schedule(el, ctx);
                break;
            case "List":
                if (inSchedule) {
                    scheduleItems(el, List.of(ctx.getSchedule().getLabel()), ctx);
                } else {
                    visitChildren(el, ctx);
                }
                break;
            case "FormGroup":
                if (inSchedule) {
                    formGroup(el, ctx);
                } else {
                    visitChildren(el, ctx);
                }
                break;
            case "TableGroup":
                if (inSchedule) {
                    tableGroup(el, ctx);
                } else {
                    visitChildren(el, ctx);
                }
                break;
            case "DocumentInternal":
                if (inSchedule) {
                    documentInternal(el, List.of(), ctx);
                } else {
                    visitChildren(el, ctx);
                }
                break;
            default:
                // Body, Introduction, Order, BillPiece, RelatedOrNotInForce, RegulationPiece,
                // Group and BilingualGroup only wrap records
                visitChildren(el, ctx);
        }
    }

    private void heading(Element el, WalkContext ctx) {
        Integer level = Elements.intAttr(el, "level");
        String headingText = MetadataExtractor.headingText(el);
        ctx.enterHeading(level != null && level > 0 ? level : 1, headingText);
        if (!headingRecords) {
            return;
        }

        int order = ctx.nextSectionOrder();
        List<Node> nodes = List.of(el);
        ParsedSection section = record(el, TextExtractor.text(nodes), ctx)
                .canonicalSectionId(ctx.idPrefix() + "/heading/" + order)
                .sectionLabel(headingText.isEmpty() ? "Heading" : headingText)
                .sectionOrder(order)
                .sectionType(SectionType.HEADING)
                .hierarchyPath(ctx.hierarchySnapshot())
                .status(SectionStatus.IN_FORCE)
                .build();
        emit(el, nodes, section, ctx, false);
    }

    private void enacts(Element el, WalkContext ctx) {
        boolean present = !ctx.getSections().isEmpty()
                && ctx.getSections().get(0).getSectionType() == SectionType.ENACTS;
        List<Node> nodes = contentNodes(el);
        String content = TextExtractor.text(nodes);
        if (present || content.isEmpty()) {
            return;
        }
        ParsedSection section = record(el, content, ctx)
                .canonicalSectionId(ctx.idPrefix() + "/enacts")
                .sectionLabel("Enacting Clause")
                .sectionOrder(0)
                .sectionType(SectionType.ENACTS)
                .hierarchyPath(List.of())
                .status(SectionStatus.IN_FORCE)
                .build();
        emit(el, nodes, section, ctx, true);
    }

    private void preamble(Element el, WalkContext ctx) {
        int n = 0;
        for (Element provision : children(el, "Provision")) {
            List<Node> nodes = contentNodes(provision);
            String content = TextExtractor.text(nodes);
            if (content.isEmpty()) {
                continue;
            }
            n++;
            int order = ctx.nextSectionOrder();
            ParsedSection section = record(provision, content, ctx)
                    .canonicalSectionId(ctx.idPrefix() + "/preamble/" + order)
                    .sectionLabel("Preamble " + n)
                    .sectionOrder(order)
                    .sectionType(SectionType.PREAMBLE)
                    .hierarchyPath(ctx.hierarchySnapshot())
                    .marginalNote(TextExtractor.innerTextOrNull(child(provision, "MarginalNote")))
                    .status(MetadataExtractor.status(provision))
                    .build();
            emit(provision, nodes, section, ctx, false);
        }
    }

    private void section(Element el, WalkContext ctx) {
        String label = TextExtractor.textOrNull(child(el, "Label"));
        if (label == null) {
            return;
        }
        int order = ctx.nextSectionOrder();
        List<Node> nodes = contentNodes(el);
        String content = TextExtractor.text(nodes);

        String xmlType = attr(el, "type");
        ScheduleContext schedule = ctx.getSchedule();
        SectionType type;
        if ("amending".equals(xmlType) || "CIF".equals(xmlType)) {
            type = SectionType.AMENDING;
        } else if (schedule != null) {
            type = schedule.sectionType();
        } else {
            type = SectionType.SECTION;
        }
        String id = ctx.idPrefix() + "/" + type.getValue() + "/" + order
                + (schedule != null ? "/sch-" + schedule.slug() : "") + "/s" + label;

        ParsedSection section = record(el, content, ctx)
                .canonicalSectionId(id)
                .sectionLabel(label)
                .sectionOrder(order)
                .sectionType(type)
                .hierarchyPath(ctx.hierarchySnapshot())
                .marginalNote(TextExtractor.innerTextOrNull(child(el, "MarginalNote")))
                .status(MetadataExtractor.sectionStatus(el, content))
                .xmlType(xmlType)
                .xmlTarget(attr(el, "target"))
                .build();
        emit(el, nodes, section, ctx, false);
        sectionDefinitions(el, label, ctx);
    }

    /**
     * Definitions of a section. The lead-in sentence that sets their scope is the
     * section's own text, or failing that the first subsection text.
     */
    private void sectionDefinitions(Element el, String label, WalkContext ctx) {
        TermOwner owner = new TermOwner(ctx.getLanguage(), ctx.getActId(), ctx.getRegulationId(), label);
        Element text = child(el, "Text");
        DefinitionScope scope = scopeOf(text, label, ctx);

        for (Element subsection : children(el, "Subsection")) {
            Element subsectionText = child(subsection, "Text");
            if (scope == null) {
                scope = scopeOf(subsectionText, label, ctx);
            }
            List<Element> definitions = children(subsection, "Definition");
            for (Element definition : definitions) {
                ctx.getDefinedTerms().addAll(terms.fromDefinition(definition, owner,
                        orDocument(scope, ctx), ctx.nextDefinitionOrder()));
            }
            if (definitions.isEmpty() && DefinedTermExtractor.hasInlineTerm(subsectionText)) {
                ctx.getDefinedTerms().addAll(terms.fromInlineText(subsectionText, owner,
                        orDocument(scope, ctx), ctx.nextDefinitionOrder()));
            }
        }

        List<Element> definitions = children(el, "Definition");
        for (Element definition : definitions) {
            ctx.getDefinedTerms().addAll(terms.fromDefinition(definition, owner,
                    orDocument(scope, ctx), ctx.nextDefinitionOrder()));
        }
        if (definitions.isEmpty() && DefinedTermExtractor.hasInlineTerm(text)) {
            ctx.getDefinedTerms().addAll(terms.fromInlineText(text, owner,
                    orDocument(scope, ctx), ctx.nextDefinitionOrder()));
        }
    }

    private DefinitionScope scopeOf(Element text, String label, WalkContext ctx) {
        if (text == null) {
            return null;
        }
        String scopeText = TextExtractor.text(text);
        return scopeText.isEmpty() ? null : ScopeResolver.resolve(scopeText, label, ctx.getType());
    }

    private DefinitionScope orDocument(DefinitionScope scope, WalkContext ctx) {
        return scope != null ? scope : ctx.documentScope();
    }

    private void provision(Element el, WalkContext ctx) {
        int order = ctx.nextSectionOrder();
        String label = TextExtractor.textOrNull(child(el, "Label"));
        if (label == null) {
            label = "order-" + order;
        }
        List<Node> nodes = contentNodes(el);
        ParsedSection section = record(el, TextExtractor.text(nodes), ctx)
                .canonicalSectionId(ctx.idPrefix() + "/provision/" + order + "/" + label)
                .sectionLabel(label)
                .sectionOrder(order)
                .sectionType(SectionType.PROVISION)
                .hierarchyPath(ctx.hierarchySnapshot())
                .marginalNote(TextExtractor.innerTextOrNull(child(el, "MarginalNote")))
                .status(MetadataExtractor.status(el))
                .provisionHeading(MetadataExtractor.provisionHeading(el))
                .build();
        emit(el, nodes, section, ctx, false);

        TermOwner owner = new TermOwner(ctx.getLanguage(), ctx.getActId(), ctx.getRegulationId(), label);
        for (Element definition : children(el, "Definition")) {
            ctx.getDefinedTerms().addAll(terms.fromDefinition(definition, owner, ctx.documentScope(),
                    ctx.nextDefinitionOrder()));
        }
    }

    private void schedule(Element el, WalkContext ctx) {
        WalkContext.Saved saved = ctx.enterSchedule(ScheduleContext.of(el, ctx.getLanguage()));
        visitChildren(el, ctx);
        ctx.leaveSchedule(saved);
    }

    private void scheduleItems(Element list, List<String> path, WalkContext ctx) {
        ScheduleContext schedule = ctx.getSchedule();
        for (Element item : children(list, "Item")) {
            String itemLabel = TextExtractor.textOrNull(child(item, "Label"));
            List<Node> nodes = contentNodes(item);
            String content = TextExtractor.text(nodes);
            if (!content.isEmpty()) {
                int order = ctx.nextSectionOrder();
                SectionType type = schedule.sectionType();
                String id = ctx.idPrefix() + "/" + type.getValue() + "/" + order + "/sch-" + schedule.slug()
                        + (itemLabel != null ? "-" + itemLabel : "-item");
                SectionStatus status = child(item, "Repealed") != null
                        ? SectionStatus.REPEALED
                        : MetadataExtractor.status(item);
                ParsedSection section = record(item, content, ctx)
                        .canonicalSectionId(id)
                        .sectionLabel(schedule.getLabel() + " Item " + (itemLabel != null ? itemLabel : order))
                        .sectionOrder(order)
                        .sectionType(type)
                        .hierarchyPath(List.copyOf(path))
                        .status(status)
                        .build();
                emit(item, nodes, section, ctx, false);
            }

            for (Element nested : children(item, "List")) {
                List<String> nestedPath = new ArrayList<>(path);
                nestedPath.add(itemLabel != null ? itemLabel : "Item " + ctx.getSectionOrder());
                scheduleItems(nested, nestedPath, ctx);
            }
        }
    }

    private void formGroup(Element el, WalkContext ctx) {
        List<Node> nodes = childNodes(el);
        String content = TextExtractor.text(nodes);
        if (content.isEmpty()) {
            return;
        }
        ScheduleContext schedule = ctx.getSchedule();
        int order = ctx.nextSectionOrder();
        ParsedSection section = record(el, content, ctx)
                .canonicalSectionId(ctx.idPrefix() + "/" + SectionType.FORM.getValue() + "/" + order
                        + "/sch-" + schedule.slug() + "-fg")
                .sectionLabel(schedule.getLabel())
                .sectionOrder(order)
                .sectionType(SectionType.FORM)
                .hierarchyPath(List.of(schedule.getLabel()))
                .marginalNote(schedule.getTitle())
                .status(SectionStatus.IN_FORCE)
                .build();
        emit(el, nodes, section, ctx, false);
    }

    private void tableGroup(Element el, WalkContext ctx) {
        List<Node> nodes = childNodes(el);
        String content = TextExtractor.text(nodes);
        if (content.isEmpty()) {
            return;
        }
        ScheduleContext schedule = ctx.getSchedule();
        int order = ctx.nextSectionOrder();
        SectionType type = schedule.sectionType();
        ContentFlags flags = ContentFlagsExtractor.extract(el);
        flags = (flags != null ? flags.toBuilder() : ContentFlags.builder()).hasTable(true).build();
        ParsedSection section = record(el, content, ctx)
                .canonicalSectionId(ctx.idPrefix() + "/" + type.getValue() + "/" + order
                        + "/sch-" + schedule.slug() + "-tbl")
                .sectionLabel(schedule.getLabel() + " Table")
                .sectionOrder(order)
                .sectionType(type)
                .hierarchyPath(List.of(schedule.getLabel()))
                .status(SectionStatus.IN_FORCE)
                .contentFlags(flags)
                .build();
        emit(el, nodes, section, ctx, false);
    }

    /**
     * Provisions of an agreement or other internal document reproduced in a schedule.
     * Group headings extend both the label and the hierarchy.
     */
    private void documentInternal(Element container, List<String> groupPath, WalkContext ctx) {
        ScheduleContext schedule = ctx.getSchedule();
        for (Element child : children(container)) {
            if (Elements.is(child, "Group")) {
                Element groupHeading = child(child, "GroupHeading");
                String heading = groupHeading != null ? MetadataExtractor.headingText(groupHeading) : "";
                List<String> nested = new ArrayList<>(groupPath);
                if (!heading.isEmpty()) {
                    nested.add(heading);
                }
                documentInternal(child, nested, ctx);
            } else if (Elements.is(child, "Provision")) {
                List<Node> nodes = contentNodes(child);
                String content = TextExtractor.text(nodes);
                if (content.isEmpty()) {
                    continue;
                }
                int order = ctx.nextSectionOrder();
                String provisionLabel = TextExtractor.textOrNull(child(child, "Label"));
                List<String> labelParts = new ArrayList<>();
                labelParts.add(schedule.getLabel());
                labelParts.addAll(groupPath);
                labelParts.add(provisionLabel != null ? provisionLabel : "Provision " + order);
                List<String> hierarchy = new ArrayList<>();
                hierarchy.add(schedule.getLabel());
                hierarchy.addAll(groupPath);

                SectionType type = schedule.sectionType();
                ParsedSection section = record(child, content, ctx)
                        .canonicalSectionId(ctx.idPrefix() + "/" + type.getValue() + "/" + order
                                + "/sch-" + schedule.slug() + "-prov")
                        .sectionLabel(String.join(" ", labelParts))
                        .sectionOrder(order)
                        .sectionType(type)
                        .hierarchyPath(List.copyOf(hierarchy))
                        .status(MetadataExtractor.status(child))
                        .provisionHeading(MetadataExtractor.provisionHeading(child))
                        .build();
                emit(child, nodes, section, ctx, false);
            }
        }
    }

    /**
     * Fields every record takes from its element and the enclosing schedule.
     */
    private ParsedSection.ParsedSectionBuilder record(Element el, String content, WalkContext ctx) {
        List<HistoricalNote> historicalNotes = MetadataExtractor.historicalNotes(el);
        List<Footnote> footnotes = MetadataExtractor.footnotes(el);
        List<InternalReference> internalReferences = references.internalReferences(el);
        ParsedSection.ParsedSectionBuilder builder = ParsedSection.builder()
                .language(ctx.getLanguage())
                .content(content)
                .changeType(MetadataExtractor.changeType(el))
                .inForceStartDate(Dates.parseDate(attr(el, "lims:inforce-start-date")))
                .lastAmendedDate(Dates.parseDate(attr(el, "lims:lastAmendedDate")))
                .enactedDate(Dates.parseDate(attr(el, "lims:enacted-date")))
                .limsMetadata(MetadataExtractor.lims(el))
                .historicalNotes(historicalNotes.isEmpty() ? null : historicalNotes)
                .footnotes(footnotes.isEmpty() ? null : footnotes)
                .contentFlags(ContentFlagsExtractor.extract(el))
                .formattingAttributes(MetadataExtractor.formatting(el))
                .internalReferences(internalReferences.isEmpty() ? null : internalReferences)
                .actId(ctx.getActId())
                .regulationId(ctx.getRegulationId());
        ScheduleContext schedule = ctx.getSchedule();
        if (schedule != null) {
            builder.scheduleId(schedule.getId())
                    .scheduleBilingual(schedule.getBilingual())
                    .scheduleSpanLanguages(schedule.getSpanLanguages())
                    .scheduleOriginatingRef(schedule.getOriginatingRef());
        }
        return builder;
    }

    private void emit(Element el, List<Node> nodes, ParsedSection section, WalkContext ctx, boolean first) {
        List<ContentNode> tree = treeBuilder.build(nodes);
        String limsId = MetadataExtractor.limsId(el);
        SectionContentTree contentTree = SectionContentTree.builder()
                .joinKey(SectionContentTree.joinKeyFor(limsId, section.getSectionOrder()))
                .limsId(limsId)
                .sectionOrder(section.getSectionOrder())
                .canonicalSectionId(section.getCanonicalSectionId())
                .sectionLabel(section.getSectionLabel())
                .hierarchyPath(section.getHierarchyPath())
                .contentTree(tree)
                .build();
        if (first) {
            ctx.addFirst(section, contentTree);
        } else {
            ctx.add(section, contentTree);
        }
        ctx.getCrossReferences().addAll(references.crossReferences(el, ctx.getActId(), ctx.getRegulationId(),
                section.getSectionLabel()));
    }

    /**
     * Child nodes of a record element without its label, marginal note and historical
     * notes.
     */
    private static List<Node> contentNodes(Element el) {
        List<Node> result = new ArrayList<>();
        for (Node node : childNodes(el)) {
            if (node.getNodeType() == Node.ELEMENT_NODE && METADATA_CHILDREN.contains(Elements.localName(node))) {
                continue;
            }
            result.add(node);
        }
        return result;
    }

    private static List<Node> childNodes(Element el) {
        NodeList nodes = el.getChildNodes();
        List<Node> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add(nodes.item(i));
        }
        return result;
    }
}
