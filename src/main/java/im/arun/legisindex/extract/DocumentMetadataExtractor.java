package im.arun.legisindex.extract;

import im.arun.legisindex.model.Amendment;
import im.arun.legisindex.model.BillHistory;
import im.arun.legisindex.model.EnablingAuthority;
import im.arun.legisindex.model.EnablingAuthorityOrder;
import im.arun.legisindex.model.Footnote;
import im.arun.legisindex.model.InternalReference;
import im.arun.legisindex.model.LimsMetadata;
import im.arun.legisindex.model.PreambleProvision;
import im.arun.legisindex.model.PublicationItem;
import im.arun.legisindex.model.RegulationMakerOrder;
import im.arun.legisindex.model.RelatedProvision;
import im.arun.legisindex.model.SignatureBlock;
import im.arun.legisindex.model.TableOfProvisionsEntry;
import im.arun.legisindex.util.Dates;
import im.arun.legisindex.xml.Elements;
import im.arun.legisindex.xml.TextExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static im.arun.legisindex.xml.Elements.attr;
import static im.arun.legisindex.xml.Elements.child;
import static im.arun.legisindex.xml.Elements.children;
import static im.arun.legisindex.xml.TextExtractor.textOrNull;

/**
 * Document-level structures found in {@code Identification}, {@code Introduction} and
 * around the body: bill history, amendments, preamble, related provisions, signature
 * blocks, table of provisions and the regulation-specific order blocks.
 *
 * <p>Every method returns null (or an empty list) when the structure is absent.
 */
public class DocumentMetadataExtractor {

    private final ReferenceExtractor referenceExtractor;

    public DocumentMetadataExtractor(ReferenceExtractor referenceExtractor) {
        this.referenceExtractor = referenceExtractor;
    }

    public BillHistory billHistory(Element identification) {
        if (identification == null) {
            return null;
        }
        String billNumber = textOrNull(child(identification, "BillNumber"));
        Element ref = child(identification, "BillRefNumber");

        BillHistory.Parliament parliament = null;
        Element parl = child(identification, "Parliament");
        if (parl != null) {
            Element regnal = child(parl, "RegnalYear");
            parliament = BillHistory.Parliament.builder()
                    .session(textOrNull(child(parl, "Session")))
                    .number(textOrNull(child(parl, "Number")))
                    .years(textOrNull(child(parl, "Year-s")))
                    .regnalYear(regnal != null ? textOrNull(child(regnal, "Year-s")) : null)
                    .monarch(regnal != null ? textOrNull(child(regnal, "Monarch")) : null)
                    .build();
        }

        List<BillHistory.Stage> stages = new ArrayList<>();
        Element history = child(identification, "BillHistory");
        if (history != null) {
            for (Element stage : children(history, "Stages")) {
                String name = attr(stage, "stage");
                if (name != null) {
                    stages.add(new BillHistory.Stage(name, date(child(stage, "Date"))));
                }
            }
        }

        if (billNumber == null && parliament == null && stages.isEmpty()) {
            return null;
        }
        return BillHistory.builder()
                .billNumber(billNumber)
                .billOrigin(attr(identification, "bill-origin"))
                .billType(attr(identification, "bill-type"))
                .parliament(parliament)
                .stages(stages.isEmpty() ? null : stages)
                .refNumber(textOrNull(ref))
                .refDateTime(attr(ref, "date-time"))
                .build();
    }

    public List<Amendment> recentAmendments(Element doc) {
        Element recent = child(doc, "RecentAmendments");
        if (recent == null) {
            return null;
        }
        List<Amendment> amendments = new ArrayList<>();
        for (Element amendment : children(recent, "Amendment")) {
            Element citation = child(amendment, "AmendmentCitation");
            String citationText = textOrNull(citation);
            if (citationText != null) {
                amendments.add(new Amendment(citationText,
                        textOrNull(child(amendment, "AmendmentDate")),
                        attr(citation, "link")));
            }
        }
        return nullIfEmpty(amendments);
    }

    public RegulationMakerOrder regulationMakerOrder(Element identification) {
        Element rmo = child(identification, "RegulationMakerOrder");
        if (rmo == null) {
            return null;
        }
        String maker = textOrNull(child(rmo, "RegulationMaker"));
        String number = textOrNull(child(rmo, "OrderNumber"));
        String date = date(child(rmo, "Date"));
        if (maker == null && number == null && date == null) {
            return null;
        }
        return new RegulationMakerOrder(maker, number, date);
    }

    /**
     * The {@code Order} block of a regulation ("His Excellency the Governor General in
     * Council ... makes the annexed Regulations").
     */
    public EnablingAuthorityOrder enablingAuthorityOrder(Element regulation) {
        Element order = child(regulation, "Order");
        if (order == null) {
            return null;
        }
        String text = textOrNull(order);
        if (text == null) {
            return null;
        }
        return EnablingAuthorityOrder.builder()
                .text(text)
                .footnotes(nullIfEmpty(MetadataExtractor.footnotes(order)))
                .limsMetadata(MetadataExtractor.lims(order))
                .build();
    }

    public List<EnablingAuthority> enablingAuthorities(Element identification) {
        Element authority = child(identification, "EnablingAuthority");
        if (authority == null) {
            return null;
        }
        List<EnablingAuthority> result = new ArrayList<>();
        for (Element xref : children(authority, "XRefExternal")) {
            String link = attr(xref, "link");
            String title = textOrNull(xref);
            if (link != null && title != null) {
                result.add(new EnablingAuthority(link, title));
            }
        }
        return nullIfEmpty(result);
    }

    public List<PreambleProvision> preamble(Element introduction) {
        Element preamble = child(introduction, "Preamble");
        if (preamble == null) {
            return null;
        }
        List<PreambleProvision> provisions = new ArrayList<>();
        for (Element provision : children(preamble, "Provision")) {
            String text = textOrNull(provision);
            if (text != null) {
                String marginalNote = TextExtractor.innerTextOrNull(child(provision, "MarginalNote"));
                provisions.add(new PreambleProvision(text, marginalNote));
            }
        }
        return nullIfEmpty(provisions);
    }

    public List<RelatedProvision> relatedProvisions(Element doc) {
        Element related = child(doc, "RelatedProvisions");
        if (related == null) {
            related = Elements.path(doc, "Body", "RelatedProvisions");
        }
        if (related == null) {
            return null;
        }
        List<RelatedProvision> result = new ArrayList<>();
        for (Element rp : children(related, "RelatedProvision")) {
            String label = attr(rp, "label");
            String source = attr(rp, "source");
            String text = textOrNull(rp);
            List<String> sections = new ArrayList<>();
            for (Element section : children(rp, "Section")) {
                String sectionText = textOrNull(section);
                if (sectionText != null) {
                    sections.add(sectionText);
                }
            }
            if (text != null || label != null || source != null || !sections.isEmpty()) {
                result.add(RelatedProvision.builder()
                        .label(label)
                        .source(source)
                        .sections(nullIfEmpty(sections))
                        .text(text)
                        .build());
            }
        }
        return nullIfEmpty(result);
    }

    /**
     * {@code Recommendation} or {@code Notice} blocks. {@code sourceSections} lists the
     * distinct internal reference labels found in the block.
     */
    public List<PublicationItem> publicationItems(List<Element> items, String type) {
        List<PublicationItem> result = new ArrayList<>();
        for (Element item : items) {
            String content = TextExtractor.text(item);
            String requirement = "notice".equals(type) ? attr(item, "publication-requirement") : null;
            LimsMetadata lims = MetadataExtractor.lims(item);
            List<Footnote> footnotes = MetadataExtractor.footnotes(item);
            List<InternalReference> refs = referenceExtractor.internalReferences(item);
            Set<String> sourceSections = new LinkedHashSet<>();
            for (InternalReference ref : refs) {
                if (ref.getTargetLabel() != null && !ref.getTargetLabel().isEmpty()) {
                    sourceSections.add(ref.getTargetLabel());
                }
            }
            if (!content.isEmpty() || requirement != null || lims != null || !refs.isEmpty() || !footnotes.isEmpty()) {
                result.add(PublicationItem.builder()
                        .type(type)
                        .content(content)
                        .publicationRequirement(requirement)
                        .sourceSections(sourceSections.isEmpty() ? null : new ArrayList<>(sourceSections))
                        .limsMetadata(lims)
                        .footnotes(nullIfEmpty(footnotes))
                        .build());
            }
        }
        return nullIfEmpty(result);
    }

    public List<SignatureBlock> signatureBlocks(Element doc) {
        List<SignatureBlock> blocks = new ArrayList<>();
        for (Element block : Elements.descendants(doc, "SignatureBlock")) {
            List<SignatureBlock.Line> lines = new ArrayList<>();
            for (Element line : children(block, "SignatureLine")) {
                String name = textOrNull(child(line, "SignatureName"));
                String title = textOrNull(child(line, "SignatureTitle"));
                if (name != null || title != null) {
                    lines.add(SignatureBlock.Line.builder()
                            .signatureName(name)
                            .signatureTitle(title)
                            .signatureDate(date(child(line, "Date")))
                            .signatureLocation(textOrNull(child(line, "Location")))
                            .build());
                }
            }
            String witness = textOrNull(child(block, "WitnessClause"));
            String doneAt = textOrNull(child(block, "DoneAt"));
            if (!lines.isEmpty() || witness != null || doneAt != null) {
                blocks.add(SignatureBlock.builder()
                        .lines(lines)
                        .witnessClause(witness)
                        .doneAt(doneAt)
                        .build());
            }
        }
        return nullIfEmpty(blocks);
    }

    public List<TableOfProvisionsEntry> tableOfProvisions(Element doc) {
        List<TableOfProvisionsEntry> entries = new ArrayList<>();
        for (Element top : Elements.descendants(doc, "TableOfProvisions")) {
            for (Element tp : children(top, "TitleProvision")) {
                addTitleProvision(tp, 1, entries);
            }
        }
        return nullIfEmpty(entries);
    }

    private void addTitleProvision(Element tp, int level, List<TableOfProvisionsEntry> entries) {
        String label = textOrNull(child(tp, "Label"));
        String title = textOrNull(child(tp, "TitleText"));
        if (title == null) {
            title = textOrNull(tp);
        }
        if (label != null || title != null) {
            entries.add(new TableOfProvisionsEntry(label != null ? label : "", title != null ? title : "", level));
        }
        for (Element nested : children(tp, "TitleProvision")) {
            addTitleProvision(nested, level + 1, entries);
        }
    }

    /**
     * ISO date from a {@code Date} element with {@code YYYY}/{@code MM}/{@code DD} children.
     */
    public static String date(Element dateEl) {
        if (dateEl == null) {
            return null;
        }
        return Dates.fromParts(textOrNull(child(dateEl, "YYYY")),
                textOrNull(child(dateEl, "MM")),
                textOrNull(child(dateEl, "DD")));
    }

    static <T> List<T> nullIfEmpty(List<T> values) {
        return values == null || values.isEmpty() ? null : values;
    }
}
