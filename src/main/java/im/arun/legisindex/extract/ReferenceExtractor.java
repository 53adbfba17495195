package im.arun.legisindex.extract;

import im.arun.legisindex.model.InternalReference;
import im.arun.legisindex.model.ParsedCrossReference;
import im.arun.legisindex.xml.Elements;
import im.arun.legisindex.xml.TextExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Collects references to other legislation ({@code XRefExternal}) and links within the
 * same document ({@code XRefInternal}).
 */
public class ReferenceExtractor {

    private final Set<String> crossReferenceTypes;

    /**
     * @param crossReferenceTypes {@code reference-type} values kept as cross-references,
     *                            usually {@code act} and {@code regulation}
     */
    public ReferenceExtractor(Set<String> crossReferenceTypes) {
        this.crossReferenceTypes = Set.copyOf(crossReferenceTypes);
    }

    public List<ParsedCrossReference> crossReferences(Element root, String actId, String regulationId,
                                                      String sectionLabel) {
        List<ParsedCrossReference> refs = new ArrayList<>();
        for (Element xref : Elements.descendants(root, "XRefExternal")) {
            String link = Elements.attr(xref, "link");
            String refType = Elements.attr(xref, "reference-type");
            if (link == null || refType == null || !crossReferenceTypes.contains(refType)) {
                continue;
            }
            refs.add(ParsedCrossReference.builder()
                    .sourceActId(actId)
                    .sourceRegulationId(regulationId)
                    .sourceSectionLabel(sectionLabel)
                    .targetType(refType)
                    .targetRef(link)
                    .referenceText(TextExtractor.textOrNull(xref))
                    .build());
        }
        return refs;
    }

    public List<InternalReference> internalReferences(Element root) {
        List<InternalReference> refs = new ArrayList<>();
        for (Element xref : Elements.descendants(root, "XRefInternal")) {
            String targetId = firstAttr(xref, "id", "idref", "link", "target");
            String text = TextExtractor.textOrNull(xref);
            if (text == null && targetId == null) {
                continue;
            }
            refs.add(InternalReference.builder()
                    .targetLabel(text != null ? text : targetId)
                    .targetId(targetId)
                    .referenceText(text != null ? text : targetId)
                    .build());
        }
        return refs;
    }

    private static String firstAttr(Element el, String... names) {
        for (String name : names) {
            String value = Elements.attr(el, name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
