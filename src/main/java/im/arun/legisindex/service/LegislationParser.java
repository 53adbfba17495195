package im.arun.legisindex.service;

import im.arun.legisindex.config.LegisIndexConfig;
import im.arun.legisindex.definitions.DefinedTermExtractor;
import im.arun.legisindex.exception.LegislationParseException;
import im.arun.legisindex.extract.DocumentMetadataExtractor;
import im.arun.legisindex.extract.MetadataExtractor;
import im.arun.legisindex.extract.ReferenceExtractor;
import im.arun.legisindex.model.EnablingAuthority;
import im.arun.legisindex.model.Language;
import im.arun.legisindex.model.LegislationType;
import im.arun.legisindex.model.ParsedAct;
import im.arun.legisindex.model.ParsedDocument;
import im.arun.legisindex.model.ParsedRegulation;
import im.arun.legisindex.util.Dates;
import im.arun.legisindex.util.RegulationIds;
import im.arun.legisindex.walk.DocumentWalker;
import im.arun.legisindex.walk.WalkContext;
import im.arun.legisindex.xml.Elements;
import im.arun.legisindex.xml.TextExtractor;
import im.arun.legisindex.xml.XmlDocumentLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;

import static im.arun.legisindex.xml.Elements.attr;
import static im.arun.legisindex.xml.Elements.child;
import static im.arun.legisindex.xml.Elements.path;

/**
 * Entry point for turning one Justice Canada XML file into a {@link ParsedDocument}.
 *
 * <p>Only a missing root element, a missing document identifier or malformed XML is
 * fatal. Everything else that is absent is simply left out of the result.
 *
 * <p>Instances hold no per-document state and may be shared between threads.
 */
public class LegislationParser {
    private static final Logger logger = LoggerFactory.getLogger(LegislationParser.class);

    private final XmlDocumentLoader loader;
    private final DocumentWalker walker;
    private final DocumentMetadataExtractor metadata;

    public LegislationParser() {
        this(new LegisIndexConfig());
    }

    public LegislationParser(LegisIndexConfig config) {
        ReferenceExtractor references = new ReferenceExtractor(new LinkedHashSet<>(config.getCrossReferenceTypes()));
        DefinedTermExtractor terms = new DefinedTermExtractor(config.isEmphasisPairing(),
                config.getEmphasisMaxWords(), config.getEmphasisMaxLength());
        this.loader = new XmlDocumentLoader();
        this.walker = new DocumentWalker(references, terms, config.isHeadingRecords());
        this.metadata = new DocumentMetadataExtractor(references);
    }

    /**
     * Parses a statute.
     *
     * @param language document language, or null to read it from the root {@code xml:lang}
     */
    public ParsedDocument parseAct(String xml, Language language) throws LegislationParseException {
        Element root = loader.load(xml).getDocumentElement();
        if (!Elements.is(root, "Statute")) {
            throw new LegislationParseException("Invalid Act XML: missing Statute element");
        }
        return parseAct(root, language);
    }

    /**
     * Parses a regulation.
     *
     * @param language document language, or null to read it from the root {@code xml:lang}
     */
    public ParsedDocument parseRegulation(String xml, Language language) throws LegislationParseException {
        Element root = loader.load(xml).getDocumentElement();
        if (!Elements.is(root, "Regulation")) {
            throw new LegislationParseException("Invalid Regulation XML: missing Regulation element");
        }
        return parseRegulation(root, language);
    }

    /**
     * Parses a statute or regulation, chosen by the root element.
     */
    public ParsedDocument parse(String xml, Language language) throws LegislationParseException {
        Document document = loader.load(xml);
        Element root = document.getDocumentElement();
        if (Elements.is(root, "Statute")) {
            return parseAct(root, language);
        }
        if (Elements.is(root, "Regulation")) {
            return parseRegulation(root, language);
        }
        throw new LegislationParseException("Unknown document type");
    }

    public ParsedDocument parseFile(Path file, Language language) throws IOException, LegislationParseException {
        String xml = Files.readString(file, StandardCharsets.UTF_8);
        try {
            return parse(xml, language);
        } catch (LegislationParseException e) {
            throw new LegislationParseException(e.getMessage() + " in " + file, e);
        }
    }

    private ParsedDocument parseAct(Element statute, Language requested) throws LegislationParseException {
        Language language = resolveLanguage(statute, requested);
        Element identification = child(statute, "Identification");
        Element chapter = child(identification, "Chapter");
        Element consolidatedNumber = child(chapter, "ConsolidatedNumber");

        String actId = TextExtractor.textOrNull(consolidatedNumber);
        if (actId == null) {
            actId = TextExtractor.textOrNull(child(chapter, "OfficialNumber"));
        }
        if (actId == null) {
            throw new LegislationParseException("Invalid Act XML: missing act ID");
        }

        WalkContext walk = walker.walk(statute, LegislationType.ACT, language, actId, null);

        Element shortTitle = child(identification, "ShortTitle");
        Element annualStatute = child(chapter, "AnnualStatuteId");
        ParsedAct act = ParsedAct.builder()
                .actId(actId)
                .language(language)
                .title(TextExtractor.textOrNull(shortTitle))
                .longTitle(TextExtractor.textOrNull(child(identification, "LongTitle")))
                .runningHead(TextExtractor.textOrNull(child(identification, "RunningHead")))
                .status(MetadataExtractor.status(statute))
                .inForceDate(Dates.parseDate(attr(statute, "lims:inforce-start-date")))
                .consolidationDate(Dates.parseDate(attr(statute, "lims:current-date")))
                .lastAmendedDate(Dates.parseDate(attr(statute, "lims:lastAmendedDate")))
                .enactedDate(Dates.parseDate(attr(statute, "lims:enacted-date")))
                .billOrigin(attr(statute, "bill-origin"))
                .billType(attr(statute, "bill-type"))
                .hasPreviousVersion(attr(statute, "hasPreviousVersion"))
                .consolidatedNumber(TextExtractor.textOrNull(consolidatedNumber))
                .consolidatedNumberOfficial(oneOf(attr(consolidatedNumber, "official"), "yes", "no"))
                .annualStatuteYear(TextExtractor.textOrNull(child(annualStatute, "YYYY")))
                .annualStatuteChapter(TextExtractor.textOrNull(child(annualStatute, "AnnualStatuteNumber")))
                .shortTitleStatus(oneOf(attr(shortTitle, "status"), "official", "unofficial"))
                .limsMetadata(MetadataExtractor.lims(statute))
                .billHistory(metadata.billHistory(identification))
                .recentAmendments(metadata.recentAmendments(statute))
                .preamble(metadata.preamble(child(statute, "Introduction")))
                .relatedProvisions(metadata.relatedProvisions(statute))
                .treaties(nullIfEmpty(walk.getTreaties()))
                .signatureBlocks(metadata.signatureBlocks(statute))
                .tableOfProvisions(metadata.tableOfProvisions(statute))
                .build();

        logger.debug("Parsed act {} ({}) with {} sections", actId, language.getCode(), walk.getSections().size());
        return document(LegislationType.ACT, language, walk).act(act).build();
    }

    private ParsedDocument parseRegulation(Element regulation, Language requested)
            throws LegislationParseException {
        Language language = resolveLanguage(regulation, requested);
        Element identification = child(regulation, "Identification");
        String instrumentNumber = TextExtractor.textOrNull(child(identification, "InstrumentNumber"));
        if (instrumentNumber == null) {
            throw new LegislationParseException("Invalid Regulation XML: missing instrument number");
        }
        String regulationId = RegulationIds.normalize(instrumentNumber);

        WalkContext walk = walker.walk(regulation, LegislationType.REGULATION, language, null, regulationId);

        String shortTitle = TextExtractor.textOrNull(child(identification, "ShortTitle"));
        String longTitle = TextExtractor.textOrNull(child(identification, "LongTitle"));
        List<EnablingAuthority> enablingAuthorities = metadata.enablingAuthorities(identification);
        EnablingAuthority firstAuthority = enablingAuthorities != null ? enablingAuthorities.get(0) : null;

        ParsedRegulation parsed = ParsedRegulation.builder()
                .regulationId(regulationId)
                .language(language)
                .instrumentNumber(instrumentNumber)
                .regulationType(attr(regulation, "regulation-type"))
                .gazettePart(attr(regulation, "gazette-part"))
                .title(shortTitle != null ? shortTitle : longTitle)
                .longTitle(longTitle)
                .enablingAuthorities(enablingAuthorities)
                .enablingActId(firstAuthority != null ? firstAuthority.getActId() : null)
                .enablingActTitle(firstAuthority != null ? firstAuthority.getActTitle() : null)
                .status(MetadataExtractor.status(regulation))
                .hasPreviousVersion(attr(regulation, "hasPreviousVersion"))
                .registrationDate(DocumentMetadataExtractor.date(path(identification, "RegistrationDate", "Date")))
                .consolidationDate(DocumentMetadataExtractor.date(path(identification, "ConsolidationDate", "Date")))
                .lastAmendedDate(Dates.parseDate(attr(regulation, "lims:lastAmendedDate")))
                .limsMetadata(MetadataExtractor.lims(regulation))
                .regulationMakerOrder(metadata.regulationMakerOrder(identification))
                .enablingAuthorityOrder(metadata.enablingAuthorityOrder(regulation))
                .recentAmendments(metadata.recentAmendments(regulation))
                .relatedProvisions(metadata.relatedProvisions(regulation))
                .treaties(nullIfEmpty(walk.getTreaties()))
                .recommendations(metadata.publicationItems(
                        Elements.children(regulation, "Recommendation"), "recommendation"))
                .notices(metadata.publicationItems(Elements.children(regulation, "Notice"), "notice"))
                .signatureBlocks(metadata.signatureBlocks(regulation))
                .tableOfProvisions(metadata.tableOfProvisions(regulation))
                .build();

        logger.debug("Parsed regulation {} ({}) with {} sections", regulationId, language.getCode(),
                walk.getSections().size());
        return document(LegislationType.REGULATION, language, walk).regulation(parsed).build();
    }

    private ParsedDocument.ParsedDocumentBuilder document(LegislationType type, Language language, WalkContext walk) {
        return ParsedDocument.builder()
                .type(type)
                .language(language)
                .sections(List.copyOf(walk.getSections()))
                .contentTrees(List.copyOf(walk.getContentTrees()))
                .definedTerms(List.copyOf(walk.getDefinedTerms()))
                .crossReferences(List.copyOf(walk.getCrossReferences()))
                .finalSectionOrder(walk.getSectionOrder());
    }

    private static Language resolveLanguage(Element root, Language requested) {
        return requested != null ? requested : Language.fromCode(attr(root, "xml:lang"));
    }

    private static String oneOf(String value, String... allowed) {
        for (String candidate : allowed) {
            if (candidate.equals(value)) {
                return value;
            }
        }
        return null;
    }

    private static <T> List<T> nullIfEmpty(List<T> values) {
        return values.isEmpty() ? null : List.copyOf(values);
    }
}
