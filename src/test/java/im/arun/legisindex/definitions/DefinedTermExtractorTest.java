package im.arun.legisindex.definitions;

import im.arun.legisindex.Fixtures;
import im.arun.legisindex.model.DefinitionScope;
import im.arun.legisindex.model.Language;
import im.arun.legisindex.model.ParsedDefinedTerm;
import im.arun.legisindex.model.ScopeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DefinedTermExtractor Tests")
class DefinedTermExtractorTest {

    private static final TermOwner ENGLISH_ACT = new TermOwner(Language.EN, "A-0.6", null, "2");
    private static final DefinitionScope ACT_SCOPE = DefinitionScope.of(ScopeType.ACT, "In this Act,");

    private final DefinedTermExtractor extractor = new DefinedTermExtractor(true, 6, 60);

    @Test
    @DisplayName("should pair an English term with its marked French equivalent")
    void shouldPairTerms_whenBothLanguagesAreMarked() {
        Element definition = Fixtures.element("<Definition lims:id=\"32\"><Text>"
                + "<DefinedTermEn>barrier</DefinedTermEn> means anything that hinders participation. "
                + "(<DefinedTermFr>obstacle</DefinedTermFr>)</Text></Definition>");

        List<ParsedDefinedTerm> terms = extractor.fromDefinition(definition, ENGLISH_ACT, ACT_SCOPE, 3);

        assertThat(terms).hasSize(1);
        ParsedDefinedTerm term = terms.get(0);
        assertThat(term.getTerm()).isEqualTo("barrier");
        assertThat(term.getTermNormalized()).isEqualTo("barrier");
        assertThat(term.getPairedTerm()).isEqualTo("obstacle");
        assertThat(term.getDefinition())
                .isEqualTo("barrier means anything that hinders participation. (obstacle)");
        assertThat(term.getLanguage()).isEqualTo(Language.EN);
        assertThat(term.getActId()).isEqualTo("A-0.6");
        assertThat(term.getSectionLabel()).isEqualTo("2");
        assertThat(term.getDefinitionOrder()).isEqualTo(3);
        assertThat(term.getScopeType()).isEqualTo(ScopeType.ACT);
        assertThat(term.getScopeRawText()).isEqualTo("In this Act,");
        assertThat(term.getLimsMetadata().getId()).isEqualTo("32");
    }

    @Test
    @DisplayName("should pair several terms by position")
    void shouldPairByPosition_whenTermCountsMatch() {
        Element definition = Fixtures.element("<Definition><Text>"
                + "<DefinedTermEn>employer</DefinedTermEn> or <DefinedTermEn>employing body</DefinedTermEn> "
                + "means a person. (<DefinedTermFr>employeur</DefinedTermFr> ou "
                + "<DefinedTermFr>organisme employeur</DefinedTermFr>)</Text></Definition>");

        List<ParsedDefinedTerm> terms = extractor.fromDefinition(definition, ENGLISH_ACT, ACT_SCOPE, 1);

        assertThat(terms).extracting(ParsedDefinedTerm::getTerm).containsExactly("employer", "employing body");
        assertThat(terms).extracting(ParsedDefinedTerm::getPairedTerm)
                .containsExactly("employeur", "organisme employeur");
    }

    @Test
    @DisplayName("should share a single other-language term between all primary terms")
    void shouldShareSingleTerm_whenOnlyOneOtherLanguageTermExists() {
        Element definition = Fixtures.element("<Definition><Text>"
                + "<DefinedTermEn>Minister</DefinedTermEn> or <DefinedTermEn>responsible Minister</DefinedTermEn> "
                + "means the Minister of Employment. (<DefinedTermFr>ministre</DefinedTermFr>)</Text></Definition>");

        List<ParsedDefinedTerm> terms = extractor.fromDefinition(definition, ENGLISH_ACT, ACT_SCOPE, 1);

        assertThat(terms).extracting(ParsedDefinedTerm::getPairedTerm).containsExactly("ministre", "ministre");
    }

    @Test
    @DisplayName("should treat the French term as primary in a French document")
    void shouldUseFrenchTermAsPrimary_whenOwnerIsFrench() {
        Element definition = Fixtures.element("<Definition><Text>"
                + "<DefinedTermFr>obstacle</DefinedTermFr> Tout élément qui nuit à la participation. "
                + "(<DefinedTermEn>barrier</DefinedTermEn>)</Text></Definition>");
        TermOwner owner = new TermOwner(Language.FR, "A-0.6", null, "2");

        List<ParsedDefinedTerm> terms = extractor.fromDefinition(definition, owner, ACT_SCOPE, 1);

        assertThat(terms).hasSize(1);
        assertThat(terms.get(0).getTerm()).isEqualTo("obstacle");
        assertThat(terms.get(0).getPairedTerm()).isEqualTo("barrier");
        assertThat(terms.get(0).getLanguage()).isEqualTo(Language.FR);
    }

    @Test
    @DisplayName("should fall back to a short italic span when the other language is not marked")
    void shouldPairWithItalicSpan_whenOtherLanguageIsUnmarked() {
        Element definition = Fixtures.element("<Definition><Text>"
                + "<DefinedTermEn>vessel</DefinedTermEn> means a ship of any kind. "
                + "(<Emphasis style=\"italic\">navire</Emphasis>)</Text></Definition>");

        List<ParsedDefinedTerm> terms = extractor.fromDefinition(definition, ENGLISH_ACT, ACT_SCOPE, 1);

        assertThat(terms.get(0).getPairedTerm()).isEqualTo("navire");
    }

    @Test
    @DisplayName("should pick up italic text that is not a term, a known weakness of the fallback")
    void shouldPairWithLatinPhrase_whenItalicTextIsNotATerm() {
        Element definition = Fixtures.element("<Definition><Text>"
                + "<DefinedTermEn>goods</DefinedTermEn> includes, <Emphasis style=\"italic\">inter alia</Emphasis>, "
                + "wares and merchandise.</Text></Definition>");

        List<ParsedDefinedTerm> terms = extractor.fromDefinition(definition, ENGLISH_ACT, ACT_SCOPE, 1);

        assertThat(terms.get(0).getPairedTerm()).isEqualTo("inter alia");
    }

    @Test
    @DisplayName("should ignore emphasis that is not italic")
    void shouldNotPair_whenEmphasisIsBold() {
        Element definition = Fixtures.element("<Definition><Text>"
                + "<DefinedTermEn>vessel</DefinedTermEn> means a ship. "
                + "(<Emphasis style=\"bold\">navire</Emphasis>)</Text></Definition>");

        List<ParsedDefinedTerm> terms = extractor.fromDefinition(definition, ENGLISH_ACT, ACT_SCOPE, 1);

        assertThat(terms.get(0).getPairedTerm()).isNull();
    }

    @Test
    @DisplayName("should reject italic spans that read like sentences or citations")
    void shouldNotPair_whenItalicSpanIsASentenceOrCitation() {
        Element sentence = Fixtures.element("<Definition><Text>"
                + "<DefinedTermEn>vessel</DefinedTermEn> has the meaning in "
                + "<Emphasis style=\"italic\">the Canada Shipping Act.</Emphasis></Text></Definition>");
        Element citation = Fixtures.element("<Definition><Text>"
                + "<DefinedTermEn>vessel</DefinedTermEn> has the meaning in "
                + "<Emphasis style=\"italic\">S.C. 2001</Emphasis></Text></Definition>");

        assertThat(extractor.fromDefinition(sentence, ENGLISH_ACT, ACT_SCOPE, 1).get(0).getPairedTerm()).isNull();
        assertThat(extractor.fromDefinition(citation, ENGLISH_ACT, ACT_SCOPE, 1).get(0).getPairedTerm()).isNull();
    }

    @Test
    @DisplayName("should leave terms unpaired when the emphasis fallback is switched off")
    void shouldNotPair_whenEmphasisPairingIsDisabled() {
        DefinedTermExtractor strict = new DefinedTermExtractor(false, 6, 60);
        Element definition = Fixtures.element("<Definition><Text>"
                + "<DefinedTermEn>vessel</DefinedTermEn> means a ship. "
                + "(<Emphasis style=\"italic\">navire</Emphasis>)</Text></Definition>");

        List<ParsedDefinedTerm> terms = strict.fromDefinition(definition, ENGLISH_ACT, ACT_SCOPE, 1);

        assertThat(terms.get(0).getPairedTerm()).isNull();
    }

    @Test
    @DisplayName("should return nothing for a definition without term markers")
    void shouldReturnEmpty_whenDefinitionHasNoTerms() {
        Element definition = Fixtures.element("<Definition><Text>Words in the singular include the plural.</Text></Definition>");

        assertThat(extractor.fromDefinition(definition, ENGLISH_ACT, ACT_SCOPE, 1)).isEmpty();
    }

    @Test
    @DisplayName("should read terms marked directly in section text")
    void shouldExtractInlineTerm_whenTextHasNoDefinitionWrapper() {
        Element text = Fixtures.element("<Text>In this section, <DefinedTermEn>designated person</DefinedTermEn> "
                + "means a person designated under section 30. (<DefinedTermFr>personne désignée</DefinedTermFr>)</Text>");
        DefinitionScope scope = DefinitionScope.ofSections(List.of("29"), "In this section,");

        assertThat(DefinedTermExtractor.hasInlineTerm(text)).isTrue();
        List<ParsedDefinedTerm> terms = extractor.fromInlineText(text, ENGLISH_ACT, scope, 4);

        assertThat(terms).hasSize(1);
        assertThat(terms.get(0).getTerm()).isEqualTo("designated person");
        assertThat(terms.get(0).getPairedTerm()).isEqualTo("personne désignée");
        assertThat(terms.get(0).getScopeType()).isEqualTo(ScopeType.SECTION);
        assertThat(terms.get(0).getScopeSections()).containsExactly("29");
        assertThat(terms.get(0).getLimsMetadata()).isNull();
    }

    @Test
    @DisplayName("should not report inline terms for plain text")
    void shouldNotDetectInlineTerm_whenTextHasNoMarkers() {
        assertThat(DefinedTermExtractor.hasInlineTerm(Fixtures.element("<Text>Plain text.</Text>"))).isFalse();
        assertThat(DefinedTermExtractor.hasInlineTerm(null)).isFalse();
    }
}
