package im.arun.legisindex.definitions;

import im.arun.legisindex.model.Language;
import lombok.Value;

/**
 * Where a definition sits: document language and id, and the label of the section
 * that holds it.
 */
@Value
public class TermOwner {
    Language language;
    String actId;
    String regulationId;
    String sectionLabel;
}
