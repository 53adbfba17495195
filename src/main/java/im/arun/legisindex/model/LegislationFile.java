package im.arun.legisindex.model;

import lombok.Value;

import java.nio.file.Path;

/**
 * A candidate XML file found by directory discovery.
 */
@Value
public class LegislationFile {
    Path path;
    LegislationType type;
    Language language;
    String id;
}
