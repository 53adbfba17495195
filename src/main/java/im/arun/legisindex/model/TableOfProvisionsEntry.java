package im.arun.legisindex.model;

import lombok.Value;

@Value
public class TableOfProvisionsEntry {
    String label;
    String title;
    int level;
}
