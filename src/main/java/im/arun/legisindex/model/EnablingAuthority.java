package im.arun.legisindex.model;

import lombok.Value;

/**
 * An act under whose authority a regulation is made.
 */
@Value
public class EnablingAuthority {
    String actId;
    String actTitle;
}
