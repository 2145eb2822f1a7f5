package im.arun.tlfextract.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What the classifier reads off a TLF heading page. Two pages belong to the
 * same TLF when their ids are exactly equal.
 */
@Value
@AllArgsConstructor
public class TlfIdentity {
    String id;
    TlfKind kind;
    String title;
    /** Null when the page carries no "Population:" line. */
    String population;
    /** Null when no "Source:" footer was found. */
    String sourceProgram;
}
