package org.gdpm.gdscript.error;

import org.gdpm.gdscript.tree.SourceLocation;

/**
 * Grammar rule that was active when a failure happened, with the location where the rule started.
 */
public record ContextFrame(String label, SourceLocation location) {

    public static ContextFrame at(String label, SourceLocation location) {
        return new ContextFrame(label, location);
    }

    @Override
    public String toString() {
        return label + " at " + location;
    }
}
