package org.gdpm.gdscript.tree;

/**
 * Dotted type reference, e.g. {@code Node2D} or {@code Inventory.Item}.
 */
public record TypeName(String name) {

    public static TypeName of(String name) {
        return new TypeName(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
