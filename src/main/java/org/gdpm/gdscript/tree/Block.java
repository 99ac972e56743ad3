package org.gdpm.gdscript.tree;

import java.util.List;

/**
 * Lines sharing one indentation level, in source order. Never contains blank lines.
 */
public record Block(List<Line> lines) {

    public Block {
        lines = List.copyOf(lines);
    }

    public static Block of(Line... lines) {
        return new Block(List.of(lines));
    }

    public int size() {
        return lines.size();
    }

    public Line line(int index) {
        return lines.get(index);
    }
}
