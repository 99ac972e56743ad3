package org.gdpm.gdscript.tree;

public enum UnOp {
    PLUS,
    MINUS,
    NOT
}
