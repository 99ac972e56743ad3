package org.gdpm.gdscript.parser;

import org.gdpm.gdscript.tree.Block;
import org.gdpm.gdscript.tree.Expr;

/**
 * Parser interface - turns GDScript text into a syntax tree.
 */
public interface ScriptParser {

    /**
     * Parse a whole script. Only blank and comment lines may follow the last parsed line.
     */
    Block parse(String source) throws ParseException;

    /**
     * Parse text holding exactly one expression.
     */
    Expr parseExpression(String source) throws ParseException;

    ParserConfig config();
}
