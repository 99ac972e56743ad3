package org.gdpm.gdscript.grammar;

import org.gdpm.gdscript.parser.ParseResult;
import org.gdpm.gdscript.parser.ParsingContext;
import org.gdpm.gdscript.tree.Block;
import org.gdpm.gdscript.tree.Line;

import java.util.ArrayList;

/**
 * Assembles lines into blocks by indentation.
 *
 * <p>A block is the longest run of lines at one indentation. Blank lines never end a block;
 * whole-line comments at the block's indentation become {@link Line.Comment} lines, comments
 * at any other indentation are skipped.
 */
public final class BlockGrammar {
    private final ParsingContext ctx;
    private final ScriptGrammar grammar;

    BlockGrammar(ParsingContext ctx, ScriptGrammar grammar) {
        this.ctx = ctx;
        this.grammar = grammar;
    }

    /**
     * One or more lines at exactly {@code indent} spaces.
     */
    public ParseResult<Block> block(int indent) {
        return ctx.rule("block", () -> {
            var lines = new ArrayList<Line>();
            while (true) {
                var mark = ctx.location();
                skipForeignLines(indent);
                if (ctx.isAtEnd()) {
                    ctx.restoreLocation(mark);
                    break;
                }
                var next = line(indent);
                if (next.isFailure()) {
                    ctx.restoreLocation(mark);
                    break;
                }
                lines.add(next.unwrap());
            }
            if (lines.isEmpty()) {
                return ctx.failure("statement");
            }
            return ctx.success(new Block(lines));
        });
    }

    /**
     * Skips blank lines and comment lines that are not indented exactly {@code indent} spaces.
     */
    private void skipForeignLines(int indent) {
        while (true) {
            if (base().skipBlankLine()) {
                continue;
            }
            boolean ownComment = base().scanIndentation() == indent && ctx.peek(indent) == '#';
            if (ownComment || !base().skipCommentLine()) {
                return;
            }
        }
    }

    /**
     * A single line at {@code indent}: declaration, statement, bare expression or comment,
     * then optional {@code ;} or trailing comment, then the line ending. Lines that end with
     * a nested block have already consumed their line endings.
     */
    public ParseResult<Line> line(int indent) {
        return ctx.rule("line", () -> {
            var aligned = base().sameIndent(indent);
            if (aligned.isFailure()) {
                return aligned.propagate();
            }
            var content = ctx.<Line>choice("line",
                                           () -> grammar.declarations().decl(indent).map(decl -> decl),
                                           () -> grammar.statements().stmt(indent).map(stmt -> stmt),
                                           () -> grammar.expressions().expr().map(expr -> expr),
                                           () -> base().comment().map(Line::comment));
            if (content.isFailure()) {
                return content;
            }
            if (ctx.atLineStart()) {
                return content;
            }
            var end = base().endOfLine();
            if (end.isFailure()) {
                return end.propagate();
            }
            return ctx.success(content.unwrap());
        });
    }

    /**
     * Block after a {@code :} header: optional trailing comment, line ending, then a block whose
     * indentation is set by its first code line and must exceed {@code parentIndent}.
     */
    public ParseResult<Block> indentedBlock(int parentIndent) {
        return ctx.rule("indented_block", () -> {
            base().ws();
            if (ctx.peek() == '#') {
                base().comment();
            }
            var eol = base().lineEnding();
            if (eol.isFailure()) {
                return eol.propagate();
            }
            var mark = ctx.location();
            base().skipEmptyLines();
            var deeper = base().moreIndent(parentIndent);
            if (deeper.isFailure()) {
                return deeper.propagate();
            }
            ctx.restoreLocation(mark);
            return ctx.nested(() -> block(deeper.unwrap()));
        });
    }

    private BaseGrammar base() {
        return grammar.base();
    }
}
