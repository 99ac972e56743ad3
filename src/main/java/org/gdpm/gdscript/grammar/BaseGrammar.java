package org.gdpm.gdscript.grammar;

import org.gdpm.gdscript.parser.ParseResult;
import org.gdpm.gdscript.parser.ParsingContext;
import org.gdpm.gdscript.tree.TypeName;

/**
 * Lexical primitives shared by all grammar rules: whitespace, comments, line endings,
 * identifiers, keywords and indentation.
 *
 * <p>Indentation is measured in spaces only. A tab at the start of a line is never counted,
 * so tab-indented scripts do not parse.
 */
public final class BaseGrammar {
    private final ParsingContext ctx;

    BaseGrammar(ParsingContext ctx) {
        this.ctx = ctx;
    }

    // === Character Classes ===

    static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isInlineSpace(char c) {
        return c == ' ' || c == '\t';
    }

    // === Whitespace ===

    /**
     * Skips spaces and tabs.
     */
    public void ws() {
        while (isInlineSpace(ctx.peek())) {
            ctx.advance();
        }
    }

    /**
     * Skips whitespace including line endings and {@code #} comments.
     */
    public void wsl() {
        while (!ctx.isAtEnd()) {
            char c = ctx.peek();
            if (isInlineSpace(c) || c == '\n' || c == '\r') {
                ctx.advance();
            } else if (c == '#') {
                skipToLineEnd();
            } else {
                return;
            }
        }
    }

    /**
     * Whitespace around binary operators and separators: lines may break only inside brackets.
     */
    public void operatorSpace() {
        if (ctx.inBrackets()) {
            wsl();
        } else {
            ws();
        }
    }

    private void skipToLineEnd() {
        while (!ctx.isAtEnd() && ctx.peek() != '\n' && ctx.peek() != '\r') {
            ctx.advance();
        }
    }

    // === Tokens ===

    public ParseResult<String> literal(String text) {
        if (ctx.consume(text)) {
            return ctx.success(text);
        }
        return ctx.failure("'" + text + "'");
    }

    /**
     * Matches a reserved word that is not immediately followed by an identifier character.
     */
    public ParseResult<String> keyword(String word) {
        if (ctx.lookingAt(word) && !isIdentPart(ctx.peek(word.length()))) {
            ctx.advance(word.length());
            return ctx.success(word);
        }
        return ctx.failure("'" + word + "'");
    }

    public boolean lookingAtKeyword(String word) {
        return ctx.lookingAt(word) && !isIdentPart(ctx.peek(word.length()));
    }

    /**
     * Letter or underscore followed by letters, digits and underscores.
     */
    public ParseResult<String> identifier() {
        return ctx.rule("ident", () -> {
            if (!isIdentStart(ctx.peek())) {
                return ctx.failure("identifier");
            }
            int start = ctx.pos();
            while (isIdentPart(ctx.peek())) {
                ctx.advance();
            }
            return ctx.success(ctx.substring(start, ctx.pos()));
        });
    }

    /**
     * Type reference such as {@code Node2D} or {@code Inventory.Item}.
     */
    public ParseResult<TypeName> typeName() {
        return ctx.rule("type", () -> {
            int start = ctx.pos();
            var first = identifier();
            if (first.isFailure()) {
                return first.propagate();
            }
            while (ctx.peek() == '.' && isIdentStart(ctx.peek(1))) {
                ctx.advance();
                identifier();
            }
            return ctx.success(TypeName.of(ctx.substring(start, ctx.pos())));
        });
    }

    // === Comments and Line Endings ===

    /**
     * {@code # text} up to the end of the line; returns the trimmed text after the hash.
     */
    public ParseResult<String> comment() {
        return ctx.rule("comment", () -> {
            ws();
            if (ctx.peek() != '#') {
                return ctx.failure("comment");
            }
            ctx.advance();
            int start = ctx.pos();
            skipToLineEnd();
            return ctx.success(ctx.substring(start, ctx.pos()).trim());
        });
    }

    public ParseResult<String> lineEnding() {
        if (ctx.consume("\r\n") || ctx.consume("\n")) {
            return ctx.success("\n");
        }
        return ctx.failure("newline");
    }

    /**
     * Trailing {@code ;} and comments after a line's content, then the line ending or end of input.
     */
    public ParseResult<String> endOfLine() {
        ws();
        while (ctx.peek() == ';' || ctx.peek() == '#') {
            if (ctx.peek() == ';') {
                ctx.advance();
            } else {
                skipToLineEnd();
            }
            ws();
        }
        if (ctx.isAtEnd()) {
            return ctx.success("");
        }
        return lineEnding();
    }

    /**
     * Skips one line holding only spaces and tabs; trailing spaces before the end of input count too.
     */
    public boolean skipBlankLine() {
        int ahead = 0;
        while (isInlineSpace(ctx.peek(ahead))) {
            ahead++;
        }
        boolean trailingSpaceAtEnd = ahead > 0 && ctx.pos() + ahead >= ctx.input().length();
        char c = ctx.peek(ahead);
        if (c != '\n' && c != '\r' && !trailingSpaceAtEnd) {
            return false;
        }
        ctx.advance(ahead);
        skipLineEnding();
        return true;
    }

    /**
     * Skips one line holding only a comment, whatever its indentation.
     */
    public boolean skipCommentLine() {
        int ahead = 0;
        while (isInlineSpace(ctx.peek(ahead))) {
            ahead++;
        }
        if (ctx.peek(ahead) != '#') {
            return false;
        }
        ctx.advance(ahead);
        skipToLineEnd();
        skipLineEnding();
        return true;
    }

    public void skipEmptyLines() {
        boolean skipped = true;
        while (skipped) {
            skipped = skipBlankLine() || skipCommentLine();
        }
    }

    private void skipLineEnding() {
        if (!ctx.consume("\r\n") && !ctx.consume("\n")) {
            ctx.consume("\r");
        }
    }

    // === Indentation ===

    /**
     * Width of the leading spaces at the cursor, without consuming them.
     */
    public int scanIndentation() {
        int width = 0;
        while (ctx.peek(width) == ' ') {
            width++;
        }
        return width;
    }

    /**
     * Consumes exactly {@code indent} leading spaces when the line is indented that much.
     */
    public ParseResult<Integer> sameIndent(int indent) {
        if (scanIndentation() == indent) {
            ctx.advance(indent);
            return ctx.success(indent);
        }
        return ctx.failure("indentation of " + indent);
    }

    /**
     * Succeeds without consuming when the line is indented deeper than {@code indent}.
     */
    public ParseResult<Integer> moreIndent(int indent) {
        int width = scanIndentation();
        if (width > indent) {
            return ctx.success(width);
        }
        return ctx.failure("indentation deeper than " + indent);
    }
}
