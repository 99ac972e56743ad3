package org.gdpm.gdscript.driver;

import org.gdpm.gdscript.GdScript;
import org.gdpm.gdscript.parser.ParseException;
import org.gdpm.gdscript.parser.ParserConfig;
import org.gdpm.gdscript.parser.ScriptParser;
import org.gdpm.gdscript.tree.Block;
import org.gdpm.gdscript.tree.TreePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parses script files and directories of scripts, printing results to an output stream.
 *
 * <ul>
 *   <li>a directory: every {@code *.gd} file below it is parsed and reported as
 *       {@code path:OK} or {@code path:ERROR: detail}; one broken file never stops the batch</li>
 *   <li>a file: the syntax tree is printed, or the parse error is thrown</li>
 * </ul>
 */
public final class GdScriptParser {
    private static final Logger log = LoggerFactory.getLogger(GdScriptParser.class);

    private final ScriptParser parser;
    private final PrintStream out;

    private GdScriptParser(ScriptParser parser, PrintStream out) {
        this.parser = parser;
        this.out = out;
    }

    public static GdScriptParser create() {
        return create(ParserConfig.load(), System.out);
    }

    public static GdScriptParser create(ParserConfig config, PrintStream out) {
        return new GdScriptParser(GdScript.parser(config), out);
    }

    /**
     * Dispatches on what {@code path} is: directory, regular file, or neither.
     */
    public void parsePath(FileEnumerator files, Path path) throws ParserException {
        if (Files.isDirectory(path)) {
            parseDir(files, path);
        } else if (Files.isRegularFile(path)) {
            parseFile(path);
        } else {
            throw new ParserException(new ParserError.MissingPath(path));
        }
    }

    /**
     * Parses every script under {@code dir} and prints one status line per file, in
     * enumeration order.
     */
    public List<FileReport> parseDir(FileEnumerator files, Path dir) throws ParserException {
        List<Path> scripts;
        try {
            scripts = files.findFilesInDir(dir, parser.config().scriptExtension());
        } catch (IOException e) {
            throw new ParserException(new ParserError.MissingPath(dir), e);
        }
        log.debug("Found {} scripts under {}", scripts.size(), dir);

        var stream = parser.config().parallel() ? scripts.parallelStream() : scripts.stream();
        var reports = stream.map(this::check).collect(Collectors.toList());

        reports.forEach(out::println);
        var failed = reports.stream().filter(report -> !report.isOk()).count();
        log.info("Parsed {} scripts under {}: {} ok, {} failed", reports.size(), dir, reports.size() - failed, failed);
        return reports;
    }

    private FileReport check(Path script) {
        try {
            parser.parse(read(script));
            log.debug("{}: OK", script);
            return FileReport.ok(script);
        } catch (ParseException e) {
            log.warn("{}: {} (in {})", script, e.error().summary(), e.error().innermostRule());
            return FileReport.failed(script, e.getMessage());
        } catch (IOException e) {
            log.warn("{}: cannot read: {}", script, e.getMessage());
            return FileReport.failed(script, "cannot read file: " + e.getMessage());
        }
    }

    /**
     * Parses one script and prints its syntax tree.
     */
    public Block parseFile(Path file) throws ParserException {
        String source;
        try {
            source = read(file);
        } catch (IOException e) {
            throw new ParserException(new ParserError.Custom("Cannot read " + file + ": " + e.getMessage()), e);
        }
        try {
            var block = parser.parse(source);
            out.println(TreePrinter.render(block));
            return block;
        } catch (ParseException e) {
            throw new ParserException(new ParserError.ParseFailure(file, e.format(file.toString())), e);
        }
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
