package org.gdpm.gdscript.driver;

import java.nio.file.Path;

/**
 * Errors surfaced by the file driver.
 */
public sealed interface ParserError {

    String message();

    /**
     * Path is neither a directory nor a regular file, or cannot be listed.
     */
    record MissingPath(Path path) implements ParserError {
        @Override
        public String message() {
            return "Path does not exist: " + path;
        }
    }

    record Custom(String reason) implements ParserError {
        @Override
        public String message() {
            return reason;
        }
    }

    /**
     * A script failed to parse; {@code detail} is the rendered diagnostic.
     */
    record ParseFailure(Path path, String detail) implements ParserError {
        @Override
        public String message() {
            return "Failed to parse " + path + ":\n" + detail;
        }
    }
}
