package org.gdpm.gdscript.driver;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of parsing one file in directory mode.
 *
 * @param path  script path as enumerated
 * @param error rendered failure detail, empty when the file parsed
 */
public record FileReport(Path path, Optional<String> error) {

    public static FileReport ok(Path path) {
        return new FileReport(path, Optional.empty());
    }

    public static FileReport failed(Path path, String detail) {
        return new FileReport(path, Optional.of(detail));
    }

    public boolean isOk() {
        return error.isEmpty();
    }

    /**
     * {@code OK} or {@code ERROR: <detail>}.
     */
    public String status() {
        return error.map(detail -> "ERROR: " + detail).orElse("OK");
    }

    @Override
    public String toString() {
        return path + ":" + status();
    }
}
