package org.gdpm.gdscript.driver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * File system walk, sorted by path so reports are stable across platforms.
 */
public final class LocalFileEnumerator implements FileEnumerator {

    public static final LocalFileEnumerator INSTANCE = new LocalFileEnumerator();

    private LocalFileEnumerator() {}

    @Override
    public List<Path> findFilesInDir(Path root, String extension) throws IOException {
        try (var paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                        .filter(path -> path.getFileName().toString().endsWith(extension))
                        .sorted()
                        .collect(Collectors.toList());
        }
    }
}
