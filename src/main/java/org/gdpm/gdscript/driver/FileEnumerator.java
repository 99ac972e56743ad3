package org.gdpm.gdscript.driver;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Lists the script files under a directory.
 */
@FunctionalInterface
public interface FileEnumerator {

    /**
     * Regular files below {@code root} (recursively) whose names end with {@code extension}.
     * The returned order is the order reports are printed in.
     */
    List<Path> findFilesInDir(Path root, String extension) throws IOException;
}
