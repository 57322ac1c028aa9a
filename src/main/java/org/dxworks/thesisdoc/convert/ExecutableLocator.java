package org.dxworks.thesisdoc.convert;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;

/**
 * Looks up executables on the {@code PATH}.
 */
public class ExecutableLocator {

    private final String searchPath;

    public ExecutableLocator() {
        this(System.getenv("PATH"));
    }

    public ExecutableLocator(String searchPath) {
        this.searchPath = searchPath != null ? searchPath : "";
    }

    public Optional<Path> find(String name) {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
        for (String directory : searchPath.split(File.pathSeparator)) {
            if (directory.isBlank()) {
                continue;
            }
            Path candidate = Paths.get(directory, name);
            if (isExecutable(candidate)) {
                return Optional.of(candidate);
            }
            if (windows) {
                Path exe = Paths.get(directory, name + ".exe");
                if (isExecutable(exe)) {
                    return Optional.of(exe);
                }
            }
        }
        return Optional.empty();
    }

    public Optional<Path> findFirst(String... names) {
        for (String name : names) {
            Optional<Path> found = find(name);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private static boolean isExecutable(Path candidate) {
        return Files.isRegularFile(candidate) && Files.isExecutable(candidate);
    }
}
