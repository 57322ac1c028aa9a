package org.dxworks.thesisdoc;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class OutputFormatDetector {

    public static Optional<OutputFormat> detectFormat(Path outputPath) {
        String fileName = outputPath.getFileName().toString().toLowerCase(Locale.ROOT);
        for (OutputFormat format : OutputFormat.values()) {
            if (format.matchesFileName(fileName)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * Replaces the extension of {@code path} (if any) with the one of {@code format}.
     */
    public static Path withExtension(Path path, OutputFormat format) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        return path.resolveSibling(baseName + "." + format.getExtension());
    }
}
