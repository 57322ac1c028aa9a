package org.dxworks.thesisdoc.convert;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Exports a {@code .docx} file to the legacy {@code .doc} format with a headless
 * LibreOffice.
 */
public class LibreOfficeConverter {

    private static final Duration TIMEOUT = Duration.ofSeconds(180);

    private final ExecutableLocator locator;
    private final PrintStream diagnostics;

    public LibreOfficeConverter(ExecutableLocator locator, PrintStream diagnostics) {
        this.locator = locator;
        this.diagnostics = diagnostics;
    }

    public boolean convertToDoc(Path docxInput, Path docOutput) {
        Optional<Path> soffice = locator.findFirst("soffice", "libreoffice");
        if (soffice.isEmpty()) {
            diagnostics.println("LibreOffice (soffice) not found, cannot export .doc. The .docx file was kept.");
            return false;
        }

        Path target = docOutput.toAbsolutePath();
        Path outDir = target.getParent();
        try {
            Files.createDirectories(outDir);
            ExternalProcess.Result result = ExternalProcess.run(command(soffice.get(), docxInput, outDir), TIMEOUT);
            if (!result.isSuccess()) {
                diagnostics.println("LibreOffice conversion failed: exit code " + result.getExitCode() + " " + result.getOutput().trim());
                return false;
            }

            // LibreOffice names the output after the input file
            Path produced = outDir.resolve(baseName(docxInput) + ".doc");
            if (!produced.equals(target) && Files.exists(produced)) {
                Files.move(produced, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return Files.exists(target);
        } catch (IOException e) {
            diagnostics.println("LibreOffice conversion failed: " + e.getMessage());
            return false;
        }
    }

    static List<String> command(Path soffice, Path docxInput, Path outDir) {
        return List.of(
                soffice.toString(),
                "--headless",
                "--convert-to", "doc",
                docxInput.toAbsolutePath().toString(),
                "--outdir", outDir.toString());
    }

    static String baseName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
