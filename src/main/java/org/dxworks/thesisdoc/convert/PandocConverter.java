package org.dxworks.thesisdoc.convert;

import org.dxworks.thesisdoc.model.document.StyledDocument;
import org.dxworks.thesisdoc.style.StyleApplier;
import org.dxworks.thesisdoc.style.StyleSheet;
import org.dxworks.thesisdoc.writer.DocxWriter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Converts with an installed pandoc, passing the style sheet through a generated
 * reference document. Every failure is reported and turned into {@code false}
 * so the caller can fall back to the built-in renderer.
 */
public class PandocConverter implements DocumentConverter {

    static final String INPUT_FORMAT = "markdown+tex_math_dollars+pipe_tables+table_captions";
    private static final Duration TIMEOUT = Duration.ofSeconds(120);

    private final StyleSheet styleSheet;
    private final String headerText;
    private final ExecutableLocator locator;
    private final PrintStream diagnostics;

    public PandocConverter(StyleSheet styleSheet, String headerText, ExecutableLocator locator, PrintStream diagnostics) {
        this.styleSheet = styleSheet;
        this.headerText = headerText;
        this.locator = locator;
        this.diagnostics = diagnostics;
    }

    @Override
    public boolean convert(Path markdownInput, Path docxOutput) {
        Optional<Path> pandoc = locator.find("pandoc");
        if (pandoc.isEmpty()) {
            return false;
        }

        Path workDir = null;
        try {
            Path parent = docxOutput.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            workDir = Files.createTempDirectory("thesisdoc-ref");
            Path referenceDoc = workDir.resolve("reference.docx");
            writeReferenceDocument(referenceDoc);

            ExternalProcess.Result result = ExternalProcess.run(
                    command(pandoc.get(), markdownInput, docxOutput, referenceDoc), TIMEOUT);
            if (!result.isSuccess()) {
                diagnostics.println("[pandoc] failed: exit code " + result.getExitCode() + " " + result.getOutput().trim());
                return false;
            }
            return Files.exists(docxOutput) && Files.size(docxOutput) > 0;
        } catch (IOException e) {
            diagnostics.println("[pandoc] failed: " + e.getMessage());
            return false;
        } finally {
            deleteQuietly(workDir);
        }
    }

    static List<String> command(Path pandoc, Path markdownInput, Path docxOutput, Path referenceDoc) {
        return List.of(
                pandoc.toString(),
                "--standalone",
                "--from=" + INPUT_FORMAT,
                "--reference-doc=" + referenceDoc.toAbsolutePath(),
                "-o", docxOutput.toAbsolutePath().toString(),
                markdownInput.toAbsolutePath().toString());
    }

    /**
     * Writes an otherwise empty document carrying the page setup and styles, for
     * pandoc's {@code --reference-doc}.
     */
    void writeReferenceDocument(Path target) throws IOException {
        StyledDocument reference = StyledDocument.blank();
        StyleApplier.apply(reference, styleSheet, headerText);
        // Keeps the style definitions referenced from the body
        reference.addParagraph();
        new DocxWriter().write(reference, target);
    }

    private void deleteQuietly(Path directory) {
        if (directory == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        } catch (IOException e) {
            diagnostics.println("[pandoc] could not remove " + directory + ": " + e.getMessage());
        }
    }
}
