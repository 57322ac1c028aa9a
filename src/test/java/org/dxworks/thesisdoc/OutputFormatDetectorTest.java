package org.dxworks.thesisdoc;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class OutputFormatDetectorTest {

    @Test
    void detectFormat_ByExtension() {
        assertEquals(Optional.of(OutputFormat.DOCX), OutputFormatDetector.detectFormat(Paths.get("a/thesis.docx")));
        assertEquals(Optional.of(OutputFormat.DOC), OutputFormatDetector.detectFormat(Paths.get("THESIS.DOC")));
        assertEquals(Optional.empty(), OutputFormatDetector.detectFormat(Paths.get("thesis.pdf")));
        assertEquals(Optional.empty(), OutputFormatDetector.detectFormat(Paths.get("thesis")));
    }

    @Test
    void withExtension_ReplacesOrAppends() {
        assertEquals(Paths.get("dir/thesis.docx"), OutputFormatDetector.withExtension(Paths.get("dir/thesis.md"), OutputFormat.DOCX));
        assertEquals(Paths.get("notes.doc"), OutputFormatDetector.withExtension(Paths.get("notes"), OutputFormat.DOC));
    }
}
