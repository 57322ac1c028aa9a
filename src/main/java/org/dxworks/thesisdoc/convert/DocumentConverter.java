package org.dxworks.thesisdoc.convert;

import java.io.IOException;
import java.nio.file.Path;

public interface DocumentConverter {

    /**
     * Converts a Markdown file into a {@code .docx} file.
     *
     * @return true if {@code docxOutput} was written
     * @throws IOException when the converter cannot recover from a read or write failure
     */
    boolean convert(Path markdownInput, Path docxOutput) throws IOException;
}
