package org.dxworks.thesisdoc;

public enum OutputFormat {
    DOCX("docx"),
    DOC("doc");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public boolean matchesFileName(String fileName) {
        return fileName.endsWith("." + extension);
    }
}
