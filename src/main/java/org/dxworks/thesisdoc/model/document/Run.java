package org.dxworks.thesisdoc.model.document;

public class Run {
    public String text;
    public String fontFamily; // null means the paragraph style font
    public Double sizePt;

    public Run(String text) {
        this.text = text;
    }

    public Run(String text, String fontFamily) {
        this.text = text;
        this.fontFamily = fontFamily;
    }
}
