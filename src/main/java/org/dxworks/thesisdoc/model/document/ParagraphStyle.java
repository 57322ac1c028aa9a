package org.dxworks.thesisdoc.model.document;

/**
 * A named paragraph style. Null properties are inherited from the base style.
 */
public class ParagraphStyle {
    public String name;
    public String eastAsiaFont; // characters of the primary (CJK) script
    public String westernFont;  // Latin letters and digits
    public Double sizePt;
    public Alignment alignment;
    public Double spaceBeforePt;
    public Double spaceAfterPt;
    public Double lineSpacingPt; // exact spacing

    public ParagraphStyle(String name) {
        this.name = name;
    }
}
