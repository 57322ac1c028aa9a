package org.dxworks.thesisdoc.model.document;

/**
 * Page geometry of the single document section, in millimetres. Unset values
 * leave the writer's defaults in place.
 */
public class SectionLayout {
    public Double pageWidthMm;
    public Double pageHeightMm;
    public Double topMarginMm;
    public Double bottomMarginMm;
    public Double leftMarginMm;
    public Double rightMarginMm;
}
