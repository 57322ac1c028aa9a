package org.dxworks.thesisdoc.style;

import org.dxworks.thesisdoc.model.document.HeaderFooter;
import org.dxworks.thesisdoc.model.document.Paragraph;
import org.dxworks.thesisdoc.model.document.ParagraphStyle;
import org.dxworks.thesisdoc.model.document.Run;
import org.dxworks.thesisdoc.model.document.SectionLayout;
import org.dxworks.thesisdoc.model.document.StyledDocument;

/**
 * Writes a resolved {@link StyleSheet} into the global settings of a document:
 * section geometry, the {@code Normal} style, the three heading styles and the
 * header/footer runs. Applying the same sheet again overwrites with equal values.
 */
public class StyleApplier {

    public static void apply(StyledDocument document, StyleSheet styleSheet, String overrideHeaderText) {
        applySection(document.section, styleSheet);
        applyBody(document.style(StyledDocument.NORMAL_STYLE), styleSheet.getBody());
        for (int level = 1; level <= StyleSheet.HEADING_COUNT; level++) {
            applyHeading(document.style(StyledDocument.headingStyleName(level)), styleSheet.getHeading(level));
        }
        applyHeader(document.header, styleSheet.getHeaderFooter(), overrideHeaderText);
        applyFooter(document.footer, styleSheet.getHeaderFooter());
    }

    private static void applySection(SectionLayout section, StyleSheet styleSheet) {
        section.pageWidthMm = styleSheet.getPage().getWidthMm();
        section.pageHeightMm = styleSheet.getPage().getHeightMm();
        section.topMarginMm = styleSheet.getMargins().getTopMm();
        section.bottomMarginMm = styleSheet.getMargins().getBottomMm();
        section.leftMarginMm = styleSheet.getMargins().getLeftMm();
        section.rightMarginMm = styleSheet.getMargins().getRightMm();
    }

    private static void applyBody(ParagraphStyle normal, StyleSheet.Body body) {
        normal.sizePt = body.getSizePt();
        normal.eastAsiaFont = body.getChineseFont();
        normal.westernFont = body.getWesternFont();
        normal.lineSpacingPt = body.getLineSpacingPt();
    }

    private static void applyHeading(ParagraphStyle style, StyleSheet.Heading heading) {
        style.eastAsiaFont = heading.getFont();
        style.westernFont = heading.getFont();
        style.sizePt = heading.getSizePt();
        style.alignment = heading.getAlignment();
        style.spaceBeforePt = heading.getSpaceBeforePt();
        style.spaceAfterPt = heading.getSpaceAfterPt();
    }

    private static void applyHeader(HeaderFooter header, StyleSheet.HeaderFooter style, String overrideHeaderText) {
        String text = overrideHeaderText != null && !overrideHeaderText.isEmpty()
                ? overrideHeaderText
                : style.getText().orElse(null);
        if (text == null) {
            return;
        }
        Paragraph paragraph = header.firstOrNewParagraph();
        // A repeated apply replaces the run written by the previous one.
        paragraph.runs.clear();
        Run run = paragraph.addRun(text);
        run.fontFamily = style.getFont();
        run.sizePt = style.getSizePt();
    }

    private static void applyFooter(HeaderFooter footer, StyleSheet.HeaderFooter style) {
        for (Paragraph paragraph : footer.paragraphs) {
            for (Run run : paragraph.runs) {
                run.fontFamily = style.getFont();
                run.sizePt = style.getSizePt();
            }
        }
    }
}
