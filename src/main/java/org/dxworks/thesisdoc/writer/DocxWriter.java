package org.dxworks.thesisdoc.writer;

import org.apache.poi.wp.usermodel.HeaderFooterType;
import org.apache.poi.xwpf.usermodel.LineSpacingRule;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHeaderFooter;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.dxworks.thesisdoc.model.document.Alignment;
import org.dxworks.thesisdoc.model.document.HeaderFooter;
import org.dxworks.thesisdoc.model.document.Paragraph;
import org.dxworks.thesisdoc.model.document.ParagraphStyle;
import org.dxworks.thesisdoc.model.document.Run;
import org.dxworks.thesisdoc.model.document.SectionLayout;
import org.dxworks.thesisdoc.model.document.StyledDocument;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBody;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTFonts;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPrGeneral;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageMar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageSz;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSpacing;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STJc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STLineSpacingRule;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serialises a {@link StyledDocument} to a {@code .docx} file with Apache POI.
 */
public class DocxWriter {

    private static final double TWIPS_PER_MM = 1440 / 25.4;
    private static final int TWIPS_PER_POINT = 20;

    public void write(StyledDocument document, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (XWPFDocument docx = toDocx(document);
             OutputStream out = Files.newOutputStream(output)) {
            docx.write(out);
        }
    }

    /**
     * Builds the POI document without writing it. The caller owns the returned
     * document and must close it.
     */
    public XWPFDocument toDocx(StyledDocument document) {
        XWPFDocument docx = new XWPFDocument();
        writeSection(docx, document.section);
        writeStyles(docx, document);
        if (!document.header.paragraphs.isEmpty()) {
            writeHeaderFooter(docx.createHeader(HeaderFooterType.DEFAULT), document.header);
        }
        if (!document.footer.paragraphs.isEmpty()) {
            writeHeaderFooter(docx.createFooter(HeaderFooterType.DEFAULT), document.footer);
        }
        for (Paragraph paragraph : document.blocks) {
            writeParagraph(docx.createParagraph(), paragraph);
        }
        return docx;
    }

    public static String styleId(String styleName) {
        return styleName.replace(" ", "");
    }

    private void writeSection(XWPFDocument docx, SectionLayout section) {
        CTBody body = docx.getDocument().getBody();
        CTSectPr sectPr = body.isSetSectPr() ? body.getSectPr() : body.addNewSectPr();

        if (section.pageWidthMm != null || section.pageHeightMm != null) {
            CTPageSz pageSize = sectPr.isSetPgSz() ? sectPr.getPgSz() : sectPr.addNewPgSz();
            if (section.pageWidthMm != null) {
                pageSize.setW(mmToTwips(section.pageWidthMm));
            }
            if (section.pageHeightMm != null) {
                pageSize.setH(mmToTwips(section.pageHeightMm));
            }
        }

        CTPageMar margins = sectPr.isSetPgMar() ? sectPr.getPgMar() : sectPr.addNewPgMar();
        if (section.topMarginMm != null) {
            margins.setTop(mmToTwips(section.topMarginMm));
        }
        if (section.bottomMarginMm != null) {
            margins.setBottom(mmToTwips(section.bottomMarginMm));
        }
        if (section.leftMarginMm != null) {
            margins.setLeft(mmToTwips(section.leftMarginMm));
        }
        if (section.rightMarginMm != null) {
            margins.setRight(mmToTwips(section.rightMarginMm));
        }
    }

    private void writeStyles(XWPFDocument docx, StyledDocument document) {
        XWPFStyles styles = docx.createStyles();
        for (ParagraphStyle style : document.styles.values()) {
            styles.addStyle(new XWPFStyle(toCtStyle(style)));
        }
    }

    private CTStyle toCtStyle(ParagraphStyle style) {
        CTStyle ctStyle = CTStyle.Factory.newInstance();
        ctStyle.setStyleId(styleId(style.name));
        ctStyle.setType(STStyleType.PARAGRAPH);

        int headingLevel = headingLevel(style.name);
        if (headingLevel > 0) {
            // Word's built-in heading names are lower case
            ctStyle.addNewName().setVal("heading " + headingLevel);
            ctStyle.addNewBasedOn().setVal(StyledDocument.NORMAL_STYLE);
            ctStyle.addNewNext().setVal(StyledDocument.NORMAL_STYLE);
            ctStyle.addNewQFormat();
        } else {
            ctStyle.addNewName().setVal(style.name);
            ctStyle.addNewQFormat();
        }

        CTPPrGeneral paragraphProperties = ctStyle.addNewPPr();
        if (headingLevel > 0) {
            paragraphProperties.addNewKeepNext();
            paragraphProperties.addNewOutlineLvl().setVal(BigInteger.valueOf(headingLevel - 1));
        }
        if (style.spaceBeforePt != null || style.spaceAfterPt != null || style.lineSpacingPt != null) {
            CTSpacing spacing = paragraphProperties.addNewSpacing();
            if (style.spaceBeforePt != null) {
                spacing.setBefore(pointsToTwips(style.spaceBeforePt));
            }
            if (style.spaceAfterPt != null) {
                spacing.setAfter(pointsToTwips(style.spaceAfterPt));
            }
            if (style.lineSpacingPt != null) {
                spacing.setLine(pointsToTwips(style.lineSpacingPt));
                spacing.setLineRule(STLineSpacingRule.EXACT);
            }
        }
        if (style.alignment != null) {
            paragraphProperties.addNewJc().setVal(STJc.Enum.forInt(toParagraphAlignment(style.alignment).getValue()));
        }

        CTRPr runProperties = ctStyle.addNewRPr();
        if (style.westernFont != null || style.eastAsiaFont != null) {
            CTFonts fonts = runProperties.addNewRFonts();
            if (style.westernFont != null) {
                fonts.setAscii(style.westernFont);
                fonts.setHAnsi(style.westernFont);
            }
            if (style.eastAsiaFont != null) {
                fonts.setEastAsia(style.eastAsiaFont);
            }
        }
        if (style.sizePt != null) {
            BigInteger halfPoints = BigInteger.valueOf(Math.round(style.sizePt * 2));
            runProperties.addNewSz().setVal(halfPoints);
            runProperties.addNewSzCs().setVal(halfPoints);
        }
        return ctStyle;
    }

    private void writeHeaderFooter(XWPFHeaderFooter part, HeaderFooter model) {
        List<XWPFParagraph> existing = part.getParagraphs();
        for (int i = 0; i < model.paragraphs.size(); i++) {
            XWPFParagraph target = i < existing.size() ? existing.get(i) : part.createParagraph();
            writeRuns(target, model.paragraphs.get(i));
        }
    }

    private void writeParagraph(XWPFParagraph target, Paragraph paragraph) {
        target.setStyle(styleId(paragraph.styleName()));
        if (paragraph.lineSpacingPt != null) {
            target.setSpacingBetween(paragraph.lineSpacingPt, LineSpacingRule.EXACT);
        }
        writeRuns(target, paragraph);
    }

    private void writeRuns(XWPFParagraph target, Paragraph paragraph) {
        for (Run run : paragraph.runs) {
            XWPFRun xwpfRun = target.createRun();
            String[] lines = (run.text != null ? run.text : "").split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    xwpfRun.addBreak();
                }
                if (!lines[i].isEmpty()) {
                    xwpfRun.setText(lines[i]);
                }
            }
            if (run.fontFamily != null) {
                xwpfRun.setFontFamily(run.fontFamily);
            }
            if (run.sizePt != null) {
                xwpfRun.setFontSize(run.sizePt);
            }
        }
    }

    private static int headingLevel(String styleName) {
        String prefix = StyledDocument.HEADING_STYLE_PREFIX;
        if (styleName != null && styleName.startsWith(prefix)) {
            try {
                return Integer.parseInt(styleName.substring(prefix.length()).trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private static ParagraphAlignment toParagraphAlignment(Alignment alignment) {
        return switch (alignment) {
            case LEFT -> ParagraphAlignment.LEFT;
            case CENTER -> ParagraphAlignment.CENTER;
            case RIGHT -> ParagraphAlignment.RIGHT;
            case JUSTIFY -> ParagraphAlignment.BOTH;
        };
    }

    private static BigInteger mmToTwips(double millimetres) {
        return BigInteger.valueOf(Math.round(millimetres * TWIPS_PER_MM));
    }

    private static BigInteger pointsToTwips(double points) {
        return BigInteger.valueOf(Math.round(points * TWIPS_PER_POINT));
    }
}
