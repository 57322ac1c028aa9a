package org.dxworks.thesisdoc.model.document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory office document: one section, a set of named paragraph styles,
 * header and footer parts and the ordered body blocks.
 */
public class StyledDocument {
    public static final String NORMAL_STYLE = "Normal";
    public static final String HEADING_STYLE_PREFIX = "Heading ";
    public static final int MAX_HEADING_LEVEL = 6;

    public SectionLayout section = new SectionLayout();
    public Map<String, ParagraphStyle> styles = new LinkedHashMap<>();
    public HeaderFooter header = new HeaderFooter();
    public HeaderFooter footer = new HeaderFooter();
    public List<Paragraph> blocks = new ArrayList<>();

    /**
     * Creates an empty document whose style table holds {@code Normal} and
     * {@code Heading 1} to {@code Heading 6} with nothing set.
     */
    public static StyledDocument blank() {
        StyledDocument document = new StyledDocument();
        document.styles.put(NORMAL_STYLE, new ParagraphStyle(NORMAL_STYLE));
        for (int level = 1; level <= MAX_HEADING_LEVEL; level++) {
            String name = headingStyleName(level);
            document.styles.put(name, new ParagraphStyle(name));
        }
        return document;
    }

    public static String headingStyleName(int level) {
        return HEADING_STYLE_PREFIX + level;
    }

    public ParagraphStyle style(String name) {
        return styles.computeIfAbsent(name, ParagraphStyle::new);
    }

    public Paragraph addParagraph() {
        Paragraph paragraph = new Paragraph();
        blocks.add(paragraph);
        return paragraph;
    }

    public Paragraph addParagraph(String text) {
        Paragraph paragraph = addParagraph();
        paragraph.addRun(text);
        return paragraph;
    }

    public Paragraph addHeading(String text, int level) {
        Paragraph paragraph = addParagraph(text);
        paragraph.headingLevel = Math.max(1, Math.min(level, MAX_HEADING_LEVEL));
        return paragraph;
    }
}
