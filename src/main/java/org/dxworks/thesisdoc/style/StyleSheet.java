package org.dxworks.thesisdoc.style;

import org.dxworks.thesisdoc.model.document.Alignment;

import java.util.List;
import java.util.Optional;

/**
 * Fully resolved layout and typography parameters. Page geometry is in
 * millimetres, everything typographic in points. Instances are immutable.
 */
public final class StyleSheet {

    public static final int HEADING_COUNT = 3;

    private final Page page;
    private final Margins margins;
    private final Body body;
    private final List<Heading> headings;
    private final HeaderFooter headerFooter;

    public StyleSheet(Page page, Margins margins, Body body, List<Heading> headings, HeaderFooter headerFooter) {
        if (headings.size() != HEADING_COUNT) {
            throw new IllegalArgumentException("Expected " + HEADING_COUNT + " heading styles, got " + headings.size());
        }
        this.page = page;
        this.margins = margins;
        this.body = body;
        this.headings = List.copyOf(headings);
        this.headerFooter = headerFooter;
    }

    public Page getPage() {
        return page;
    }

    public Margins getMargins() {
        return margins;
    }

    public Body getBody() {
        return body;
    }

    public List<Heading> getHeadings() {
        return headings;
    }

    /**
     * @param level heading level, 1 to {@link #HEADING_COUNT}
     */
    public Heading getHeading(int level) {
        return headings.get(level - 1);
    }

    public HeaderFooter getHeaderFooter() {
        return headerFooter;
    }

    public static final class Page {
        private final double widthMm;
        private final double heightMm;

        public Page(double widthMm, double heightMm) {
            this.widthMm = widthMm;
            this.heightMm = heightMm;
        }

        public double getWidthMm() {
            return widthMm;
        }

        public double getHeightMm() {
            return heightMm;
        }
    }

    public static final class Margins {
        private final double topMm;
        private final double bottomMm;
        private final double leftMm;
        private final double rightMm;

        public Margins(double topMm, double bottomMm, double leftMm, double rightMm) {
            this.topMm = topMm;
            this.bottomMm = bottomMm;
            this.leftMm = leftMm;
            this.rightMm = rightMm;
        }

        public double getTopMm() {
            return topMm;
        }

        public double getBottomMm() {
            return bottomMm;
        }

        public double getLeftMm() {
            return leftMm;
        }

        public double getRightMm() {
            return rightMm;
        }
    }

    public static final class Body {
        private final String chineseFont;
        private final String westernFont;
        private final double sizePt;
        private final double lineSpacingPt;

        public Body(String chineseFont, String westernFont, double sizePt, double lineSpacingPt) {
            this.chineseFont = chineseFont;
            this.westernFont = westernFont;
            this.sizePt = sizePt;
            this.lineSpacingPt = lineSpacingPt;
        }

        public String getChineseFont() {
            return chineseFont;
        }

        public String getWesternFont() {
            return westernFont;
        }

        public double getSizePt() {
            return sizePt;
        }

        /** Exact line spacing, never "at least". */
        public double getLineSpacingPt() {
            return lineSpacingPt;
        }
    }

    public static final class Heading {
        private final String font;
        private final double sizePt;
        private final Alignment alignment;
        private final double spaceBeforePt;
        private final double spaceAfterPt;

        public Heading(String font, double sizePt, Alignment alignment, double spaceBeforePt, double spaceAfterPt) {
            this.font = font;
            this.sizePt = sizePt;
            this.alignment = alignment;
            this.spaceBeforePt = spaceBeforePt;
            this.spaceAfterPt = spaceAfterPt;
        }

        public String getFont() {
            return font;
        }

        public double getSizePt() {
            return sizePt;
        }

        public Alignment getAlignment() {
            return alignment;
        }

        public double getSpaceBeforePt() {
            return spaceBeforePt;
        }

        public double getSpaceAfterPt() {
            return spaceAfterPt;
        }
    }

    public static final class HeaderFooter {
        private final String font;
        private final double sizePt;
        private final String text;

        public HeaderFooter(String font, double sizePt, String text) {
            this.font = font;
            this.sizePt = sizePt;
            this.text = text;
        }

        public String getFont() {
            return font;
        }

        public double getSizePt() {
            return sizePt;
        }

        public Optional<String> getText() {
            return Optional.ofNullable(text).filter(t -> !t.isEmpty());
        }
    }
}
