package org.dxworks.thesisdoc.style;

import org.dxworks.thesisdoc.model.document.Alignment;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges a partial {@link StyleConfig} with the built-in academic layout. Every
 * field missing from the config is taken from the defaults below; the config
 * object is never modified.
 */
public class StyleResolver {

    public static final double DEFAULT_PAGE_WIDTH_MM = 210;
    public static final double DEFAULT_PAGE_HEIGHT_MM = 297;
    public static final double DEFAULT_MARGIN_TOP_MM = 30;
    public static final double DEFAULT_MARGIN_BOTTOM_MM = 25;
    public static final double DEFAULT_MARGIN_LEFT_MM = 30;
    public static final double DEFAULT_MARGIN_RIGHT_MM = 25;

    public static final String DEFAULT_CHINESE_FONT = "SimSun";
    public static final String DEFAULT_WESTERN_FONT = "Times New Roman";
    public static final double DEFAULT_BODY_SIZE_PT = 12;
    public static final double DEFAULT_LINE_SPACING_PT = 20;

    public static final String DEFAULT_HEADING_FONT = "SimHei";
    public static final double DEFAULT_HEADING_SPACING_PT = 12;
    private static final double[] DEFAULT_HEADING_SIZES_PT = {16, 14, 12};
    private static final Alignment[] DEFAULT_HEADING_ALIGNMENTS = {Alignment.CENTER, Alignment.LEFT, Alignment.LEFT};

    public static final double DEFAULT_HEADER_FOOTER_SIZE_PT = 9;

    public static StyleSheet defaults() {
        return resolve(null);
    }

    public static StyleSheet resolve(StyleConfig config) {
        StyleConfig cfg = config != null ? config : StyleConfig.empty();

        StyleConfig.PageConfig page = cfg.page != null ? cfg.page : new StyleConfig.PageConfig();
        StyleSheet.Page resolvedPage = new StyleSheet.Page(
                orDefault(page.widthMm, DEFAULT_PAGE_WIDTH_MM),
                orDefault(page.heightMm, DEFAULT_PAGE_HEIGHT_MM));

        StyleConfig.MarginsConfig margins = cfg.margins != null ? cfg.margins : new StyleConfig.MarginsConfig();
        StyleSheet.Margins resolvedMargins = new StyleSheet.Margins(
                orDefault(margins.topMm, DEFAULT_MARGIN_TOP_MM),
                orDefault(margins.bottomMm, DEFAULT_MARGIN_BOTTOM_MM),
                orDefault(margins.leftMm, DEFAULT_MARGIN_LEFT_MM),
                orDefault(margins.rightMm, DEFAULT_MARGIN_RIGHT_MM));

        StyleConfig.NormalConfig normal = cfg.normal != null ? cfg.normal : new StyleConfig.NormalConfig();
        StyleSheet.Body body = new StyleSheet.Body(
                orDefault(normal.chinese, DEFAULT_CHINESE_FONT),
                orDefault(normal.western, DEFAULT_WESTERN_FONT),
                orDefault(normal.sizePt, DEFAULT_BODY_SIZE_PT),
                orDefault(normal.lineSpacingPt, DEFAULT_LINE_SPACING_PT));

        List<StyleSheet.Heading> headings = new ArrayList<>();
        for (int level = 1; level <= StyleSheet.HEADING_COUNT; level++) {
            headings.add(resolveHeading(level, cfg.heading(level)));
        }

        StyleConfig.HeaderConfig header = cfg.header != null ? cfg.header : new StyleConfig.HeaderConfig();
        StyleSheet.HeaderFooter headerFooter = new StyleSheet.HeaderFooter(
                orDefault(header.family, body.getChineseFont()),
                orDefault(header.sizePt, DEFAULT_HEADER_FOOTER_SIZE_PT),
                header.text);

        return new StyleSheet(resolvedPage, resolvedMargins, body, headings, headerFooter);
    }

    private static StyleSheet.Heading resolveHeading(int level, StyleConfig.HeadingConfig heading) {
        StyleConfig.HeadingConfig h = heading != null ? heading : new StyleConfig.HeadingConfig();
        Alignment defaultAlignment = DEFAULT_HEADING_ALIGNMENTS[level - 1];
        return new StyleSheet.Heading(
                orDefault(h.family, DEFAULT_HEADING_FONT),
                orDefault(h.sizePt, DEFAULT_HEADING_SIZES_PT[level - 1]),
                Alignment.fromName(h.align).orElse(defaultAlignment),
                orDefault(h.spaceBeforePt, DEFAULT_HEADING_SPACING_PT),
                orDefault(h.spaceAfterPt, DEFAULT_HEADING_SPACING_PT));
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
