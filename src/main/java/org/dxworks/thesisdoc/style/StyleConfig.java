package org.dxworks.thesisdoc.style;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partially populated style configuration as read from a YAML or JSON file.
 * Every field may be null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StyleConfig {
    public PageConfig page;
    public MarginsConfig margins;
    public NormalConfig normal;
    public Map<String, HeadingConfig> headings = new LinkedHashMap<>();
    public HeaderConfig header;

    public static StyleConfig empty() {
        return new StyleConfig();
    }

    public HeadingConfig heading(int level) {
        return headings == null ? null : headings.get("Heading " + level);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PageConfig {
        @JsonProperty("width_mm")
        public Double widthMm;
        @JsonProperty("height_mm")
        public Double heightMm;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MarginsConfig {
        @JsonProperty("top_mm")
        public Double topMm;
        @JsonProperty("bottom_mm")
        public Double bottomMm;
        @JsonProperty("left_mm")
        public Double leftMm;
        @JsonProperty("right_mm")
        public Double rightMm;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NormalConfig {
        public String chinese;
        public String western;
        @JsonProperty("size_pt")
        public Double sizePt;
        @JsonProperty("line_spacing_pt")
        public Double lineSpacingPt;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HeadingConfig {
        public String family;
        @JsonProperty("size_pt")
        public Double sizePt;
        public String align;
        @JsonProperty("space_before_pt")
        public Double spaceBeforePt;
        @JsonProperty("space_after_pt")
        public Double spaceAfterPt;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HeaderConfig {
        public String text;
        public String family;
        @JsonProperty("size_pt")
        public Double sizePt;
    }
}
