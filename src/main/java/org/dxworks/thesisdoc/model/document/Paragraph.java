package org.dxworks.thesisdoc.model.document;

import java.util.ArrayList;
import java.util.List;

public class Paragraph {
    public int headingLevel; // 1-6, with 0 used for body paragraphs
    public Double lineSpacingPt; // exact spacing override
    public List<Run> runs = new ArrayList<>();

    public Run addRun(String text) {
        Run run = new Run(text);
        runs.add(run);
        return run;
    }

    public boolean isHeading() {
        return headingLevel > 0;
    }

    public String styleName() {
        return isHeading() ? StyledDocument.headingStyleName(headingLevel) : StyledDocument.NORMAL_STYLE;
    }

    public String getText() {
        StringBuilder text = new StringBuilder();
        for (Run run : runs) {
            if (run.text != null) {
                text.append(run.text);
            }
        }
        return text.toString();
    }
}
