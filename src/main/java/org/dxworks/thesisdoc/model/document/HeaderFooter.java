package org.dxworks.thesisdoc.model.document;

import java.util.ArrayList;
import java.util.List;

public class HeaderFooter {
    public List<Paragraph> paragraphs = new ArrayList<>();

    public Paragraph firstOrNewParagraph() {
        if (paragraphs.isEmpty()) {
            paragraphs.add(new Paragraph());
        }
        return paragraphs.get(0);
    }
}
