package org.dxworks.thesisdoc.markdown;

import org.commonmark.ext.gfm.strikethrough.Strikethrough;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.CustomBlock;
import org.commonmark.node.CustomNode;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.dxworks.thesisdoc.model.token.InlineSpan;
import org.dxworks.thesisdoc.model.token.SpanKind;
import org.dxworks.thesisdoc.model.token.Token;
import org.dxworks.thesisdoc.model.token.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses Markdown with commonmark (tables and strikethrough enabled) and
 * flattens the syntax tree into a linear token stream: every container block
 * becomes an open/close pair, every leaf with inline content an
 * {@link TokenKind#INLINE} token whose children are the flattened inline spans.
 */
public class MarkdownTokenizer {

    private final Parser parser;

    public MarkdownTokenizer() {
        // Block source spans give the raw text of paragraphs for inline tokens
        this.parser = Parser.builder()
                .extensions(List.of(
                        TablesExtension.create(),
                        StrikethroughExtension.create()
                ))
                .includeSourceSpans(IncludeSourceSpans.BLOCKS)
                .build();
    }

    public List<Token> tokenize(String markdown) {
        String[] sourceLines = markdown.split("\r\n|\r|\n", -1);
        Node document = parser.parse(markdown);
        BlockTokenVisitor visitor = new BlockTokenVisitor(sourceLines);
        document.accept(visitor);
        return visitor.tokens;
    }

    private static class BlockTokenVisitor extends AbstractVisitor {
        private final String[] sourceLines;
        private final List<Token> tokens = new ArrayList<>();

        BlockTokenVisitor(String[] sourceLines) {
            this.sourceLines = sourceLines;
        }

        @Override
        public void visit(Heading heading) {
            tokens.add(Token.headingOpen(heading.getLevel()));
            List<InlineSpan> spans = collectSpans(heading);
            tokens.add(Token.inline(plainText(spans).trim(), spans));
            tokens.add(Token.headingClose(heading.getLevel()));
        }

        @Override
        public void visit(Paragraph paragraph) {
            tokens.add(Token.of(TokenKind.PARAGRAPH_OPEN));
            List<InlineSpan> spans = collectSpans(paragraph);
            String raw = rawSource(paragraph);
            tokens.add(Token.inline(raw != null ? raw : plainText(spans), spans));
            tokens.add(Token.of(TokenKind.PARAGRAPH_CLOSE));
        }

        @Override
        public void visit(BulletList bulletList) {
            wrap(bulletList, TokenKind.BULLET_LIST_OPEN, TokenKind.BULLET_LIST_CLOSE);
        }

        @Override
        public void visit(OrderedList orderedList) {
            wrap(orderedList, TokenKind.ORDERED_LIST_OPEN, TokenKind.ORDERED_LIST_CLOSE);
        }

        @Override
        public void visit(ListItem listItem) {
            wrap(listItem, TokenKind.LIST_ITEM_OPEN, TokenKind.LIST_ITEM_CLOSE);
        }

        @Override
        public void visit(BlockQuote blockQuote) {
            wrap(blockQuote, TokenKind.BLOCKQUOTE_OPEN, TokenKind.BLOCKQUOTE_CLOSE);
        }

        @Override
        public void visit(FencedCodeBlock codeBlock) {
            tokens.add(Token.fence(codeBlock.getLiteral()));
        }

        @Override
        public void visit(IndentedCodeBlock codeBlock) {
            tokens.add(new Token(TokenKind.CODE_BLOCK, 0, codeBlock.getLiteral(), List.of()));
        }

        @Override
        public void visit(ThematicBreak thematicBreak) {
            tokens.add(Token.of(TokenKind.HORIZONTAL_RULE));
        }

        @Override
        public void visit(HtmlBlock htmlBlock) {
            tokens.add(new Token(TokenKind.OTHER, 0, htmlBlock.getLiteral(), List.of()));
        }

        @Override
        public void visit(CustomBlock customBlock) {
            if (customBlock instanceof TableBlock) {
                // Tables are not rendered; keep a placeholder so the stream stays in document order.
                tokens.add(Token.of(TokenKind.OTHER));
                return;
            }
            super.visit(customBlock);
        }

        private void wrap(Node node, TokenKind open, TokenKind close) {
            tokens.add(Token.of(open));
            visitChildren(node);
            tokens.add(Token.of(close));
        }

        private String rawSource(Node node) {
            List<SourceSpan> spans = node.getSourceSpans();
            if (spans == null || spans.isEmpty()) {
                return null;
            }
            List<String> lines = new ArrayList<>();
            for (SourceSpan span : spans) {
                int lineIndex = span.getLineIndex();
                if (lineIndex < 0 || lineIndex >= sourceLines.length) {
                    return null;
                }
                String line = sourceLines[lineIndex];
                int start = Math.min(span.getColumnIndex(), line.length());
                int end = Math.min(start + span.getLength(), line.length());
                lines.add(line.substring(start, end));
            }
            return String.join("\n", lines).trim();
        }
    }

    static List<InlineSpan> collectSpans(Node block) {
        InlineSpanVisitor visitor = new InlineSpanVisitor();
        Node child = block.getFirstChild();
        while (child != null) {
            child.accept(visitor);
            child = child.getNext();
        }
        return visitor.spans;
    }

    private static String plainText(List<InlineSpan> spans) {
        StringBuilder text = new StringBuilder();
        for (InlineSpan span : spans) {
            text.append(span.getContent());
        }
        return text.toString();
    }

    private static class InlineSpanVisitor extends AbstractVisitor {
        private final List<InlineSpan> spans = new ArrayList<>();

        @Override
        public void visit(Text text) {
            spans.add(InlineSpan.text(text.getLiteral()));
        }

        @Override
        public void visit(Code code) {
            spans.add(InlineSpan.code(code.getLiteral()));
        }

        @Override
        public void visit(SoftLineBreak softLineBreak) {
            spans.add(InlineSpan.marker(SpanKind.SOFT_BREAK));
        }

        @Override
        public void visit(HardLineBreak hardLineBreak) {
            spans.add(InlineSpan.marker(SpanKind.HARD_BREAK));
        }

        @Override
        public void visit(Emphasis emphasis) {
            surround(emphasis, SpanKind.EM_OPEN, SpanKind.EM_CLOSE);
        }

        @Override
        public void visit(StrongEmphasis strongEmphasis) {
            surround(strongEmphasis, SpanKind.STRONG_OPEN, SpanKind.STRONG_CLOSE);
        }

        @Override
        public void visit(Link link) {
            surround(link, SpanKind.LINK_OPEN, SpanKind.LINK_CLOSE);
        }

        @Override
        public void visit(Image image) {
            spans.add(new InlineSpan(SpanKind.IMAGE, altText(image)));
        }

        @Override
        public void visit(HtmlInline htmlInline) {
            spans.add(new InlineSpan(SpanKind.HTML_INLINE, htmlInline.getLiteral()));
        }

        @Override
        public void visit(CustomNode customNode) {
            if (customNode instanceof Strikethrough) {
                surround(customNode, SpanKind.STRIKE_OPEN, SpanKind.STRIKE_CLOSE);
                return;
            }
            super.visit(customNode);
        }

        private void surround(Node node, SpanKind open, SpanKind close) {
            spans.add(InlineSpan.marker(open));
            visitChildren(node);
            spans.add(InlineSpan.marker(close));
        }

        private String altText(Node node) {
            StringBuilder text = new StringBuilder();
            Node child = node.getFirstChild();
            while (child != null) {
                if (child instanceof Text) {
                    text.append(((Text) child).getLiteral());
                } else if (child instanceof Code) {
                    text.append(((Code) child).getLiteral());
                } else {
                    text.append(altText(child));
                }
                child = child.getNext();
            }
            return text.toString();
        }
    }
}
