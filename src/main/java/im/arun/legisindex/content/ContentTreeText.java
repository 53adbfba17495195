package im.arun.legisindex.content;

import im.arun.legisindex.model.content.ContentNode;
import im.arun.legisindex.xml.TextLayout;

import java.util.List;

/**
 * Renders content trees back to normalized plain text, following the same layout rules
 * as {@link im.arun.legisindex.xml.TextExtractor}.
 */
public final class ContentTreeText {

    private ContentTreeText() {}

    public static String render(List<ContentNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (ContentNode node : nodes) {
            append(node, sb);
        }
        return TextLayout.normalize(sb);
    }

    private static void append(ContentNode node, StringBuilder sb) {
        if (node instanceof ContentNode.Text) {
            sb.append(((ContentNode.Text) node).getValue());
            return;
        }
        if (node instanceof ContentNode.MathMarkup) {
            sb.append(((ContentNode.MathMarkup) node).getPlainText());
            return;
        }
        boolean block = TextLayout.isBlock(node.getSourceTag());
        if (block) {
            sb.append(' ');
        }
        for (ContentNode child : node.getChildren()) {
            append(child, sb);
        }
        if (block) {
            sb.append(' ');
        }
    }
}
