package com.warden.controlplane.domain.ruletype;

import com.warden.controlplane.domain.ServiceException;
import java.nio.charset.StandardCharsets;
import org.jsoup.Jsoup;
import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;

/**
 * Checks rule-type guidance before it is stored. Guidance is markdown shown next to failing
 * evaluations; it must be valid UTF-8, at most {@value #MAX_BYTES} bytes and free of HTML.
 */
public final class GuidanceSanitizer {

    public static final int MAX_BYTES = 4096;

    private GuidanceSanitizer() {
        // utility class
    }

    public static void check(String guidance) {
        if (guidance == null || guidance.isEmpty()) {
            return;
        }
        if (!StandardCharsets.UTF_8.newEncoder().canEncode(guidance)) {
            throw ServiceException.badRequest("guidance is not valid UTF-8");
        }
        int size = guidance.getBytes(StandardCharsets.UTF_8).length;
        if (size > MAX_BYTES) {
            throw ServiceException.badRequest(
                    String.format("guidance too long: %d bytes, maximum is %d", size, MAX_BYTES));
        }
        // the XML parser keeps every tag and comment where it was written
        Document parsed = Jsoup.parse(guidance, "", Parser.xmlParser());
        for (Node node : parsed.childNodes()) {
            if (node instanceof TextNode && !(node instanceof CDataNode)) {
                continue;
            }
            throw ServiceException.badRequest(
                    "guidance must not contain HTML: found " + describe(node));
        }
    }

    private static String describe(Node node) {
        if (node instanceof Element element) {
            return "<" + element.tagName() + ">";
        }
        if (node instanceof Comment) {
            return "a comment";
        }
        return node.nodeName();
    }
}
