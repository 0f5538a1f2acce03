package com.siteharvest.core.parse;

import com.siteharvest.core.api.ParsedPage;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** jsoup Document 래퍼. visibleText 는 복제본에서 script/style 을 지운 뒤 계산한다. */
final class JsoupParsedPage implements ParsedPage {

    private final Document doc;
    private String visibleText; // lazy

    JsoupParsedPage(Document doc) {
        this.doc = Objects.requireNonNull(doc, "doc");
    }

    @Override
    public String visibleText() {
        if (visibleText != null) return visibleText;

        Document copy = doc.clone();
        copy.select("script, style").remove();

        StringBuilder sb = new StringBuilder(256);
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode t) {
                String s = t.text().strip();
                if (s.isEmpty()) return;
                if (sb.length() > 0) sb.append(' ');
                sb.append(s);
            }
        }, copy);

        visibleText = sb.toString();
        return visibleText;
    }

    @Override
    public List<String> attributeValues(String tag, String attr) {
        List<String> out = new ArrayList<>();
        for (Element e : doc.select(tag + "[" + attr + "]")) {
            out.add(e.attr(attr));
        }
        return out;
    }
}
