package com.siteharvest.core.parse;

import com.siteharvest.core.api.IPageParser;
import com.siteharvest.core.api.PageParseException;
import com.siteharvest.core.api.ParsedPage;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/** 기본 JSoup 기반 파서. jsoup 은 관대하므로 실패는 사실상 런타임 예외뿐이다. */
public class JsoupPageParser implements IPageParser {

    @Override
    public ParsedPage parse(String html) throws PageParseException {
        if (html == null) throw new PageParseException("no markup");
        try {
            Document doc = Jsoup.parse(html);
            return new JsoupParsedPage(doc);
        } catch (RuntimeException e) {
            throw new PageParseException("jsoup failed: " + e.getMessage(), e);
        }
    }
}
