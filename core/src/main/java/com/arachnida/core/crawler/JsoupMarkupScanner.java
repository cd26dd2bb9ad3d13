package com.arachnida.core.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** jsoup 파서 기반 대체 구현: 같은 계약, 더 엄격한 파싱. */
public class JsoupMarkupScanner implements MarkupScanner {

    @Override
    public List<String> findAttributeValues(String html, String tagName, String attrName) {
        List<String> out = new ArrayList<>();
        if (html == null || html.isEmpty()) return out;

        for (Element el : Jsoup.parse(html).getElementsByTag(tagName)) {
            add(el, attrName, out);
        }
        return out;
    }

    @Override
    public List<String> findAttributeValuesWhere(String html, String tagName, String attrName,
                                                 String filterAttr, Set<String> acceptedTokens) {
        List<String> out = new ArrayList<>();
        if (html == null || html.isEmpty() || acceptedTokens.isEmpty()) return out;

        Document doc = Jsoup.parse(html);
        for (Element el : doc.getElementsByTag(tagName)) {
            if (!el.hasAttr(filterAttr)) continue;
            if (!PatternMarkupScanner.anyTokenAccepted(List.of(el.attr(filterAttr).strip()), acceptedTokens)) continue;
            add(el, attrName, out);
        }
        return out;
    }

    private static void add(Element el, String attrName, List<String> out) {
        if (!el.hasAttr(attrName)) return;
        String v = el.attr(attrName).strip();
        if (!v.isEmpty()) out.add(v);
    }
}
