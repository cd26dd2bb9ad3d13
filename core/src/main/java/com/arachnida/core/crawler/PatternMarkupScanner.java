package com.arachnida.core.crawler;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 정규식 기반 속성 추출기 (DOM 파서 아님).
 * 1) &lt;tag ...&gt; 조각을 대소문자 무시로 찾고 (첫 '&gt;' 까지)
 * 2) 조각 안에서 attr="..." | attr='...' | attr=bare 를 모두 찾는다.
 * 중첩 따옴표나 HTML 엔티티가 섞인 마크업은 놓칠 수 있음.
 */
public class PatternMarkupScanner implements MarkupScanner {

    private static final Pattern WS = Pattern.compile("\\s+");

    private final Map<String, Pattern> tagPatterns = new ConcurrentHashMap<>();
    private final Map<String, Pattern> attrPatterns = new ConcurrentHashMap<>();

    @Override
    public List<String> findAttributeValues(String html, String tagName, String attrName) {
        List<String> out = new ArrayList<>();
        if (html == null || html.isEmpty()) return out;

        Matcher tags = tagPattern(tagName).matcher(html);
        Pattern attr = attrPattern(attrName);
        while (tags.find()) {
            collect(attr, tags.group(), out);
        }
        return out;
    }

    @Override
    public List<String> findAttributeValuesWhere(String html, String tagName, String attrName,
                                                 String filterAttr, Set<String> acceptedTokens) {
        List<String> out = new ArrayList<>();
        if (html == null || html.isEmpty() || acceptedTokens.isEmpty()) return out;

        Matcher tags = tagPattern(tagName).matcher(html);
        Pattern attr = attrPattern(attrName);
        Pattern filter = attrPattern(filterAttr);
        while (tags.find()) {
            String fragment = tags.group();
            List<String> filterValues = new ArrayList<>();
            collect(filter, fragment, filterValues);
            if (anyTokenAccepted(filterValues, acceptedTokens)) {
                collect(attr, fragment, out);
            }
        }
        return out;
    }

    private static void collect(Pattern attr, String fragment, List<String> out) {
        Matcher m = attr.matcher(fragment);
        while (m.find()) {
            String v = m.group(2) != null ? m.group(2)
                    : m.group(3) != null ? m.group(3)
                    : m.group(4);
            v = v.strip();
            if (!v.isEmpty()) out.add(v);
        }
    }

    static boolean anyTokenAccepted(List<String> values, Set<String> acceptedTokens) {
        for (String v : values) {
            for (String token : WS.split(v)) {
                if (acceptedTokens.contains(token.toLowerCase(Locale.ROOT))) return true;
            }
        }
        return false;
    }

    private Pattern tagPattern(String tagName) {
        return tagPatterns.computeIfAbsent(tagName, t ->
                Pattern.compile("<\\s*" + Pattern.quote(t) + "\\b[^>]*?>", Pattern.CASE_INSENSITIVE));
    }

    private Pattern attrPattern(String attrName) {
        // data-src 안의 src 처럼 더 긴 속성명의 꼬리는 제외
        return attrPatterns.computeIfAbsent(attrName, a ->
                Pattern.compile("(?<![\\w-])" + Pattern.quote(a)
                                + "\\s*=\\s*(\"([^\"]*)\"|'([^']*)'|([^\\s>]+))",
                        Pattern.CASE_INSENSITIVE));
    }
}
