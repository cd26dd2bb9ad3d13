package com.arachnida.core.util;

import com.arachnida.core.model.AbsoluteUrl;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Optional;

/**
 * http(s) 절대 URL 파싱 + href 해석 유틸.
 *
 * 해석 순서(resolve):
 * 1) 공백 제거 후 빈 문자열 / "#..." / javascript: / mailto: → 거부
 * 2) http:// , https:// → 그대로 파싱
 * 3) "//host/..." → base.scheme + ":" 접두
 * 4) "/path" → base.scheme://base.host + href
 * 5) 그 외 상대 경로 → base 디렉터리 + href 후 "."/".." 정규화
 *
 * ".." 가 루트 위로 올라가면 조용히 버린다(RFC 3986 엄격 준수가 아닌 관대한 정책).
 * 어떤 입력에도 예외를 던지지 않는다.
 */
public final class UrlResolver {
    private UrlResolver() {}

    private static final String HTTP = "http://";
    private static final String HTTPS = "https://";

    /** 절대 URL 파싱. http/https 외 스킴, 빈 host, 공백 섞인 host 는 empty */
    public static Optional<AbsoluteUrl> parse(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.strip();
        String lower = s.toLowerCase(Locale.ROOT);

        String scheme;
        if (lower.startsWith(HTTP)) scheme = "http";
        else if (lower.startsWith(HTTPS)) scheme = "https";
        else return Optional.empty();

        String rest = s.substring(scheme.length() + 3);
        int end = indexOfAny(rest, "/?#");
        String host = end < 0 ? rest : rest.substring(0, end);
        if (host.isEmpty() || containsWhitespace(host)) return Optional.empty();

        String path = end < 0 ? "/" : rest.substring(end);
        if (path.charAt(0) != '/') path = "/" + path; // "?q" 또는 "#f" 가 host 바로 뒤에 온 경우

        return Optional.of(AbsoluteUrl.of(scheme, host, path));
    }

    /** base 기준으로 href 해석. 거부/파싱 실패 시 empty */
    public static Optional<AbsoluteUrl> resolve(AbsoluteUrl base, String href) {
        if (base == null || href == null) return Optional.empty();
        String h = href.strip();
        if (h.isEmpty() || h.charAt(0) == '#') return Optional.empty();

        String lower = h.toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:") || lower.startsWith("mailto:")) return Optional.empty();

        if (lower.startsWith(HTTP) || lower.startsWith(HTTPS)) {
            return parse(h);
        }
        if (h.startsWith("//")) {
            return parse(base.scheme() + ":" + h);
        }
        if (h.charAt(0) == '/') {
            return Optional.of(AbsoluteUrl.of(base.scheme(), base.host(), h));
        }

        String combined = baseDirectory(base) + h;
        return Optional.of(AbsoluteUrl.of(base.scheme(), base.host(), normalizePath(combined)));
    }

    /** "/a/b/index.html?x" → "/a/b/" , "/a/b/" → "/a/b/" */
    static String baseDirectory(AbsoluteUrl base) {
        String path = base.pathWithoutSuffix();
        if (path.isEmpty()) return "/";
        if (path.endsWith("/")) return path;
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "/" : path.substring(0, slash + 1);
    }

    /**
     * "/" 기준 분할 후 빈 세그먼트와 "."은 버리고 ".."은 직전 세그먼트를 제거.
     * 결과는 항상 "/"로 시작하고, 비면 "/".
     */
    public static String normalizePath(String path) {
        Deque<String> kept = new ArrayDeque<>();
        for (String seg : path.split("/")) {
            if (seg.isEmpty() || seg.equals(".")) continue;
            if (seg.equals("..")) {
                kept.pollLast();
                continue;
            }
            kept.addLast(seg);
        }
        if (kept.isEmpty()) return "/";
        return "/" + String.join("/", kept);
    }

    private static int indexOfAny(String s, String chars) {
        for (int i = 0; i < s.length(); i++) {
            if (chars.indexOf(s.charAt(i)) >= 0) return i;
        }
        return -1;
    }

    private static boolean containsWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return true;
        }
        return false;
    }
}
