package com.arachnida.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * 파싱이 끝난 절대 URL {scheme, host, path}. 불변 값 객체.
 * - scheme: "http" | "https" (소문자)
 * - host  : 원본 대소문자 유지, 포트 포함 가능
 * - path  : 항상 "/"로 시작, query/fragment 접미사는 그대로 보존
 *
 * 직접 만들기보다 {@link com.arachnida.core.util.UrlResolver#parse(String)} 사용 권장.
 */
public final class AbsoluteUrl {

    private final String scheme;
    private final String host;
    private final String path;

    private AbsoluteUrl(String scheme, String host, String path) {
        this.scheme = scheme;
        this.host = host;
        this.path = path;
    }

    /** 불변식 검사 후 생성. 위반 시 IllegalArgumentException */
    public static AbsoluteUrl of(String scheme, String host, String path) {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        String s = scheme.toLowerCase(Locale.ROOT);
        if (!s.equals("http") && !s.equals("https")) {
            throw new IllegalArgumentException("scheme must be http or https: " + scheme);
        }
        if (host.isEmpty()) throw new IllegalArgumentException("host must not be empty");
        String p = (path == null || path.isEmpty()) ? "/" : path;
        if (p.charAt(0) != '/') throw new IllegalArgumentException("path must start with '/': " + path);
        return new AbsoluteUrl(s, host, p);
    }

    public String scheme() { return scheme; }
    public String host() { return host; }
    public String path() { return path; }

    /** query/fragment 를 떼어낸 경로 */
    public String pathWithoutSuffix() {
        int cut = indexOfSuffix(path);
        return cut < 0 ? path : path.substring(0, cut);
    }

    /** host 대소문자 무시 비교 (same-host 정책) */
    public boolean sameHost(AbsoluteUrl other) {
        return other != null && host.equalsIgnoreCase(other.host);
    }

    static int indexOfSuffix(String p) {
        int q = p.indexOf('?');
        int f = p.indexOf('#');
        if (q < 0) return f;
        if (f < 0) return q;
        return Math.min(q, f);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AbsoluteUrl u)) return false;
        return scheme.equals(u.scheme) && host.equals(u.host) && path.equals(u.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, host, path);
    }

    @Override
    public String toString() {
        return scheme + "://" + host + path;
    }
}
