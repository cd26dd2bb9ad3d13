package com.arachnida.core.crawler;

import com.arachnida.core.model.AbsoluteUrl;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** 확장자 기반 이미지 판정 + 로컬 파일명 생성. */
public final class ImageClassifier {
    private ImageClassifier() {}

    public static final Set<String> IMAGE_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".gif", ".bmp");

    static final String FALLBACK_NAME = "image.bin";

    /** query/fragment 제거 후 소문자 경로의 확장자로 판정 */
    public static boolean isImage(AbsoluteUrl url) {
        if (url == null) return false;
        String p = url.pathWithoutSuffix().toLowerCase(Locale.ROOT);
        for (String ext : IMAGE_EXTENSIONS) {
            if (p.endsWith(ext)) return true;
        }
        return false;
    }

    /**
     * 경로의 마지막 세그먼트를 파일명으로. 비면 "image.bin".
     * [A-Za-z0-9._-] 외 문자는 '_' 로 치환. 서로 다른 URL 이 같은 이름이 되는 충돌은 해결하지 않는다.
     */
    public static String deriveFilename(AbsoluteUrl url) {
        String p = url.pathWithoutSuffix();
        String name = p.substring(p.lastIndexOf('/') + 1);
        if (name.isEmpty()) return FALLBACK_NAME;

        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean safe = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '.' || c == '_' || c == '-';
            sb.append(safe ? c : '_');
        }
        return sb.toString();
    }

    /**
     * srcset="a.png 1x, b.png 2x" → [a.png, b.png].
     * 쉼표로 후보를 나누고 각 후보의 첫 공백 앞 토큰(URL)만 취한다. 서술자(1x, 480w)는 버린다.
     */
    public static List<String> srcsetCandidates(String srcset) {
        List<String> out = new ArrayList<>();
        if (srcset == null) return out;
        for (String candidate : srcset.split(",")) {
            String c = candidate.strip();
            if (c.isEmpty()) continue;
            out.add(c.split("\\s+", 2)[0]);
        }
        return out;
    }
}
