package com.arachnida.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상). 순수 설정 보관용.
 * CLI 플래그가 있으면 로더 이후에 덮어쓴다.
 */
public final class CrawlConfig {

    /** 마크업 스캐너 선택: 기본은 패턴 매칭, JSOUP 은 엄격 파서 대체 구현 */
    public enum ScannerKind { PATTERN, JSOUP }

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) ArachnidaSpider/1.0";

    // ---------- 기본 필드 ----------
    private String target;                       // 시드 URL (필수)
    private boolean recursive = false;           // -r
    private int maxDepth = 5;                    // -l, recursive 일 때만 의미 있음
    private Path outputDir = Path.of("./data");  // -p
    private String userAgent = DEFAULT_USER_AGENT;

    private Duration timeout = Duration.ofSeconds(15);          // 페이지 요청
    private Duration downloadTimeout = Duration.ofSeconds(30);  // 이미지 다운로드
    private int concurrency = 1;                 // 워커 수, 1이면 완전 순차
    private int rps = 10;                        // 호스트별 초당 요청 상한
    private boolean followRedirects = true;
    private ScannerKind scanner = ScannerKind.PATTERN;

    /** img 태그에서 src 외에 추가로 볼 속성 (lazy-load: data-src 등) */
    private List<String> extraImageAttributes = List.of();

    /** img srcset 후보 URL 도 이미지로 수집할지 */
    private boolean srcsetImages = false;

    /** &lt;link rel=... href&gt; 중 따라갈 rel 값 (next, prev, canonical 등). 소문자 */
    private List<String> relLinks = List.of();

    // ---------- getters ----------
    public String getTarget() { return target; }
    public boolean isRecursive() { return recursive; }
    public int getMaxDepth() { return maxDepth; }
    public Path getOutputDir() { return outputDir; }
    public String getUserAgent() { return userAgent; }
    public Duration getTimeout() { return timeout; }
    public Duration getDownloadTimeout() { return downloadTimeout; }
    public int getConcurrency() { return concurrency; }
    public int getRps() { return rps; }
    public boolean isFollowRedirects() { return followRedirects; }
    public ScannerKind getScanner() { return scanner; }
    public List<String> getExtraImageAttributes() { return extraImageAttributes; }
    public boolean isSrcsetImages() { return srcsetImages; }
    public List<String> getRelLinks() { return relLinks; }

    /** 시드 작업의 남은 깊이: 재귀가 꺼져 있으면 0 */
    public int seedDepth() { return recursive ? maxDepth : 0; }

    // ---------- fluent setters ----------
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setRecursive(boolean v) { this.recursive = v; return this; }
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public CrawlConfig setUserAgent(String ua) {
        this.userAgent = (ua == null || ua.isBlank()) ? DEFAULT_USER_AGENT : ua.trim();
        return this;
    }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setDownloadTimeout(Duration d) { this.downloadTimeout = d; return this; }
    public CrawlConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
    public CrawlConfig setRps(int rps) { this.rps = rps; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setScanner(ScannerKind kind) {
        this.scanner = (kind != null ? kind : ScannerKind.PATTERN);
        return this;
    }
    public CrawlConfig setExtraImageAttributes(List<String> attrs) {
        this.extraImageAttributes = (attrs == null ? List.of() : List.copyOf(attrs));
        return this;
    }
    public CrawlConfig setSrcsetImages(boolean v) { this.srcsetImages = v; return this; }
    public CrawlConfig setRelLinks(List<String> rels) {
        List<String> out = new ArrayList<>();
        if (rels != null) {
            for (String r : rels) {
                if (r != null && !r.isBlank()) out.add(r.strip().toLowerCase(Locale.ROOT));
            }
        }
        this.relLinks = List.copyOf(out);
        return this;
    }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
    public CrawlConfig setDownloadTimeoutMs(long ms) {
        this.downloadTimeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (rps <= 0) throw new IllegalArgumentException("rps must be > 0");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (downloadTimeout == null || downloadTimeout.isNegative() || downloadTimeout.isZero())
            throw new IllegalArgumentException("downloadTimeout must be > 0");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(userAgent, "userAgent");
        Objects.requireNonNull(extraImageAttributes, "extraImageAttributes");
        Objects.requireNonNull(relLinks, "relLinks");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }
    public long getDownloadTimeoutMs() { return downloadTimeout.toMillis(); }
}
