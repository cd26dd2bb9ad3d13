package com.arachnida.core.crawler;

import com.arachnida.core.api.ICrawler;
import com.arachnida.core.api.ITransport;
import com.arachnida.core.api.ITransport.Response;
import com.arachnida.core.http.HttpTransport;
import com.arachnida.core.model.AbsoluteUrl;
import com.arachnida.core.model.CrawlConfig;
import com.arachnida.core.model.CrawlReport;
import com.arachnida.core.model.CrawlStats;
import com.arachnida.core.model.CrawlTask;
import com.arachnida.core.util.HostThrottle;
import com.arachnida.core.util.StructuredLog;
import com.arachnida.core.util.UrlResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 크롤 오케스트레이터:
 *  - fetch → scan(img/src, a/href) → resolve → classify → download / 자식 작업
 *  - 설정 시 img/srcset 후보와 link[rel=next|prev|...]/href 도 함께 수집
 *  - 재귀 대신 CrawlTask 워크리스트 + 고정 스레드풀(동시성=concurrency)
 *  - visited / downloaded 는 원자적 check-and-insert (ConcurrentHashMap keySet.add)
 *  - 링크 추적만 시드 host 로 제한, 이미지 다운로드는 host 제한 없음
 *  - 실패는 URL 단위로 격리, 재시도 없음
 */
public class CrawlEngine implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlEngine.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlEngine.class);

    private final CrawlConfig config;
    private final ITransport transport;
    private final MarkupScanner scanner;
    private final HostThrottle throttle;

    /** 기본 구현(HttpTransport + 설정된 스캐너) */
    public CrawlEngine(CrawlConfig config) {
        this(config, new HttpTransport(config), scannerFor(config));
    }

    /** DI/테스트용 */
    public CrawlEngine(CrawlConfig config, ITransport transport) {
        this(config, transport, scannerFor(config));
    }

    public CrawlEngine(CrawlConfig config, ITransport transport, MarkupScanner scanner) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.transport = Objects.requireNonNull(transport, "transport");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.throttle = new HostThrottle(config.getRps());
    }

    public static MarkupScanner scannerFor(CrawlConfig config) {
        return config.getScanner() == CrawlConfig.ScannerKind.JSOUP
                ? new JsoupMarkupScanner()
                : new PatternMarkupScanner();
    }

    @Override
    public CrawlReport crawl() {
        return crawl(config.getTarget());
    }

    /**
     * seed 에서 한 번 크롤. 방문/다운로드 집합은 호출마다 새로 만든다.
     * @throws MalformedSeedException seed 가 http(s) URL 이 아니면 (fetch 전)
     */
    public CrawlReport crawl(String seedUrl) {
        AbsoluteUrl seed = UrlResolver.parse(seedUrl)
                .orElseThrow(() -> new MalformedSeedException(seedUrl));
        return new Run(seed).execute();
    }

    @Override
    public void close() throws Exception {
        transport.close();
    }

    /** 한 번의 실행 상태. 실행 종료와 함께 버려진다. */
    private final class Run {
        private final AbsoluteUrl seed;
        private final Set<String> visited = ConcurrentHashMap.newKeySet();
        private final Set<String> downloaded = ConcurrentHashMap.newKeySet();
        private final CrawlStats stats = new CrawlStats();
        private final AtomicInteger active = new AtomicInteger(0);
        private final List<String> imageAttributes;
        private final Set<String> relLinks;

        Run(AbsoluteUrl seed) {
            this.seed = seed;
            Set<String> attrs = new LinkedHashSet<>();
            attrs.add("src");
            attrs.addAll(config.getExtraImageAttributes());
            this.imageAttributes = List.copyOf(attrs);
            this.relLinks = Set.copyOf(config.getRelLinks());
        }

        CrawlReport execute() {
            final int cc = Math.max(1, config.getConcurrency());
            final long t0 = System.nanoTime();
            SLOG.info("crawl-start",
                    "seed", seed.toString(),
                    "recursive", config.isRecursive(),
                    "seedDepth", config.seedDepth(),
                    "out", config.getOutputDir().toString(),
                    "cc", cc);

            ExecutorService exec = Executors.newFixedThreadPool(cc, new NamedThreadFactory("crawl-worker"));
            ExecutorCompletionService<List<CrawlTask>> completion = new ExecutorCompletionService<>(exec);
            int inFlight = 0; // 스케줄러 스레드에서만 접근

            try {
                completion.submit(taskFor(new CrawlTask(seed, config.seedDepth())));
                inFlight++;

                while (inFlight > 0) {
                    Future<List<CrawlTask>> f = completion.take();
                    inFlight--;

                    List<CrawlTask> children;
                    try {
                        children = f.get();
                    } catch (ExecutionException e) {
                        Throwable cause = (e.getCause() != null ? e.getCause() : e);
                        SLOG.error("task-failed", cause, "cause", cause.toString());
                        continue;
                    }

                    for (CrawlTask child : children) {
                        // 빠른 컷일 뿐, 최종 판정은 process()의 visited.add
                        if (visited.contains(child.url().toString())) continue;
                        completion.submit(taskFor(child));
                        inFlight++;
                    }
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                LOG.warn("Crawl interrupted with {} task(s) in flight", inFlight);
            } finally {
                exec.shutdownNow();
                try {
                    exec.awaitTermination(30, TimeUnit.SECONDS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            CrawlStats.Snapshot snap = stats.snapshot();
            SLOG.info("crawl-done",
                    "visitedPages", visited.size(),
                    "attemptedImages", downloaded.size(),
                    "imagesSaved", snap.imagesSaved,
                    "pagesFailed", snap.pagesFailed,
                    "imagesFailed", snap.imagesFailed,
                    "maxObservedCC", snap.maxObservedConcurrency,
                    "elapsedMs", elapsedMs);
            return new CrawlReport(seed, config.getOutputDir(), visited, downloaded, snap, elapsedMs);
        }

        /** 워커 경계: 어떤 예외도 이 URL 밖으로 나가지 않는다 */
        private Callable<List<CrawlTask>> taskFor(CrawlTask task) {
            return () -> {
                try {
                    return process(task);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return List.of();
                } catch (RuntimeException e) {
                    stats.pageFailed();
                    SLOG.error("page-crashed", e, "url", task.url().toString());
                    return List.of();
                }
            };
        }

        List<CrawlTask> process(CrawlTask task) throws InterruptedException {
            final String pageUrl = task.url().toString();
            if (!visited.add(pageUrl)) return List.of(); // 사이클/중복 경로 종료 지점

            int cur = active.incrementAndGet();
            stats.observeConcurrency(cur);
            try {
                LOG.info("[PAGE] {} (depthLeft={})", pageUrl, task.depthRemaining());
                throttle.acquire(task.url());
                Response page = transport.fetchText(pageUrl, config.getUserAgent());
                if (!page.ok()) {
                    stats.pageFailed();
                    SLOG.warn("page-failed", "url", pageUrl, "status", page.status, "error", page.describe());
                    return List.of();
                }
                stats.pageFetched();
                SLOG.debug("page-fetched", "url", pageUrl, "depthLeft", task.depthRemaining(),
                        "bytes", page.body.length());

                downloadImages(task.url(), page.body);

                if (!config.isRecursive() || task.depthRemaining() <= 0) return List.of();
                return followLinks(task, page.body);
            } finally {
                active.decrementAndGet();
            }
        }

        private void downloadImages(AbsoluteUrl page, String html) throws InterruptedException {
            for (String attr : imageAttributes) {
                for (String raw : scanner.findAttributeValues(html, "img", attr)) {
                    considerImage(page, attr, raw);
                }
            }
            if (config.isSrcsetImages()) {
                for (String srcset : scanner.findAttributeValues(html, "img", "srcset")) {
                    for (String raw : ImageClassifier.srcsetCandidates(srcset)) {
                        considerImage(page, "srcset", raw);
                    }
                }
            }
        }

        private void considerImage(AbsoluteUrl page, String attr, String raw) throws InterruptedException {
            Optional<AbsoluteUrl> resolved = UrlResolver.resolve(page, raw);
            if (resolved.isEmpty()) {
                LOG.debug("Unresolvable {} '{}' on {}", attr, raw, page);
                return;
            }
            AbsoluteUrl img = resolved.get();
            if (!ImageClassifier.isImage(img)) return;
            if (!downloaded.add(img.toString())) return;

            downloadOne(img);
        }

        private void downloadOne(AbsoluteUrl img) throws InterruptedException {
            final String imgUrl = img.toString();
            Path dest = config.getOutputDir().resolve(ImageClassifier.deriveFilename(img));
            throttle.acquire(img);
            try {
                Response r = transport.downloadTo(imgUrl, config.getUserAgent(), dest);
                if (r.ok()) {
                    stats.imageSaved();
                    LOG.info("  [IMG] {} -> {}", imgUrl, dest);
                    SLOG.debug("image-saved", "url", imgUrl, "path", dest.toString());
                } else {
                    stats.imageFailed();
                    SLOG.warn("image-failed", "url", imgUrl, "status", r.status, "error", r.describe());
                }
            } catch (RuntimeException e) {
                // 한 이미지 실패가 페이지/형제 이미지를 중단시키지 않도록
                stats.imageFailed();
                SLOG.error("image-failed", e, "url", imgUrl);
            }
        }

        private List<CrawlTask> followLinks(CrawlTask task, String html) {
            List<String> hrefs = new ArrayList<>(scanner.findAttributeValues(html, "a", "href"));
            if (!relLinks.isEmpty()) {
                hrefs.addAll(scanner.findAttributeValuesWhere(html, "link", "href", "rel", relLinks));
            }

            List<CrawlTask> children = new ArrayList<>();
            Set<String> queued = new HashSet<>();
            for (String raw : hrefs) {
                Optional<AbsoluteUrl> next = UrlResolver.resolve(task.url(), raw);
                if (next.isEmpty()) continue;
                AbsoluteUrl n = next.get();
                if (!n.sameHost(seed)) continue; // same-origin 정책은 링크마다 적용
                if (visited.contains(n.toString()) || !queued.add(n.toString())) continue;
                children.add(task.child(n));
            }
            return children;
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
