package com.arachnida.core.crawler;

import com.arachnida.core.model.CrawlConfig;
import com.arachnida.core.model.CrawlReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CrawlEngine — 깊이 제한 / same-host / 이미지 다운로드")
class CrawlEngineTest {

    @TempDir
    Path out;

    private CrawlConfig cfg(String seed, boolean recursive, int depth) {
        return CrawlConfig.defaults()
                .setTarget(seed)
                .setRecursive(recursive)
                .setMaxDepth(depth)
                .setRps(10_000)
                .setOutputDir(out);
    }

    private static CrawlReport run(CrawlConfig cfg, FakeTransport t) {
        return new CrawlEngine(cfg, t).crawl();
    }

    @Test
    @DisplayName("end-to-end: 상대 이미지 + 두번째 페이지의 외부 host 이미지까지 저장")
    void endToEnd_crossHostImageOnSecondPage() {
        var t = new FakeTransport()
                .page("http://site.test/index.html",
                        "<html><img src=\"pics/a.png\"><a href=\"/next.html\">next</a></html>")
                .page("http://site.test/next.html",
                        "<img src='http://other.test/x.png'>");

        CrawlReport r = run(cfg("http://site.test/index.html", true, 1), t);

        assertThat(r.visitedPages())
                .containsExactlyInAnyOrder("http://site.test/index.html", "http://site.test/next.html");
        assertThat(r.attemptedImages())
                .containsExactlyInAnyOrder("http://site.test/pics/a.png", "http://other.test/x.png");
        assertThat(out.resolve("a.png")).exists();
        assertThat(out.resolve("x.png")).exists();
        assertThat(r.imagesSaved()).isEqualTo(2);
        assertThat(r.pagesFailed()).isZero();
        assertThat(r.stats().pagesFetched).isEqualTo(2);
    }

    @Test
    @DisplayName("-r 없이: 시드 페이지 이미지만, 링크는 따라가지 않음")
    void nonRecursive_seedOnly() {
        var t = new FakeTransport()
                .page("http://site.test/", "<img src=a.jpg><a href=next.html>n</a>")
                .page("http://site.test/next.html", "<img src=b.jpg>");

        CrawlReport r = run(cfg("http://site.test/", false, 5), t);

        assertThat(r.visitedPages()).containsExactly("http://site.test/");
        assertThat(t.fetches("http://site.test/next.html")).isZero();
        assertThat(r.attemptedImages()).containsExactly("http://site.test/a.jpg");
    }

    @Test
    @DisplayName("maxDepth=2: 시드에서 2-hop 까지만 fetch")
    void depthBound() {
        var t = new FakeTransport()
                .page("http://s.test/0", "<a href=\"/1\">")
                .page("http://s.test/1", "<a href=\"/2\">")
                .page("http://s.test/2", "<a href=\"/3\"><img src=\"/deep.gif\">")
                .page("http://s.test/3", "<img src=\"/deeper.gif\">");

        CrawlReport r = run(cfg("http://s.test/0", true, 2), t);

        assertThat(r.visitedPages()).containsExactlyInAnyOrder("http://s.test/0", "http://s.test/1", "http://s.test/2");
        assertThat(t.fetches("http://s.test/3")).isZero();
        // 깊이 0 페이지도 이미지는 처리
        assertThat(r.attemptedImages()).containsExactly("http://s.test/deep.gif");
    }

    @Test
    @DisplayName("maxDepth=0 + -r: 시드만")
    void depthZero() {
        var t = new FakeTransport()
                .page("http://s.test/", "<a href=\"/a\">")
                .page("http://s.test/a", "");

        CrawlReport r = run(cfg("http://s.test/", true, 0), t);

        assertThat(r.visitedPages()).containsExactly("http://s.test/");
    }

    @Test
    @DisplayName("사이클(a↔b, 자기참조)은 한 번씩만 fetch")
    void cyclesFetchedOnce() {
        var t = new FakeTransport()
                .page("http://s.test/a", "<a href=\"b\"><a href=\"a\"><a href=\"/a\">")
                .page("http://s.test/b", "<a href=\"a\"><a href=\"http://s.test/b\">");

        CrawlReport r = run(cfg("http://s.test/a", true, 10), t);

        assertThat(r.visitedPages()).containsExactlyInAnyOrder("http://s.test/a", "http://s.test/b");
        assertThat(t.fetches("http://s.test/a")).isEqualTo(1);
        assertThat(t.fetches("http://s.test/b")).isEqualTo(1);
    }

    @Test
    @DisplayName("다른 host 링크는 따라가지 않지만 host 대소문자는 무시")
    void sameHostOnly() {
        var t = new FakeTransport()
                .page("http://site.test/", "<a href=\"http://other.test/p.html\"><a href=\"HTTP://SITE.test/up.html\">"
                        + "<a href=\"//cdn.site.test/c.html\">")
                .page("http://SITE.test/up.html", "<p>ok</p>")
                .page("http://other.test/p.html", "<img src=\"/never.png\">");

        CrawlReport r = run(cfg("http://site.test/", true, 3), t);

        assertThat(t.fetches("http://other.test/p.html")).isZero();
        assertThat(t.fetches("http://cdn.site.test/c.html")).isZero();
        assertThat(t.fetches("http://SITE.test/up.html")).isEqualTo(1);
        assertThat(r.attemptedImages()).isEmpty();
    }

    @Test
    @DisplayName("trailing slash 가 다르면 다른 페이지로 본다")
    void trailingSlashVariantsAreDistinct() {
        var t = new FakeTransport()
                .page("http://s.test/", "<a href=\"/dir\"><a href=\"/dir/\">")
                .page("http://s.test/dir", "")
                .page("http://s.test/dir/", "");

        CrawlReport r = run(cfg("http://s.test/", true, 1), t);

        assertThat(r.visitedPages()).hasSize(3);
    }

    @Test
    @DisplayName("javascript:/mailto:/# 링크와 비이미지 src 는 무시")
    void ignoresPseudoLinksAndNonImages() {
        var t = new FakeTransport()
                .page("http://s.test/", "<a href=\"javascript:void(0)\"><a href=\"mailto:a@b.c\"><a href=\"#top\">"
                        + "<img src=\"logo.svg\"><img src=\"\"><img src=\"photo.JPEG?w=200\">");

        CrawlReport r = run(cfg("http://s.test/", true, 3), t);

        assertThat(t.fetchCalls).containsOnlyKeys("http://s.test/");
        assertThat(r.attemptedImages()).containsExactly("http://s.test/photo.JPEG?w=200");
        assertThat(out.resolve("photo.JPEG")).exists();
    }

    @Test
    @DisplayName("여러 페이지에 같은 이미지가 있어도 한 번만 다운로드")
    void sameImageDownloadedOnce() {
        var t = new FakeTransport()
                .page("http://s.test/", "<img src=\"/i/logo.png\"><a href=\"/p\"><img src=\"i/logo.png\">")
                .page("http://s.test/p", "<img src=\"http://s.test/i/logo.png\">");

        CrawlReport r = run(cfg("http://s.test/", true, 1), t);

        assertThat(t.downloads("http://s.test/i/logo.png")).isEqualTo(1);
        assertThat(r.attemptedImages()).containsExactly("http://s.test/i/logo.png");
    }

    @Test
    @DisplayName("시드 URL 은 Transport 에 설정된 User-Agent 로 요청")
    void passesConfiguredUserAgent() {
        var t = new FakeTransport().page("http://s.test/", "");
        CrawlConfig c = cfg("http://s.test/", false, 0).setUserAgent("TestBot/2");

        run(c, t);

        assertThat(t.lastUserAgent()).isEqualTo("TestBot/2");
    }

    @Test
    @DisplayName("img data-src 등 추가 속성 설정 시 함께 수집")
    void extraImageAttributes() {
        var t = new FakeTransport()
                .page("http://s.test/", "<img data-src=\"lazy.png\" src=\"ph.gif\">");

        CrawlReport plain = run(cfg("http://s.test/", false, 0), t);
        assertThat(plain.attemptedImages()).containsExactly("http://s.test/ph.gif");

        CrawlReport lazy = run(cfg("http://s.test/", false, 0).setExtraImageAttributes(List.of("data-src")), t);
        assertThat(lazy.attemptedImages()).containsExactlyInAnyOrder("http://s.test/ph.gif", "http://s.test/lazy.png");
    }

    @Test
    @DisplayName("JSOUP 스캐너로 바꿔도 같은 결과")
    void jsoupScannerSelectable() {
        var t = new FakeTransport()
                .page("http://site.test/index.html",
                        "<html><body><IMG SRC=\"pics/a.png\"><a href=\"/next.html\">next</a></body></html>")
                .page("http://site.test/next.html", "<img src='http://other.test/x.png'>");

        CrawlConfig c = cfg("http://site.test/index.html", true, 1).setScanner(CrawlConfig.ScannerKind.JSOUP);
        assertThat(CrawlEngine.scannerFor(c)).isInstanceOf(JsoupMarkupScanner.class);

        CrawlReport r = run(c, t);
        assertThat(r.attemptedImages())
                .containsExactlyInAnyOrder("http://site.test/pics/a.png", "http://other.test/x.png");
    }

    @Test
    @DisplayName("crawl 호출마다 방문 집합은 새로 시작")
    void eachRunStartsFresh() {
        var t = new FakeTransport().page("http://s.test/", "<img src=a.png>");
        var engine = new CrawlEngine(cfg("http://s.test/", false, 0), t);

        engine.crawl();
        CrawlReport second = engine.crawl();

        assertThat(t.fetches("http://s.test/")).isEqualTo(2);
        assertThat(second.attemptedImages()).containsExactly("http://s.test/a.png");
    }

    @Test
    @DisplayName("close() 는 Transport 를 닫는다")
    void closeClosesTransport() throws Exception {
        var t = new FakeTransport();
        new CrawlEngine(cfg("http://s.test/", false, 0), t).close();
        assertThat(t.isClosed()).isTrue();
    }

    @Test
    @DisplayName("img srcset 후보는 images.srcset 을 켠 경우에만 수집")
    void srcsetCandidatesWhenEnabled() {
        var t = new FakeTransport()
                .page("http://s.test/g/",
                        "<img src=\"main.png\" srcset=\"small.png 1x, /big/large.png 2x, main.png 3x, icon.svg 4x\">");

        CrawlReport off = run(cfg("http://s.test/g/", false, 0), t);
        assertThat(off.attemptedImages()).containsExactly("http://s.test/g/main.png");

        CrawlReport on = run(cfg("http://s.test/g/", false, 0).setSrcsetImages(true), t);
        assertThat(on.attemptedImages()).containsExactlyInAnyOrder(
                "http://s.test/g/main.png", "http://s.test/g/small.png", "http://s.test/big/large.png");
        assertThat(out.resolve("large.png")).exists();
        // 한 실행 안에서 src 와 srcset 에 같은 URL 이 있어도 한 번만
        assertThat(t.downloads("http://s.test/g/main.png")).isEqualTo(2);
    }

    @Test
    @DisplayName("<link rel> 은 links.relLinks 에 있는 rel 만, same-host 로 따라간다")
    void relLinksWhenConfigured() {
        var t = new FakeTransport()
                .page("http://s.test/1", "<link rel=\"stylesheet\" href=\"/style.css\">"
                        + "<link rel=\"next\" href=\"/2\">"
                        + "<link href=\"http://other.test/1\" rel=\"Canonical\">")
                .page("http://s.test/2", "<link rel='prev' href='/1'><img src=\"p2.png\">");

        CrawlReport off = run(cfg("http://s.test/1", true, 2), t);
        assertThat(off.visitedPages()).containsExactly("http://s.test/1");

        CrawlConfig c = cfg("http://s.test/1", true, 2).setRelLinks(List.of("next", "prev", "canonical"));
        CrawlReport on = run(c, t);

        assertThat(on.visitedPages()).containsExactlyInAnyOrder("http://s.test/1", "http://s.test/2");
        assertThat(on.attemptedImages()).containsExactly("http://s.test/p2.png");
        assertThat(t.fetches("http://s.test/style.css")).isZero();
        assertThat(t.fetches("http://other.test/1")).isZero();
    }

    @Test
    @DisplayName("rel 링크는 JSOUP 스캐너에서도 같은 결과")
    void relLinksWithJsoupScanner() {
        var t = new FakeTransport()
                .page("http://s.test/1", "<html><head><link rel=\"alternate next\" href=\"/2\"></head></html>")
                .page("http://s.test/2", "");

        CrawlConfig c = cfg("http://s.test/1", true, 1)
                .setScanner(CrawlConfig.ScannerKind.JSOUP)
                .setRelLinks(List.of("NEXT"));

        assertThat(run(c, t).visitedPages()).containsExactlyInAnyOrder("http://s.test/1", "http://s.test/2");
    }

    @Nested
    @DisplayName("로깅")
    class Logging {

        private final Logger jul = Logger.getLogger(CrawlEngine.class.getName());
        private final List<LogRecord> records = new CopyOnWriteArrayList<>();
        private final Handler capture = new Handler() {
            @Override public void publish(LogRecord r) { records.add(r); }
            @Override public void flush() {}
            @Override public void close() {}
        };

        @BeforeEach
        void attach() {
            capture.setLevel(Level.ALL);
            jul.addHandler(capture);
        }

        @AfterEach
        void detach() {
            jul.removeHandler(capture);
        }

        private long warningsMentioning(String url) {
            return records.stream()
                    .filter(r -> r.getLevel().intValue() >= Level.WARNING.intValue())
                    .filter(r -> String.valueOf(r.getMessage()).contains(url))
                    .count();
        }

        @Test
        @DisplayName("실패한 페이지/이미지는 각각 WARN 한 줄만 남긴다")
        void failureLoggedOnce() {
            var t = new FakeTransport()
                    .page("http://s.test/", "<a href=\"/missing\"><img src=\"bad.png\">")
                    .failImage("http://s.test/bad.png");

            run(cfg("http://s.test/", true, 1), t);

            assertThat(warningsMentioning("http://s.test/missing")).isEqualTo(1);
            assertThat(warningsMentioning("http://s.test/bad.png")).isEqualTo(1);
        }

        @Test
        @DisplayName("crawl-start / crawl-done 은 한 번씩")
        void runEventsLoggedOnce() {
            run(cfg("http://s.test/", false, 0), new FakeTransport().page("http://s.test/", ""));

            assertThat(records.stream().filter(r -> String.valueOf(r.getMessage()).contains("crawl-start"))).hasSize(1);
            assertThat(records.stream().filter(r -> String.valueOf(r.getMessage()).contains("crawl-done"))).hasSize(1);
        }
    }

    @Nested
    @DisplayName("실패 격리")
    class Failures {

        @Test
        @DisplayName("잘못된 시드는 fetch 전에 MalformedSeedException")
        void malformedSeed() {
            var t = new FakeTransport();
            var engine = new CrawlEngine(cfg("ftp://s.test/", true, 1), t);

            assertThatThrownBy(engine::crawl)
                    .isInstanceOf(MalformedSeedException.class)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("ftp://s.test/");
            assertThat(t.fetchCalls).isEmpty();
        }

        @Test
        @DisplayName("시드 fetch 실패: 방문 1, 실패 1, 예외 없음")
        void seedFetchFails() {
            var t = new FakeTransport();

            CrawlReport r = run(cfg("http://s.test/missing", true, 2), t);

            assertThat(r.visitedPages()).containsExactly("http://s.test/missing");
            assertThat(r.pagesFailed()).isEqualTo(1);
            assertThat(r.attemptedImages()).isEmpty();
        }

        @Test
        @DisplayName("형제 페이지 404 는 다른 형제에 영향 없음")
        void siblingFailureIsolated() {
            var t = new FakeTransport()
                    .page("http://s.test/", "<a href=\"/bad\"><a href=\"/good\">")
                    .page("http://s.test/good", "<img src=\"g.png\">");

            CrawlReport r = run(cfg("http://s.test/", true, 1), t);

            assertThat(r.pagesFailed()).isEqualTo(1);
            assertThat(r.attemptedImages()).containsExactly("http://s.test/g.png");
            assertThat(out.resolve("g.png")).exists();
        }

        @Test
        @DisplayName("Transport 예외도 해당 URL 에서 멈춘다")
        void transportCrashIsolated() {
            var t = new FakeTransport()
                    .page("http://s.test/", "<a href=\"/boom\"><a href=\"/ok\">")
                    .page("http://s.test/ok", "<img src=\"ok.png\">")
                    .crashOn("http://s.test/boom");

            CrawlReport r = run(cfg("http://s.test/", true, 1), t);

            assertThat(r.pagesFailed()).isEqualTo(1);
            assertThat(r.visitedPages()).contains("http://s.test/boom", "http://s.test/ok");
            assertThat(r.imagesSaved()).isEqualTo(1);
        }

        @Test
        @DisplayName("이미지 하나가 실패해도 나머지 이미지와 링크는 계속")
        void imageFailureIsolated() {
            var t = new FakeTransport()
                    .page("http://s.test/", "<img src=\"bad.png\"><img src=\"ok.png\"><a href=\"/next\">")
                    .page("http://s.test/next", "<img src=\"more.png\">")
                    .failImage("http://s.test/bad.png");

            CrawlReport r = run(cfg("http://s.test/", true, 1), t);

            assertThat(r.stats().imagesFailed).isEqualTo(1);
            assertThat(r.imagesSaved()).isEqualTo(2);
            assertThat(out.resolve("bad.png")).doesNotExist();
            assertThat(out.resolve("more.png")).exists();
            // 실패한 이미지도 "시도됨" 으로 남아 재시도하지 않음
            assertThat(r.attemptedImages()).contains("http://s.test/bad.png");
        }
    }
}
