package com.arachnida.core.http;

import com.arachnida.core.api.ITransport;
import com.arachnida.core.model.CrawlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;

/** java.net.http 기반 ITransport. 재시도 없음, 호출당 고정 타임아웃. */
public class HttpTransport implements ITransport {

    private static final Logger LOG = LoggerFactory.getLogger(HttpTransport.class);

    private static final String ACCEPT_HTML =
            "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final String ACCEPT_IMAGE = "image/*,*/*;q=0.8";

    private final HttpClient client;
    private final Duration pageTimeout;
    private final Duration downloadTimeout;

    public HttpTransport(CrawlConfig config) {
        this(HttpClient.newBuilder()
                        .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                        .connectTimeout(config.getTimeout())
                        .build(),
                config.getTimeout(),
                config.getDownloadTimeout());
    }

    public HttpTransport(HttpClient client, Duration pageTimeout, Duration downloadTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.pageTimeout = Objects.requireNonNull(pageTimeout, "pageTimeout");
        this.downloadTimeout = Objects.requireNonNull(downloadTimeout, "downloadTimeout");
    }

    @Override
    public Response fetchText(String url, String userAgent) {
        try {
            HttpRequest req = request(url, userAgent, pageTimeout, ACCEPT_HTML);
            HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int code = res.statusCode();
            if (code < 200 || code >= 300) {
                return Response.fail(code, "status " + code);
            }
            return Response.ok(code, res.body());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return Response.fail(0, "interrupted");
        } catch (IOException | IllegalArgumentException e) {
            // 타임아웃(HttpTimeoutException)도 여기로 온다
            return Response.fail(0, e.toString());
        }
    }

    @Override
    public Response downloadTo(String url, String userAgent, Path destination) {
        Objects.requireNonNull(destination, "destination");
        Path target = destination.toAbsolutePath();
        Path part;
        try {
            // 같은 디렉터리의 임시 파일로 받고 2xx 일 때만 destination 으로 옮긴다
            part = Files.createTempFile(target.getParent(), ".spider-", ".part");
        } catch (IOException e) {
            return Response.fail(0, e.toString());
        }
        try {
            HttpRequest req = request(url, userAgent, downloadTimeout, ACCEPT_IMAGE);
            HttpResponse<Path> res = client.send(req, HttpResponse.BodyHandlers.ofFile(part));
            int code = res.statusCode();
            if (code < 200 || code >= 300) {
                return Response.fail(code, "status " + code);
            }
            moveIntoPlace(part, target);
            return Response.ok(code, "");
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return Response.fail(0, "interrupted");
        } catch (IOException | IllegalArgumentException e) {
            return Response.fail(0, e.toString());
        } finally {
            removePartial(part);
        }
    }

    private static void moveIntoPlace(Path part, Path target) throws IOException {
        try {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static HttpRequest request(String url, String userAgent, Duration timeout, String accept) {
        // 마크업에서 온 URL 은 공백이 섞여 있을 수 있음
        return HttpRequest.newBuilder(URI.create(url.replace(" ", "%20")))
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", accept)
                .GET()
                .build();
    }

    private static void removePartial(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary download {}: {}", file, e.toString());
        }
    }
}
