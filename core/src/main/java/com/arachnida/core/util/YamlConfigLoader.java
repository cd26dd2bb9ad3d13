package com.arachnida.core.util;

import com.arachnida.core.model.CrawlConfig;
import com.arachnida.core.model.CrawlConfig.ScannerKind;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * crawl.yml 을 읽어 CrawlConfig 로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com/"
 * recursive: true
 * maxDepth: 5
 * userAgent: "..."
 * timeoutMs: 15000
 * downloadTimeoutMs: 30000
 * concurrency: 1
 * rps: 10
 * followRedirects: true
 * scanner: PATTERN | JSOUP
 * output:
 *   dir: "./data"
 * images:
 *   extraAttributes: ["data-src"]
 *   srcset: false
 * links:
 *   relLinks: ["next", "prev", "canonical"]
 *
 * target 은 CLI 에서 채울 수 있으므로 여기서는 validate() 하지 않는다.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static CrawlConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        CrawlConfig cfg = CrawlConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        // 1) 평면 키
        setString(map, "target", cfg::setTarget);
        setBoolean(map, "recursive", cfg::setRecursive);
        setInt(map, "maxDepth", cfg::setMaxDepth);
        setString(map, "userAgent", cfg::setUserAgent);
        setLong(map, "timeoutMs", cfg::setTimeoutMs);
        setLong(map, "downloadTimeoutMs", cfg::setDownloadTimeoutMs);
        setInt(map, "concurrency", cfg::setConcurrency);
        setInt(map, "rps", cfg::setRps);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setScanner(map, "scanner", cfg::setScanner);

        // 2) output.dir
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
        }

        // 3) images.extraAttributes
        Map<String, Object> images = getMap(map, "images");
        if (images != null) {
            setStringList(images, "extraAttributes", cfg::setExtraImageAttributes);
            setBoolean(images, "srcset", cfg::setSrcsetImages);
        }

        // 4) links.relLinks
        Map<String, Object> links = getMap(map, "links");
        if (links != null) {
            setStringList(links, "relLinks", cfg::setRelLinks);
        }
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null && !String.valueOf(o).isBlank()) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setScanner(Map<?, ?> map, String key, Consumer<ScannerKind> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim().toUpperCase(Locale.ROOT);
        try {
            setter.accept(ScannerKind.valueOf(s));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown scanner: " + v + " (use PATTERN or JSOUP)", e);
        }
    }
}
