package com.arachnida.core.model;

import java.nio.file.Path;
import java.util.Set;

/**
 * 한 번의 크롤 실행 결과.
 * visitedPages / attemptedImages 는 종료 시점의 불변 스냅샷(순서 없음).
 */
public record CrawlReport(
        AbsoluteUrl seed,
        Path outputDir,
        Set<String> visitedPages,
        Set<String> attemptedImages,
        CrawlStats.Snapshot stats,
        long elapsedMs
) {
    public CrawlReport {
        visitedPages = Set.copyOf(visitedPages);
        attemptedImages = Set.copyOf(attemptedImages);
    }

    public int imagesSaved() { return stats.imagesSaved; }
    public int pagesFailed() { return stats.pagesFailed; }
}
