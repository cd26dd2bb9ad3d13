package com.arachnida.core.model;

import java.util.Objects;

/** 재귀 작업 단위: 방문할 URL + 남은 깊이. 깊이는 홉마다 정확히 1 감소한다. */
public record CrawlTask(AbsoluteUrl url, int depthRemaining) {

    public CrawlTask {
        Objects.requireNonNull(url, "url");
        if (depthRemaining < 0) throw new IllegalArgumentException("depthRemaining must be >= 0");
    }

    /** 자식 작업(depth - 1). depthRemaining == 0 이면 호출 불가 */
    public CrawlTask child(AbsoluteUrl next) {
        return new CrawlTask(next, depthRemaining - 1);
    }
}
