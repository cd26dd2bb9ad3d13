// ICrawler.java
package com.arachnida.core.api;

import com.arachnida.core.model.CrawlReport;

/** 크롤러 최소 계약: 설정된 시드에서 한 번 돌고 결과를 돌려준다. */
public interface ICrawler extends AutoCloseable {
    CrawlReport crawl();
    @Override default void close() throws Exception {}
}
