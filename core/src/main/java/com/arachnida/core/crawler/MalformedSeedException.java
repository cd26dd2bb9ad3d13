package com.arachnida.core.crawler;

/** 시드 URL 이 http(s) 절대 URL 로 파싱되지 않음. 실행 전 치명 오류. */
public class MalformedSeedException extends IllegalArgumentException {

    public MalformedSeedException(String seed) {
        super("Invalid URL (only http/https supported): " + seed);
    }
}
