package com.arachnida.core.util;

import com.arachnida.core.model.AbsoluteUrl;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/** 호스트별 RateLimiter 묶음. 같은 host(대소문자 무시)는 하나의 버킷을 공유한다. */
public final class HostThrottle {
    private final int rps;
    private final ConcurrentHashMap<String, RateLimiter> perHost = new ConcurrentHashMap<>();

    public HostThrottle(int rps) {
        if (rps <= 0) throw new IllegalArgumentException("rps must be > 0");
        this.rps = rps;
    }

    public void acquire(AbsoluteUrl url) throws InterruptedException {
        limiterFor(url.host()).acquire();
    }

    RateLimiter limiterFor(String host) {
        String key = host.toLowerCase(Locale.ROOT);
        return perHost.computeIfAbsent(key, h -> RateLimiter.perSecond(rps));
    }

    int hostCount() { return perHost.size(); }
}
