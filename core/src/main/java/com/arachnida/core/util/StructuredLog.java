package com.arachnida.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거.
 * 콘솔/파일 핸들러 세팅 후 여기서 호출하면 한 줄짜리 JSON 으로 찍힘.
 * 사용: SLOG.info("page-fetched", "url", url, "depthLeft", 2)
 */
public final class StructuredLog {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,   event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,   event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING,event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        Map<String, Object> m = fields(lvl, event, t, kvs);
        try {
            return MAPPER.writeValueAsString(m);
        } catch (JsonProcessingException e) {
            // 값은 이미 문자열/숫자/불리언이라 사실상 도달 불가
            return m.toString();
        }
    }

    private Map<String, Object> fields(Level lvl, String event, Throwable t, Object... kvs) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ts", Instant.now().toString());
        m.put("lvl", lvl.getName());
        m.put("comp", comp);
        m.put("thread", Thread.currentThread().getName());
        m.put("event", event);

        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                Object v = kvs[i + 1];
                m.put(String.valueOf(kvs[i]), v == null || v instanceof Number || v instanceof Boolean ? v : String.valueOf(v));
            }
            if (kvs.length % 2 == 1) m.put("_kv_mismatch", true);
        }
        if (t != null) {
            m.put("error", t.getClass().getSimpleName());
            m.put("message", t.getMessage());
        }
        return m;
    }
}
