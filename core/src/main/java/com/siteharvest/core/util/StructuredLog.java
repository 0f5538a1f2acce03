package com.siteharvest.core.util;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 한 줄짜리 이벤트 로거.
 * LogSetup 이 붙인 JUL 핸들러(콘솔/파일)로 그대로 흘러간다.
 */
public final class StructuredLog {

    private static final JsonFactory JSON = new JsonFactory();

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE, event, null, kvs); }
    public void info(String event, Object... kvs)  { log(Level.INFO, event, null, kvs); }
    public void warn(String event, Object... kvs)  { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    /** 패키지 내부 테스트용으로 노출 */
    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        StringWriter out = new StringWriter(128);
        try (JsonGenerator g = JSON.createGenerator(out)) {
            g.writeStartObject();
            g.writeStringField("ts", Instant.now().toString());
            g.writeStringField("lvl", lvl.getName());
            g.writeStringField("comp", comp);
            g.writeStringField("thread", Thread.currentThread().getName());
            g.writeStringField("event", event);
            if (kvs != null) {
                for (int i = 0; i + 1 < kvs.length; i += 2) {
                    field(g, String.valueOf(kvs[i]), kvs[i + 1]);
                }
                if (kvs.length % 2 == 1) g.writeBooleanField("_kv_mismatch", true);
            }
            if (t != null) {
                g.writeStringField("error", t.getClass().getSimpleName());
                g.writeStringField("message", t.getMessage());
            }
            g.writeEndObject();
        } catch (IOException e) {
            // StringWriter 는 IOException 을 던지지 않는다
            throw new IllegalStateException(e);
        }
        return out.toString();
    }

    private static void field(JsonGenerator g, String key, Object v) throws IOException {
        g.writeFieldName(key);
        if (v == null) {
            g.writeNull();
        } else if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
            g.writeNumber(((Number) v).longValue());
        } else if (v instanceof Number n) {
            g.writeNumber(n.doubleValue());
        } else if (v instanceof Boolean b) {
            g.writeBoolean(b);
        } else {
            g.writeString(String.valueOf(v));
        }
    }
}
