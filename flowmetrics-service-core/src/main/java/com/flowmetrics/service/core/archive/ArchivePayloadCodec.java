package com.flowmetrics.service.core.archive;

import com.flowmetrics.service.core.support.JsonUtil;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/** Serialization helpers for persisting archive payloads: gzip-compressed JSON of {@link AggregateStats}. */
public final class ArchivePayloadCodec {

    private ArchivePayloadCodec() {}

    public static byte[] serialize(AggregateStats stats) {
        if (stats == null) {
            return new byte[0];
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(96);
        try (OutputStream out = new GZIPOutputStream(bytes)) {
            JsonUtil.mapper().writeValue(out, stats);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to serialize archive payload", ex);
        }
        return bytes.toByteArray();
    }

    public static AggregateStats deserialize(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return AggregateStats.EMPTY;
        }
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(payload))) {
            return JsonUtil.mapper().readValue(in, AggregateStats.class);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to deserialize archive payload", ex);
        }
    }
}
