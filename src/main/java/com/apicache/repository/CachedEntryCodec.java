package com.apicache.repository;

import com.apicache.config.ApiCacheProperties;
import com.apicache.exception.CacheStoreException;
import com.apicache.model.CachedEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Serializes cache entries as JSON, optionally GZIP-compressed.
 * Decoding recognises both forms, so the compression flag can change without flushing the store.
 */
@Component
public class CachedEntryCodec {

    private static final int GZIP_MAGIC_FIRST = 0x1f;
    private static final int GZIP_MAGIC_SECOND = 0x8b;

    private final ObjectMapper objectMapper;
    private final boolean compressionEnabled;

    @Autowired
    public CachedEntryCodec(ObjectMapper objectMapper, ApiCacheProperties properties) {
        this(objectMapper, properties.getCache().isCompressionEnabled());
    }

    public CachedEntryCodec(ObjectMapper objectMapper, boolean compressionEnabled) {
        this.objectMapper = objectMapper;
        this.compressionEnabled = compressionEnabled;
    }

    public byte[] encode(CachedEntry entry) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(entry);
            return compressionEnabled ? compress(json) : json;
        } catch (IOException e) {
            throw new CacheStoreException("failed to marshal cached entry", e);
        }
    }

    public CachedEntry decode(byte[] data) {
        try {
            byte[] json = isGzip(data) ? decompress(data) : data;
            return objectMapper.readValue(json, CachedEntry.class);
        } catch (IOException e) {
            throw new CacheStoreException("failed to unmarshal cached entry", e);
        }
    }

    private static boolean isGzip(byte[] data) {
        return data.length >= 2
                && (data[0] & 0xff) == GZIP_MAGIC_FIRST
                && (data[1] & 0xff) == GZIP_MAGIC_SECOND;
    }

    private static byte[] compress(byte[] json) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
            gzipOut.write(json);
        }
        return baos.toByteArray();
    }

    private static byte[] decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return gzipIn.readAllBytes();
        }
    }
}
