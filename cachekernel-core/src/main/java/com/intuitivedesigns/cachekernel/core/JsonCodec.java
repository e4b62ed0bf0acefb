/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON encoding for structured cache values (Jackson).
 * <p>
 * The mapper is shared and thread-safe once configured.
 */
public final class JsonCodec {

    private final ObjectMapper mapper;

    public JsonCodec() {
        this(new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public JsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public byte[] encode(String key, Object value) throws SerializationException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new SerializationException("encode", key, e);
        }
    }

    public <T> T decode(String key, byte[] raw, JavaType type) throws SerializationException {
        try {
            return mapper.readValue(raw, type);
        } catch (IOException e) {
            throw new SerializationException("decode", key, e);
        }
    }

    public JavaType type(Class<?> type) {
        return mapper.getTypeFactory().constructType(type);
    }

    public JavaType type(TypeReference<?> type) {
        return mapper.getTypeFactory().constructType(type);
    }
}
