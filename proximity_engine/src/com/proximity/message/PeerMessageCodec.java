/*
 * Copyright (C) 2024 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.proximity.message;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;

/**
 * Converts {@link PeerMessage}s to and from their JSON wire form:
 * <pre>{"type": tag, "timestamp": seconds since epoch, "payload": {string: string}}</pre>
 * Binary values travel as base64 strings inside the payload.
 */
public final class PeerMessageCodec {
    private static final String FIELD_TYPE = "type";
    private static final String FIELD_TIMESTAMP = "timestamp";
    private static final String FIELD_PAYLOAD = "payload";
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final Gson mGson = new Gson();

    /** @return the wire bytes for {@code message}. */
    public byte @NonNull [] encode(@NonNull PeerMessage message) {
        Preconditions.checkArgument(message.getType() != PeerMessageType.UNKNOWN,
                "Unknown messages cannot be sent");
        JsonObject json = new JsonObject();
        json.addProperty(FIELD_TYPE, message.getType().getTag());
        json.addProperty(FIELD_TIMESTAMP, toEpochSeconds(message.getTimestamp()));
        JsonObject payload = new JsonObject();
        for (Map.Entry<String, String> entry : message.getPayload().entrySet()) {
            payload.addProperty(entry.getKey(), entry.getValue());
        }
        json.add(FIELD_PAYLOAD, payload);
        return mGson.toJson(json).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parse wire bytes. Well formed messages with an unrecognized type decode to
     * {@link PeerMessageType#UNKNOWN}.
     *
     * @throws MessageDecodeException if the bytes are not a well formed message.
     */
    public @NonNull PeerMessage decode(byte @NonNull [] bytes) throws MessageDecodeException {
        JsonElement root;
        try {
            root = JsonParser.parseString(new String(bytes, StandardCharsets.UTF_8));
        } catch (JsonParseException e) {
            throw new MessageDecodeException("Message is not valid JSON", e);
        }
        if (!root.isJsonObject()) {
            throw new MessageDecodeException("Message is not a JSON object");
        }
        JsonObject json = root.getAsJsonObject();

        String tag = getString(json, FIELD_TYPE);
        Instant timestamp = fromEpochSeconds(getNumber(json, FIELD_TIMESTAMP));

        ImmutableMap.Builder<String, String> payload = ImmutableMap.builder();
        JsonElement payloadElement = json.get(FIELD_PAYLOAD);
        if (payloadElement != null && !payloadElement.isJsonNull()) {
            if (!payloadElement.isJsonObject()) {
                throw new MessageDecodeException("Payload is not a JSON object");
            }
            for (Map.Entry<String, JsonElement> entry
                    : payloadElement.getAsJsonObject().entrySet()) {
                JsonElement value = entry.getValue();
                if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
                    throw new MessageDecodeException(
                            "Payload value for " + entry.getKey() + " is not a string");
                }
                payload.put(entry.getKey(), value.getAsString());
            }
        }
        return PeerMessage.create(PeerMessageType.fromTag(tag), timestamp, payload.build());
    }

    /** @return {@code bytes} as a base64 payload value. */
    public static @NonNull String encodeBinary(byte @NonNull [] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    /**
     * @return the bytes of a base64 payload value.
     * @throws MessageDecodeException if {@code value} is not valid base64.
     */
    public static byte @NonNull [] decodeBinary(@NonNull String value)
            throws MessageDecodeException {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new MessageDecodeException("Payload value is not valid base64", e);
        }
    }

    private static String getString(JsonObject json, String field)
            throws MessageDecodeException {
        JsonElement element = json.get(field);
        if (element == null || !element.isJsonPrimitive()
                || !element.getAsJsonPrimitive().isString()) {
            throw new MessageDecodeException("Missing string field " + field);
        }
        return element.getAsString();
    }

    private static double getNumber(JsonObject json, String field)
            throws MessageDecodeException {
        JsonElement element = json.get(field);
        if (element == null || !element.isJsonPrimitive()) {
            throw new MessageDecodeException("Missing numeric field " + field);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (!primitive.isNumber()) {
            throw new MessageDecodeException("Field " + field + " is not a number");
        }
        double value = primitive.getAsDouble();
        if (!Double.isFinite(value)) {
            throw new MessageDecodeException("Field " + field + " is not finite");
        }
        return value;
    }

    private static double toEpochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / NANOS_PER_SECOND;
    }

    private static Instant fromEpochSeconds(double seconds) throws MessageDecodeException {
        if (seconds < Instant.MIN.getEpochSecond() || seconds > Instant.MAX.getEpochSecond()) {
            throw new MessageDecodeException("Timestamp " + seconds + " is out of range");
        }
        long whole = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - whole) * NANOS_PER_SECOND);
        try {
            return Instant.ofEpochSecond(whole, nanos);
        } catch (DateTimeException | ArithmeticException e) {
            throw new MessageDecodeException("Timestamp " + seconds + " is out of range", e);
        }
    }
}
