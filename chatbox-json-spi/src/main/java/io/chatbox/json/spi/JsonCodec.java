package io.chatbox.json.spi;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Minimal JSON codec used for wire payloads and stored rows.
 *
 * <p>Implementations wrap a concrete JSON library. Domain types are records; maps are used only for loosely
 * typed request bodies.
 */
public interface JsonCodec {

    byte[] writeBytes(Object value) throws JsonException;

    String writeString(Object value) throws JsonException;

    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    <T> T readValue(String json, Class<T> type) throws JsonException;

    <T> T readValue(InputStream input, Class<T> type) throws JsonException;

    <T> List<T> readList(String json, Class<T> elementType) throws JsonException;

    /**
     * Parses a JSON object into a map of plain values (strings, numbers, booleans, lists, maps).
     *
     * @throws JsonException if the input is not a JSON object
     */
    Map<String, Object> readObject(byte[] data) throws JsonException;
}
