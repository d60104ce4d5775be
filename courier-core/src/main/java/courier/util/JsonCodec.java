package courier.util;

import java.util.List;
import java.util.Map;

/**
 * Codec for flat JSON objects whose values are strings, numbers, booleans or null.
 *
 * <p>Frames and mirrored envelopes are flat by construction, so the default
 * implementation ({@link DefaultJsonCodec}) is a lightweight, zero-dependency
 * encoder/decoder. Users who already have Jackson, Gson, or another JSON library on
 * the classpath can implement this interface to delegate to their preferred library.
 *
 * @see #getDefault()
 * @see DefaultJsonCodec
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a flat field map as a JSON object string. {@link Number} and {@link Boolean}
     * values are written as JSON literals, {@code null} as {@code null}, everything else as
     * a JSON string via {@link Object#toString()}.
     *
     * @param fields the fields to encode, in iteration order
     * @return JSON object string (never {@code null})
     */
    String toJson(Map<String, ?> fields);

    /**
     * Parses a flat JSON object into a string map. Literal values (numbers, {@code true},
     * {@code false}) are returned as their source text; {@code null} members are skipped.
     * Returns an empty map for {@code null}, empty, or {@code "null"} input.
     *
     * @param json the JSON string to parse
     * @return parsed map (never {@code null})
     * @throws IllegalArgumentException if the input is not a valid flat JSON object
     */
    Map<String, String> parseObject(String json);

    /**
     * Encodes flat field maps as a JSON array of objects.
     *
     * @param elements the objects to encode, in order
     * @return JSON array string (never {@code null})
     */
    default String toJsonArray(List<? extends Map<String, ?>> elements) {
        StringBuilder sb = new StringBuilder().append('[');
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(toJson(elements.get(i)));
        }
        return sb.append(']').toString();
    }

    /**
     * Parses a JSON array whose elements are flat objects, each decoded as by
     * {@link #parseObject(String)}.
     *
     * @param json the JSON string to parse
     * @return parsed objects in order (never {@code null})
     * @throws IllegalArgumentException if the input is not an array of flat JSON objects
     */
    List<Map<String, String>> parseArray(String json);
}
