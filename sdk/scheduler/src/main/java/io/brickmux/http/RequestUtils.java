package io.brickmux.http;

import org.apache.commons.lang3.StringUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Map;
import java.util.TreeMap;

/**
 * Utilities for handling HTTP requests from clients.
 */
public final class RequestUtils {

    private RequestUtils() {
        // do not instantiate
    }

    /**
     * Parses a JSON object payload of string values, returning the corresponding Java map. Non-string values are
     * converted to their string form, so that {@code {"cluster.max-bricks-per-process": 3}} is accepted.
     *
     * @throws JSONException if the provided string could not be parsed as a JSON object
     */
    public static Map<String, String> parseJsonStringMap(String payload) throws JSONException {
        Map<String, String> map = new TreeMap<>();
        if (StringUtils.isBlank(payload)) {
            return map;
        }
        return toStringMap(new JSONObject(payload));
    }

    /**
     * Converts the provided JSON object to a map of strings.
     *
     * @throws JSONException if a value is null or a nested object or array
     */
    public static Map<String, String> toStringMap(JSONObject obj) throws JSONException {
        Map<String, String> map = new TreeMap<>();
        for (String key : obj.keySet()) {
            Object value = obj.get(key);
            if (value == JSONObject.NULL || value instanceof JSONObject || value instanceof JSONArray) {
                throw new JSONException(String.format("Value of '%s' must be a string: %s", key, value));
            }
            map.put(key, value.toString());
        }
        return map;
    }
}
