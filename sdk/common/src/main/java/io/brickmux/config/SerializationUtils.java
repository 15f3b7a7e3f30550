package io.brickmux.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Contains static object serialization utilities for JSON and YAML.
 */
public class SerializationUtils {

    private SerializationUtils() {
        // do not instantiate
    }

    /**
     * An Object mapper that can be used for mapping Objects to and from YAML.
     */
    private static final ObjectMapper DEFAULT_YAML_MAPPER = registerDefaultModules(new ObjectMapper(new YAMLFactory()));

    /**
     * An Object mapper that can be used for mapping Objects to and from JSON.
     */
    private static final ObjectMapper DEFAULT_JSON_MAPPER = registerDefaultModules(new ObjectMapper());

    /**
     * Returns a new {@link ObjectMapper} with default modules against the provided factory.
     *
     * @param mapper the instance to register default modules with
     */
    public static ObjectMapper registerDefaultModules(ObjectMapper mapper) {
        // enable support for ...
        return mapper
                .registerModules(
                        new GuavaModule(),     // Guava types
                        new JavaTimeModule(),  // java.time.* types
                        new Jdk8Module())      // Optional<>s
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Returns a YAML representation of the provided value.
     *
     * @param value The value that will be converted to YAML
     * @param <T> The type of the {@code value}
     * @return A YAML representation of the {@code value}
     * @throws IOException if conversion fails
     */
    public static <T> String toYamlString(T value) throws IOException {
        return toString(value, DEFAULT_YAML_MAPPER);
    }

    /**
     * Returns the object represented by the provided YAML string created via
     * {@link #toYamlString(Object)}.
     */
    public static <T> T fromYamlString(String str, Class<T> clazz) throws IOException {
        return fromString(str, clazz, DEFAULT_YAML_MAPPER);
    }

    /**
     * Returns the object represented by the YAML content of the provided stream. The stream is not closed.
     */
    public static <T> T fromYamlStream(InputStream stream, Class<T> clazz) throws IOException {
        return DEFAULT_YAML_MAPPER.readValue(stream, clazz);
    }

    /**
     * Returns the object represented by the YAML content of the provided file.
     */
    public static <T> T fromYamlFile(File file, Class<T> clazz) throws IOException {
        return DEFAULT_YAML_MAPPER.readValue(file, clazz);
    }

    /**
     * Returns a JSON representation of the provided value.
     *
     * @param value The value that will be converted to JSON
     * @param <T> The type of the {@code value}
     * @return A JSON representation of the {@code value}
     * @throws IOException if conversion fails
     */
    public static <T> String toJsonString(T value) throws IOException {
        return toString(value, DEFAULT_JSON_MAPPER);
    }

    /**
     * Returns a JSON representation of the provided value, or an empty string if conversion fails.
     * This is a convenience function for cases like {@link Object#toString()}.
     *
     * @param value The value that will be converted to JSON
     * @param <T> The type of the {@code value}
     * @return A JSON representation of the {@code value}, or an empty string if conversion fails
     */
    public static <T> String toJsonStringOrEmpty(T value) {
        try {
            return toJsonString(value);
        } catch (IOException e) {
            return "";
        }
    }

    /**
     * Returns the object represented by the provided JSON string created via
     * {@link #toJsonString(Object)}.
     */
    public static <T> T fromJsonString(String str, Class<T> clazz) throws IOException {
        return fromString(str, clazz, DEFAULT_JSON_MAPPER);
    }

    /**
     * Returns a representation of the provided value using the provided custom object mapper.
     */
    public static <T> String toString(T value, ObjectMapper mapper) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    /**
     * Returns a representation of the provided value using the provided custom object mapper.
     */
    public static <T> T fromString(String str, Class<T> clazz, ObjectMapper mapper) throws IOException {
        return mapper.readValue(str, clazz);
    }
}
