package com.swiftship.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads component trees from JSON.
 *
 * <p>The reader maps JSON structure only. Prop shapes are validated upstream and are not
 * checked here.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComponentNode root = ComponentTreeReader.read(Path.of("tree.json"));
 * }</pre>
 */
public final class ComponentTreeReader {

    private static final Logger log = LoggerFactory.getLogger(ComponentTreeReader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private ComponentTreeReader() {
    }

    /**
     * Reads a tree from a JSON file.
     *
     * @param file path to the JSON file
     * @return root node
     * @throws UncheckedIOException if the file cannot be read
     * @throws IllegalArgumentException if the content is not a component tree
     */
    public static ComponentNode read(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        try {
            log.debug("Reading component tree from: {}", file);
            return parse(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read component tree: " + file, e);
        }
    }

    /**
     * Parses a tree from JSON text.
     *
     * @param json JSON content
     * @return root node
     * @throws IllegalArgumentException if the content is not a component tree
     */
    public static ComponentNode parse(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            ComponentNode root = JSON_MAPPER.readValue(json, ComponentNode.class);
            if (root == null) {
                throw new IllegalArgumentException("Component tree JSON is empty");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid component tree JSON: " + e.getOriginalMessage(), e);
        }
    }
}
