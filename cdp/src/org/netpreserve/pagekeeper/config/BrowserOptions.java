package org.netpreserve.pagekeeper.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.netpreserve.pagekeeper.cdp.Viewport;
import org.netpreserve.pagekeeper.util.DurationDeserializer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings for a {@link org.netpreserve.pagekeeper.cdp.Browser}.
 *
 * @param defaultViewport viewport new pages are emulated with, or null to leave the window size alone
 * @param timeout         default bound for {@code waitForTarget}; zero waits forever
 */
public record BrowserOptions(
        Viewport defaultViewport,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout
) {
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();

    public BrowserOptions {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) throw new IllegalArgumentException("timeout must not be negative: " + timeout);
    }

    public BrowserOptions withTimeout(Duration timeout) {
        return new BrowserOptions(defaultViewport, timeout);
    }

    /**
     * The bundled defaults from {@code defaults.yaml}.
     */
    public static BrowserOptions defaults() {
        try {
            return YAML.treeToValue(defaultsTree(), BrowserOptions.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Reads a YAML file, filling anything it leaves out from the bundled defaults.
     */
    public static BrowserOptions load(Path file) throws IOException {
        JsonNode override = YAML.readTree(file.toFile());
        if (override == null || override.isMissingNode() || override.isNull()) return defaults();
        return YAML.treeToValue(deepMerge(defaultsTree(), override), BrowserOptions.class);
    }

    private static JsonNode defaultsTree() throws IOException {
        try (InputStream stream = BrowserOptions.class.getResourceAsStream("defaults.yaml")) {
            if (stream == null) throw new IOException("Missing bundled defaults.yaml");
            return YAML.readTree(stream);
        }
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // scalars, arrays and explicit nulls replace the default wholesale
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }
}
