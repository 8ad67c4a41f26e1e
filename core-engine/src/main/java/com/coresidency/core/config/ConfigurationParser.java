package com.coresidency.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads a {@link DetectorConfiguration} from its file representation.
 *
 * <h3>Schema</h3>
 *
 * <pre>
 * {
 *   "Version": "1.0",
 *   "EnableMitigation": true,
 *   "MitigationConfiguration": {
 *     "FlagsBeforeActivation":     { "Value": 3, "Description": "..." },
 *     "DeflagsBeforeDeactivation": { "Value": 3 }
 *   },
 *   "Thresholds": {
 *     "NrConnections": { "Value": 1.0, "Description": "..." }
 *   },
 *   "Performance": {
 *     "SamplesBeforeInclusion": { "Value": -1 },
 *     "SamplesBeforeExclusion": { "Value": -1 },
 *     "NormalizeSamples":       { "Value": true },
 *     "MaxSamples":             { "Value": 10 }
 *   },
 *   "EventNames": {
 *     "SampleEvent": { "Value": "MetricsSampled" }
 *   }
 * }
 * </pre>
 *
 * <p>
 * Every leaf lives under a {@code Value} key; {@code Description} siblings are
 * ignored. {@code MitigationConfiguration} is required only when mitigation is
 * enabled, and every {@code EventNames} entry is optional.
 * </p>
 *
 * <h3>Formats</h3>
 * <p>
 * JSON is parsed with Jackson. Sources whose name ends in {@code .yml} or
 * {@code .yaml} are parsed with SnakeYAML and then validated against the same
 * tree schema.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * All problems are collected and reported together in a single
 * {@link MalformedConfigurationException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigurationParser {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationParser.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String VALUE = "Value";

    /** Supported source formats. */
    public enum Format {
        JSON,
        YAML;

        /**
         * @param name file or resource name
         * @return {@link #YAML} for {@code .yml}/{@code .yaml} names, {@link #JSON}
         *         otherwise
         */
        public static Format forName(String name) {
            String lower = name.toLowerCase(Locale.ROOT);
            return lower.endsWith(".yml") || lower.endsWith(".yaml") ? YAML : JSON;
        }
    }

    private ConfigurationParser() {
        // utility class: not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load a configuration from a file system path.
     *
     * @param path configuration file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws MalformedConfigurationException if the file is missing,
     *                                         unreadable or invalid
     */
    public static DetectorConfiguration fromFile(Path path) {
        Objects.requireNonNull(path, "Configuration path must not be null");
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, Format.forName(path.getFileName().toString()));
        } catch (NoSuchFileException e) {
            throw new MalformedConfigurationException("Configuration file not found: " + path, e);
        } catch (IOException e) {
            throw new MalformedConfigurationException("Failed to read configuration file: " + path, e);
        }
    }

    /**
     * Load a configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException        if the resource does not exist
     * @throws MalformedConfigurationException if the resource is invalid
     */
    public static DetectorConfiguration fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigurationParser.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is, Format.forName(resource));
        } catch (IOException e) {
            throw new MalformedConfigurationException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse a configuration from a stream. The stream is not closed.
     *
     * @param is     source stream; must not be {@code null}
     * @param format source format
     * @return parsed and validated configuration
     * @throws MalformedConfigurationException if the content is invalid
     */
    public static DetectorConfiguration parse(InputStream is, Format format) {
        Objects.requireNonNull(is, "Configuration stream must not be null");
        Objects.requireNonNull(format, "Configuration format must not be null");
        JsonNode root = format == Format.YAML ? readYaml(is) : readJson(is);
        DetectorConfiguration configuration = fromTree(root);
        LOG.info("Loaded configuration version={} mitigation={} thresholds={}",
                configuration.getVersion(), configuration.isMitigationEnabled(),
                configuration.getThresholds().keySet());
        return configuration;
    }

    /**
     * Build a configuration from an already parsed tree.
     *
     * @param root document root
     * @return validated configuration
     * @throws MalformedConfigurationException if the tree violates the schema
     */
    public static DetectorConfiguration fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedConfigurationException("Configuration root must be an object");
        }

        List<String> errors = new ArrayList<>();
        DetectorConfiguration.Builder builder = DetectorConfiguration.builder();

        JsonNode version = root.get("Version");
        if (version != null && !version.isNull()) {
            if (version.isValueNode()) {
                builder.version(version.asText());
            } else {
                errors.add("'Version' must be a scalar");
            }
        }

        Boolean enabled = requireBoolean(root.get("EnableMitigation"), "EnableMitigation", errors);
        if (enabled != null) {
            builder.mitigationEnabled(enabled);
        }

        if (Boolean.TRUE.equals(enabled)) {
            JsonNode mitigation = requireObject(root, "MitigationConfiguration", errors);
            if (mitigation != null) {
                Integer flags = requireInt(mitigation, "MitigationConfiguration", "FlagsBeforeActivation", errors);
                Integer deflags = requireInt(mitigation, "MitigationConfiguration", "DeflagsBeforeDeactivation", errors);
                if (flags != null) {
                    builder.flagsBeforeActivation(flags);
                }
                if (deflags != null) {
                    builder.deflagsBeforeDeactivation(deflags);
                }
            }
        }

        JsonNode thresholds = requireObject(root, "Thresholds", errors);
        if (thresholds != null) {
            Iterator<Map.Entry<String, JsonNode>> it = thresholds.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                JsonNode value = leaf(entry.getValue());
                if (value == null || !value.isNumber()) {
                    errors.add("'Thresholds." + entry.getKey() + "." + VALUE + "' must be a number");
                } else {
                    builder.threshold(entry.getKey(), value.doubleValue());
                }
            }
        }

        JsonNode performance = requireObject(root, "Performance", errors);
        if (performance != null) {
            Integer inclusion = requireInt(performance, "Performance", "SamplesBeforeInclusion", errors);
            Integer exclusion = requireInt(performance, "Performance", "SamplesBeforeExclusion", errors);
            Integer maxSamples = requireInt(performance, "Performance", "MaxSamples", errors);
            Boolean normalize = requireBoolean(leaf(performance.get("NormalizeSamples")),
                    "Performance.NormalizeSamples." + VALUE, errors);
            if (inclusion != null) {
                builder.samplesBeforeInclusion(inclusion);
            }
            if (exclusion != null) {
                builder.samplesBeforeExclusion(exclusion);
            }
            if (maxSamples != null) {
                builder.maxSamples(maxSamples);
            }
            if (normalize != null) {
                builder.normalizeSamples(normalize);
            }
        }

        JsonNode eventNames = root.get("EventNames");
        if (eventNames != null && !eventNames.isNull()) {
            if (!eventNames.isObject()) {
                errors.add("'EventNames' must be an object");
            } else {
                readEventNames(eventNames, builder, errors);
            }
        }

        if (!errors.isEmpty()) {
            throw new MalformedConfigurationException(errors);
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static JsonNode readJson(InputStream is) {
        try {
            return MAPPER.readTree(is);
        } catch (JsonProcessingException e) {
            throw new MalformedConfigurationException(
                    "Configuration is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedConfigurationException("Failed to read configuration: " + e.getMessage(), e);
        }
    }

    private static JsonNode readYaml(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        try {
            Object document = new Yaml(options).load(is);
            return MAPPER.valueToTree(document);
        } catch (YAMLException e) {
            throw new MalformedConfigurationException("Configuration is not valid YAML: " + e.getMessage(), e);
        }
    }

    private static void readEventNames(JsonNode eventNames, DetectorConfiguration.Builder builder,
            List<String> errors) {
        Iterator<Map.Entry<String, JsonNode>> it = eventNames.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            Optional<EventType> type = EventType.fromLogicalName(entry.getKey());
            if (type.isEmpty()) {
                LOG.warn("Ignoring unknown event name '{}'", entry.getKey());
                continue;
            }
            JsonNode value = leaf(entry.getValue());
            if (value == null || !value.isTextual() || value.asText().isBlank()) {
                errors.add("'EventNames." + entry.getKey() + "." + VALUE + "' must be a non-blank string");
            } else {
                builder.eventName(type.get(), value.asText());
            }
        }
    }

    /** The {@code Value} child of a documented leaf, or {@code null}. */
    private static JsonNode leaf(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return node.get(VALUE);
    }

    private static JsonNode requireObject(JsonNode parent, String key, List<String> errors) {
        JsonNode node = parent.get(key);
        if (node == null || node.isNull()) {
            errors.add("Missing required section '" + key + "'");
            return null;
        }
        if (!node.isObject()) {
            errors.add("'" + key + "' must be an object");
            return null;
        }
        return node;
    }

    private static Integer requireInt(JsonNode section, String sectionName, String key, List<String> errors) {
        String path = sectionName + "." + key + "." + VALUE;
        JsonNode value = leaf(section.get(key));
        if (value == null) {
            errors.add("Missing required key '" + path + "'");
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            errors.add("'" + path + "' must be an integer, got: " + value);
            return null;
        }
        return value.intValue();
    }

    private static Boolean requireBoolean(JsonNode value, String path, List<String> errors) {
        if (value == null) {
            errors.add("Missing required key '" + path + "'");
            return null;
        }
        if (!value.isBoolean()) {
            errors.add("'" + path + "' must be a boolean, got: " + value);
            return null;
        }
        return value.booleanValue();
    }
}
