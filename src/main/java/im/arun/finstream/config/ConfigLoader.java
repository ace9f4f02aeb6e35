package im.arun.finstream.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.finstream.layout.AnchorPolicy;
import im.arun.finstream.layout.ColumnMatchPolicy;
import im.arun.finstream.text.NumericMatchPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Loads {@link StreamerConfig} from YAML and merges caller overrides on top.
 *
 * <p>Lookup order: explicit file path, then {@code finstream.yaml} on the classpath, then
 * built-in defaults. Unreadable files fall back to defaults with a warning.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CLASSPATH_CONFIG = "finstream.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final StreamerConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private StreamerConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), StreamerConfig.class);
                }
                logger.warn("Config file {} not found, trying classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(CLASSPATH_CONFIG)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, StreamerConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", CLASSPATH_CONFIG);
            return new StreamerConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new StreamerConfig();
        }
    }

    public StreamerConfig load() {
        return load(null);
    }

    public StreamerConfig load(Map<String, Object> userOptions) {
        StreamerConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "x_tolerance":
                    case "horizontalTolerance":
                        setTolerance(key, value, config::setHorizontalTolerance);
                        break;
                    case "y_tolerance":
                    case "verticalTolerance":
                        setTolerance(key, value, config::setVerticalTolerance);
                        break;
                    case "word_gap_tolerance":
                    case "wordGapTolerance":
                        setTolerance(key, value, config::setWordGapTolerance);
                        break;
                    case "mask":
                    case "mask_values":
                    case "maskValues":
                        config.setMaskValues(parseBoolean(value));
                        break;
                    case "mask_char":
                    case "maskChar":
                        if (value instanceof String && ((String) value).length() == 1) {
                            config.setMaskChar(((String) value).charAt(0));
                        } else if (value instanceof Character) {
                            config.setMaskChar((Character) value);
                        }
                        break;
                    case "numeric_match_policy":
                    case "numericMatchPolicy":
                        config.setNumericMatchPolicy(parseEnum(NumericMatchPolicy.class, value));
                        break;
                    case "column_match_policy":
                    case "columnMatchPolicy":
                        config.setColumnMatchPolicy(parseEnum(ColumnMatchPolicy.class, value));
                        break;
                    case "anchor_policy":
                    case "anchorPolicy":
                        config.setAnchorPolicy(parseEnum(AnchorPolicy.class, value));
                        break;
                    case "model":
                        if (value instanceof String) config.setModel((String) value);
                        break;
                    case "count_llm_tokens":
                    case "countLlmTokens":
                        config.setCountLlmTokens(parseBoolean(value));
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (IllegalArgumentException e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private interface FloatSetter {
        void set(float value);
    }

    private void setTolerance(String key, Object value, FloatSetter setter) {
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("expected a number but got " + value);
        }
        float tolerance = ((Number) value).floatValue();
        if (tolerance < 0 || Float.isNaN(tolerance)) {
            logger.warn("Ignoring negative tolerance {}={}", key, value);
            return;
        }
        setter.set(tolerance);
    }

    private <E extends Enum<E>> E parseEnum(Class<E> type, Object value) {
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        String name = String.valueOf(value).trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Enum.valueOf(type, name);
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private StreamerConfig copyConfig(StreamerConfig source) {
        StreamerConfig copy = new StreamerConfig();
        copy.setHorizontalTolerance(source.getHorizontalTolerance());
        copy.setVerticalTolerance(source.getVerticalTolerance());
        copy.setMaskValues(source.isMaskValues());
        copy.setMaskChar(source.getMaskChar());
        copy.setNumericMatchPolicy(source.getNumericMatchPolicy());
        copy.setColumnMatchPolicy(source.getColumnMatchPolicy());
        copy.setAnchorPolicy(source.getAnchorPolicy());
        copy.setWordGapTolerance(source.getWordGapTolerance());
        copy.setModel(source.getModel());
        copy.setCountLlmTokens(source.isCountLlmTokens());
        return copy;
    }
}
