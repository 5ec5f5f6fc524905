package com.raditha.fuzzy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads scoring configuration from YAML.
 *
 * Lookup order: file named by the {@value #CONFIG_PROPERTY} system property,
 * then {@value #CLASSPATH_RESOURCE} on the classpath, then built-in defaults.
 * Missing or wrongly typed keys fall back to their defaults.
 */
public class FuzzySettings {

    private static final Logger logger = LoggerFactory.getLogger(FuzzySettings.class);

    public static final String CONFIG_PROPERTY = "fuzzy.scoring.config";
    public static final String CLASSPATH_RESOURCE = "fuzzy-scoring.yml";

    private static final String CONFIG_KEY = "fuzzy_scoring";

    private static final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    private FuzzySettings() {
    }

    /**
     * Resolve configuration from the system property, the classpath or defaults.
     *
     * @return complete scoring configuration
     */
    public static ScoringConfig load() {
        String explicit = System.getProperty(CONFIG_PROPERTY);
        if (explicit != null && !explicit.isBlank()) {
            return load(Path.of(explicit.strip()));
        }

        try (InputStream in = FuzzySettings.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", CLASSPATH_RESOURCE);
                return ScoringConfig.defaults();
            }
            logger.debug("Loading scoring configuration from classpath:{}", CLASSPATH_RESOURCE);
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read classpath:" + CLASSPATH_RESOURCE, e);
        }
    }

    /**
     * Load configuration from an explicit YAML file.
     */
    public static ScoringConfig load(Path file) {
        logger.debug("Loading scoring configuration from {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read scoring configuration " + file, e);
        }
    }

    /**
     * Load configuration from a YAML stream.
     */
    public static ScoringConfig load(InputStream in) throws IOException {
        Object root = mapper.readValue(in, Object.class);
        if (!(root instanceof Map)) {
            return ScoringConfig.defaults();
        }
        return fromMap(getMap((Map<?, ?>) root, CONFIG_KEY));
    }

    /**
     * Build configuration from the map under the {@code fuzzy_scoring} key.
     * A null map yields the defaults.
     */
    public static ScoringConfig fromMap(Map<?, ?> config) {
        if (config == null) {
            return ScoringConfig.defaults();
        }

        String backend = getString(config, "backend", ScoringConfig.REFERENCE_BACKEND);
        return new ScoringConfig(
                backend,
                buildAligner(getMap(config, "aligner")),
                buildScales(getMap(config, "weighted_ratio")));
    }

    private static AlignerConfig buildAligner(Map<?, ?> aligner) {
        if (aligner == null) {
            return AlignerConfig.defaults();
        }
        return new AlignerConfig(
                getBoolean(aligner, "auto_junk", true),
                getInt(aligner, "auto_junk_min_length", AlignerConfig.DEFAULT_AUTO_JUNK_MIN_LENGTH),
                getInt(aligner, "popularity_divisor", AlignerConfig.DEFAULT_POPULARITY_DIVISOR));
    }

    private static WeightedRatioScales buildScales(Map<?, ?> scales) {
        WeightedRatioScales defaults = WeightedRatioScales.defaults();
        if (scales == null) {
            return defaults;
        }
        return new WeightedRatioScales(
                getDouble(scales, "token_scale", defaults.tokenScale()),
                getDouble(scales, "partial_scale", defaults.partialScale()),
                getDouble(scales, "long_partial_scale", defaults.longPartialScale()),
                getDouble(scales, "partial_length_ratio", defaults.partialLengthRatio()),
                getDouble(scales, "long_length_ratio", defaults.longLengthRatio()));
    }

    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map) {
            return (Map<?, ?>) value;
        }
        return null;
    }

    private static int getInt(Map<?, ?> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<?, ?> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<?, ?> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<?, ?> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value instanceof String) {
            return (String) value;
        }
        return defaultValue;
    }
}
