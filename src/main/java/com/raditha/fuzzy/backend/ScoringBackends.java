package com.raditha.fuzzy.backend;

import com.raditha.fuzzy.config.FuzzySettings;
import com.raditha.fuzzy.config.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;

/**
 * Binds the process-wide {@link ScoringBackend}.
 * <p>
 * The binding is resolved from {@link FuzzySettings#load()} the first time
 * {@link #active()} is called and never changes afterwards. A configured backend
 * class that is not on the classpath falls back to the reference backend; one
 * that is present but unusable is a configuration error.
 */
public final class ScoringBackends {

    private static final Logger logger = LoggerFactory.getLogger(ScoringBackends.class);

    private ScoringBackends() {
    }

    /**
     * The backend bound for this process.
     */
    public static ScoringBackend active() {
        return Holder.ACTIVE;
    }

    /**
     * Build the backend described by {@code config} without touching the
     * process-wide binding.
     *
     * @throws IllegalStateException if the configured class exists but cannot be used
     */
    public static ScoringBackend create(ScoringConfig config) {
        if (config.usesReferenceBackend()) {
            return new ReferenceScoringBackend(config);
        }

        String className = config.backend();
        Class<?> type;
        try {
            type = Class.forName(className);
        } catch (ClassNotFoundException e) {
            logger.warn("Scoring backend {} not found, falling back to the reference backend", className);
            return new ReferenceScoringBackend(config);
        }

        if (!ScoringBackend.class.isAssignableFrom(type)) {
            throw new IllegalStateException(className + " does not implement " + ScoringBackend.class.getName());
        }
        try {
            return (ScoringBackend) type.getDeclaredConstructor().newInstance();
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("Cannot instantiate scoring backend " + className, e);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Scoring backend " + className + " failed to initialise", e.getCause());
        }
    }

    private static final class Holder {
        private static final ScoringBackend ACTIVE = bind();

        private static ScoringBackend bind() {
            ScoringBackend backend = create(FuzzySettings.load());
            logger.info("Using {} scoring backend", backend.name());
            return backend;
        }
    }
}
