package ai.latex.translator.config;

import java.util.Optional;

/**
 * Source of the environment settings {@link ConfigLoader} falls back to when an option is absent from
 * the command line.
 */
@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);

    /**
     * The trimmed value of {@code key}; blank values count as unset so an exported but empty
     * {@code LATEX_ENGINE=} keeps the default engine.
     */
    default Optional<String> value(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
