package ai.latex.translator.config;

import java.util.Optional;

/**
 * Reads the translator settings ({@code LLM_PROVIDER}, {@code LATEX_ENGINE}, {@code COMPILE_TIMEOUT_SECONDS}
 * and the rest of {@link ConfigLoader}'s keys) from the process environment.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
