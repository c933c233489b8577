package ai.latex.translator.config;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Chat model used to translate the prose spans of a LaTeX project. A blank model name falls back to the
 * provider's default model.
 */
public record TranslatorConfig(LlmProvider provider, String modelName, Optional<String> baseUrl) {

    public TranslatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = modelName == null || modelName.isBlank() ? provider.defaultModel() : modelName.strip();
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
    }

    /**
     * Log line naming the model and, for Ollama, the endpoint it is served from.
     */
    public String describe() {
        String model = "%s model '%s'".formatted(provider.name().toLowerCase(Locale.ROOT), modelName);
        return baseUrl.map(url -> model + " via " + url).orElse(model);
    }
}
