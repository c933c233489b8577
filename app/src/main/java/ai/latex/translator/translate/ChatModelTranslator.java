package ai.latex.translator.translate;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translator backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelTranslator implements Translator {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:latex|tex)?\\s*(.*?)```", Pattern.DOTALL);
    private static final Pattern WRAPPER_TAG = Pattern.compile("</?(?:latex|tex)>");
    private static final Pattern EXTRA_BLANK_LINES = Pattern.compile("\\n{3,}");

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelTranslator(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public String translate(String text, TargetLanguage targetLanguage, String context) {
        if (text == null || text.isBlank()) {
            return text == null ? "" : text;
        }
        try {
            String response = model.chat(buildPrompt(text, targetLanguage, context));
            if (response == null) {
                return "";
            }
            return cleanOutput(response);
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new TranslationException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new TranslationException("LangChain translation failed", ex);
        }
    }

    String buildPrompt(String text, TargetLanguage targetLanguage, String context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("""
You are an expert translator of academic LaTeX documents. Translate only the natural-language text of the LaTeX fragment below into %s.
Rules:
- Do not change LaTeX commands, environments or math. Command names, braces and brackets must stay exactly where they are.
- Keep the keys inside \\cite{}, \\ref{} and \\label{} unchanged.
- Never change the special characters $, \\(, \\), {, }, \\, &, %% and #.
- Do not translate custom commands.
- Keep line breaks, spacing and indentation.
- Do not use full-width forms of ASCII symbols.
- Output only the translated fragment. Do not wrap it in code fences or <latex> tags and do not add commentary.
""".formatted(targetLanguage.displayName()));
        if (context != null && !context.isBlank()) {
            prompt.append("\nContext:\n").append(context.strip()).append('\n');
        }
        prompt.append("\n<latex>\n").append(text).append("\n</latex>");
        return prompt.toString();
    }

    /**
     * Removes wrappers chat models like to add around their answer.
     */
    static String cleanOutput(String response) {
        String cleaned = CODE_FENCE.matcher(response).replaceAll(match -> Matcher.quoteReplacement(match.group(1)));
        cleaned = WRAPPER_TAG.matcher(cleaned).replaceAll("");
        cleaned = EXTRA_BLANK_LINES.matcher(cleaned).replaceAll("\n\n");
        return cleaned.strip();
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
