package ai.latex.translator.translate;

import java.util.Objects;

/**
 * Provides translator instances based on the desired execution mode.
 */
public class TranslatorFactory {

    private final Translator productionTranslator;
    private final Translator dryRunTranslator;
    private final Translator mockTranslator;

    public TranslatorFactory(Translator productionTranslator,
                             Translator dryRunTranslator,
                             Translator mockTranslator) {
        this.productionTranslator = Objects.requireNonNull(productionTranslator, "productionTranslator");
        this.dryRunTranslator = Objects.requireNonNull(dryRunTranslator, "dryRunTranslator");
        this.mockTranslator = Objects.requireNonNull(mockTranslator, "mockTranslator");
    }

    /**
     * Factory without a language model, for runs that never use {@link TranslationMode#PRODUCTION}.
     */
    public static TranslatorFactory offline() {
        Translator passThrough = new PassThroughTranslator();
        return new TranslatorFactory(passThrough, passThrough, new MockTranslator());
    }

    public Translator select(TranslationMode mode) {
        return switch (Objects.requireNonNull(mode, "mode")) {
            case PRODUCTION -> productionTranslator;
            case DRY_RUN -> dryRunTranslator;
            case MOCK -> mockTranslator;
        };
    }
}
