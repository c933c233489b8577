package ai.latex.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TargetLanguageTest {

    @Test
    void resolvesByNameOrCode() {
        assertThat(TargetLanguage.from("ja")).isEqualTo(TargetLanguage.JAPANESE);
        assertThat(TargetLanguage.from("English")).isEqualTo(TargetLanguage.ENGLISH);
        assertThat(TargetLanguage.from(" ZH ")).isEqualTo(TargetLanguage.CHINESE);
        assertThat(TargetLanguage.from(null)).isEqualTo(TargetLanguage.JAPANESE);
    }

    @Test
    void rejectsUnknownLanguage() {
        assertThatThrownBy(() -> TargetLanguage.from("klingon"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("klingon");
    }

    @Test
    void translationModeAcceptsDashedNames() {
        assertThat(TranslationMode.from("dry-run")).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(TranslationMode.from("mock")).isEqualTo(TranslationMode.MOCK);
        assertThat(TranslationMode.from("")).isEqualTo(TranslationMode.PRODUCTION);
    }
}
