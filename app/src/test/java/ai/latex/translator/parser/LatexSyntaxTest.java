package ai.latex.translator.parser;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LatexSyntaxTest {

    @Test
    void detectsEscapedCharacters() {
        assertThat(LatexSyntax.isEscaped("\\%", 1)).isTrue();
        assertThat(LatexSyntax.isEscaped("\\\\%", 2)).isFalse();
        assertThat(LatexSyntax.isEscaped("%", 0)).isFalse();
    }

    @Test
    void skipsBalancedGroups() {
        String source = "{a{b}\\}c}rest";

        assertThat(LatexSyntax.skipGroup(source, 0, '{', '}')).isEqualTo(source.indexOf("rest"));
        assertThat(LatexSyntax.groupBody(source, 0)).isEqualTo("a{b}\\}c");
        assertThat(LatexSyntax.skipGroup("{open", 0, '{', '}')).isEqualTo(-1);
        assertThat(LatexSyntax.groupBody("x", 0)).isNull();
    }

    @Test
    void masksCommentsKeepingOffsets() {
        String source = "a % one\n50\\% b % two";

        String masked = LatexSyntax.maskComments(source);

        assertThat(masked).hasSameSizeAs(source);
        assertThat(masked).isEqualTo("a      \n50\\% b      ");
        assertThat(LatexSyntax.stripComments(source)).isEqualTo("a \n50\\% b ");
    }

    @Test
    void countsOnlyUnescapedOccurrences() {
        assertThat(LatexSyntax.countUnescaped("$a$ \\$ $", '$')).isEqualTo(3);
        assertThat(LatexSyntax.commentStart("100\\% sure % really")).isEqualTo(11);
    }
}
