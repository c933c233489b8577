package ai.latex.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = layout(context);
        LoggingEvent event = event(context, "hello world", Level.INFO);

        String json = layout.doLayout(event);

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"hello world\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"mdc\"", "\"exception\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void includesSortedMdcAndException() {
        LoggerContext context = new LoggerContext();
        context.start();
        LoggingEvent event = event(context, "failed on \"main.tex\"", Level.ERROR);
        event.setMDCPropertyMap(Map.of("latexFile", "chapters/intro.tex", "attempt", "2"));
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("broken\nlog")));

        String json = layout(context).doLayout(event);

        assertThat(json).contains("\"message\":\"failed on \\\"main.tex\\\"\"");
        assertThat(json).contains("\"mdc\":{\"attempt\":\"2\",\"latexFile\":\"chapters/intro.tex\"}");
        assertThat(json).contains("\"exception\":{\"class\":\"java.lang.IllegalStateException\",\"message\":\"broken\\nlog\"");
        assertThat(json).contains("\"stackTrace\":\"java.lang.IllegalStateException: broken\\nlog");
    }

    @Test
    void escapesControlCharacters() {
        assertThat(SimpleJsonLayout.quote("tab\there\u0001")).isEqualTo("\"tab\\there\\u0001\"");
        assertThat(SimpleJsonLayout.quote(null)).isEqualTo("null");
    }

    private static SimpleJsonLayout layout(LoggerContext context) {
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(LoggerContext context, String message, Level level) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(level);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
