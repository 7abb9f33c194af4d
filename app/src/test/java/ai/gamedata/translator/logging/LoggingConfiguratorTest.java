package ai.gamedata.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.gamedata.translator.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreTextFormat() {
        LoggingConfigurator.configure(LogFormat.TEXT);
    }

    @Test
    void switchesConsoleBetweenJsonAndText() {
        assertThat(LoggingConfigurator.configure(LogFormat.JSON)).isTrue();

        OutputStreamAppender<?> console = consoleAppender();
        assertThat(console.getEncoder()).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<?>) console.getEncoder()).getLayout()).isInstanceOf(SimpleJsonLayout.class);
        assertThat(console.isStarted()).isTrue();

        LoggingConfigurator.configure(LogFormat.TEXT);

        assertThat(consoleAppender().getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) consoleAppender().getEncoder()).getPattern())
                .isEqualTo(LoggingConfigurator.TEXT_PATTERN);
    }

    @Test
    void quietsTheModelClient() {
        LoggingConfigurator.configure(LogFormat.TEXT);

        assertThat(context.getLogger("dev.langchain4j").getEffectiveLevel()).isEqualTo(Level.WARN);
    }

    private OutputStreamAppender<?> consoleAppender() {
        return (OutputStreamAppender<?>) context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("CONSOLE");
    }
}
