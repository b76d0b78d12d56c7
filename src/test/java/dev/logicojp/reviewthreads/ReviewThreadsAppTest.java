package dev.logicojp.reviewthreads;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReviewThreadsApp")
class ReviewThreadsAppTest {

    private final LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Level originalRoot = ctx.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    private final Level originalApp = ctx.getLogger("dev.logicojp").getLevel();

    @AfterEach
    void restoreLogLevels() {
        ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRoot);
        ctx.getLogger("dev.logicojp").setLevel(originalApp);
    }

    @Test
    @DisplayName("-vでアプリケーションロガーとルートロガーがDEBUGになる")
    void verboseSwitchesLoggersToDebug() {
        int exitCode = new CommandLine(new ReviewThreadsApp()).execute("-v");

        assertThat(exitCode).isZero();
        assertThat(ctx.getLogger("dev.logicojp").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(ctx.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @DisplayName("--verboseも同じ効果を持つ")
    void longVerboseOptionSwitchesLoggersToDebug() {
        new CommandLine(new ReviewThreadsApp()).execute("--verbose");

        assertThat(ctx.getLogger("dev.logicojp").getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @DisplayName("-vなしではログレベルを変更しない")
    void withoutVerboseLevelsStayAsConfigured() {
        int exitCode = new CommandLine(new ReviewThreadsApp()).execute();

        assertThat(exitCode).isZero();
        assertThat(ctx.getLogger("dev.logicojp").getLevel()).isEqualTo(originalApp);
        assertThat(ctx.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(originalRoot);
    }
}
