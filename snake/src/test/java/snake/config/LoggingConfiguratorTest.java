package snake.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRoot;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRoot = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(originalRoot);
        context.getLogger("snake.core.GameEngine").setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_shouldApplyDefaultAndSpecificLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { default-level = ERROR, levels { \"snake.core.GameEngine\" = DEBUG } }"));

        assertThat(context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("snake.core.GameEngine").getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void configure_shouldOnlyApplyOnce() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = TRACE"));

        assertThat(context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void configure_shouldSkipUnknownLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"snake.core.GameEngine\" = LOUD }"));

        assertThat(context.getLogger("snake.core.GameEngine").getLevel()).isNull();
    }
}
