package snake.app;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import snake.config.ConfigLoader;
import snake.config.GameSettings;
import snake.config.LoggingConfigurator;
import snake.core.Board;
import snake.core.Food;
import snake.core.GameEngine;
import snake.core.Snake;

import java.io.IOException;
import java.util.Random;

public final class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    @FunctionalInterface
    interface TerminalOpener {
        GameTerminal open() throws IOException;
    }

    private Main() {}

    public static void main(String[] args) throws Exception {
        Config config = ConfigLoader.load();
        LoggingConfigurator.configure(config);
        GameSettings settings = GameSettings.from(config);
        LOG.info("Settings: {}", settings);

        Random rnd = settings.seed().isPresent() ? new Random(settings.seed().getAsLong()) : new Random();
        Board board = new Board(settings.width(), settings.height());
        GameEngine engine = new GameEngine(board,
                new Snake(board, rnd, settings.snakeColor()),
                new Food(board, rnd, settings.foodColor()));

        play(engine, () -> TerminalSession.open(settings, board), new FixedRatePacer(settings.tickNanos()));
    }

    static long play(GameEngine engine, TerminalOpener opener, Pacer pacer) throws IOException {
        try (GameTerminal terminal = opener.open()) {
            return new GameLoop(engine, terminal, terminal, pacer).run();
        } catch (IOException | RuntimeException e) {
            LOG.error("Game aborted", e);
            throw e;
        }
    }
}
