package snake.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import snake.core.Rgb;

import java.util.OptionalLong;

/**
 * Typed view of the {@code snake} configuration block.
 *
 * <pre>
 * snake {
 *   title = "The Snake"
 *   board { width = 32, height = 24 }   # cells
 *   ticks-per-second = 20
 *   cell-width = 2                       # terminal columns per cell
 *   colors { background = "#000000", snake = "#00FF00", food = "#FF0000" }
 *   # seed = 42
 * }
 * </pre>
 */
public record GameSettings(String title,
                           int width,
                           int height,
                           int ticksPerSecond,
                           int cellWidth,
                           Rgb background,
                           Rgb snakeColor,
                           Rgb foodColor,
                           OptionalLong seed) {

    private static final String ROOT = "snake";
    static final int MAX_TICKS_PER_SECOND = 1000;

    public static GameSettings from(final Config config) {
        final Config c = config.getConfig(ROOT);
        return new GameSettings(
            c.getString("title"),
            positive(c, "board.width"),
            positive(c, "board.height"),
            ticksPerSecond(c),
            positive(c, "cell-width"),
            color(c, "colors.background"),
            color(c, "colors.snake"),
            color(c, "colors.food"),
            c.hasPath("seed") ? OptionalLong.of(c.getLong("seed")) : OptionalLong.empty());
    }

    public long tickNanos() { return 1_000_000_000L / ticksPerSecond; }

    private static int positive(final Config c, final String path) {
        final int v = c.getInt(path);
        if (v <= 0) throw new ConfigException.BadValue(c.origin(), ROOT + "." + path, "must be positive, got " + v);
        return v;
    }

    private static int ticksPerSecond(final Config c) {
        final int v = c.getInt("ticks-per-second");
        if (v <= 0 || v > MAX_TICKS_PER_SECOND)
            throw new ConfigException.BadValue(c.origin(), ROOT + ".ticks-per-second",
                "must be between 1 and " + MAX_TICKS_PER_SECOND + ", got " + v);
        return v;
    }

    private static Rgb color(final Config c, final String path) {
        final String raw = c.getString(path);
        try {
            return Rgb.parse(raw);
        } catch (final IllegalArgumentException e) {
            throw new ConfigException.BadValue(c.origin(), ROOT + "." + path, "expected #RRGGBB, got '" + raw + "'", e);
        }
    }
}
