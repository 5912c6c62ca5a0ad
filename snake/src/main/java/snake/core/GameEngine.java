package snake.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public final class GameEngine {
    private static final Logger LOG = LoggerFactory.getLogger(GameEngine.class);

    public record TickResult(Cell head, boolean collided, boolean ate) {}

    public final Board board;
    public final Snake snake;
    public final Food food;

    private long ticks;
    private long eaten;
    private long resets;

    public GameEngine(Board board, Snake snake, Food food) {
        this.board = board;
        this.snake = snake;
        this.food = food;
    }

    public void steer(Dir d) { snake.bufferDirection(d); }

    public TickResult tick() {
        ticks++;
        snake.commitDirection();
        Snake.Move move = snake.advance();

        if (move.collided()) {
            resets++;
            LOG.debug("Self-collision on tick {}, snake reset to {} heading {}", ticks, move.head(), snake.direction());
            return new TickResult(move.head(), true, false);
        }

        boolean ate = move.head().equals(food.position());
        if (ate) {
            snake.grow();
            food.relocatePosition();
            eaten++;
            LOG.debug("Food eaten at {}, growth target {}, food moved to {}", move.head(), snake.growthTarget(), food.position());
        }
        LOG.trace("Tick {} head {}", ticks, move.head());
        return new TickResult(move.head(), false, ate);
    }

    /** Draw order: snake first, food on top. */
    public List<Drawable> drawables() { return List.of(snake, food); }

    public long ticks() { return ticks; }

    public long eaten() { return eaten; }

    public long resets() { return resets; }
}
