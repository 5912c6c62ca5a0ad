package snake.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import snake.core.GameEngine;
import snake.ui.LanternaInput;

public final class GameLoop {
    private static final Logger LOG = LoggerFactory.getLogger(GameLoop.class);

    private final GameEngine engine;
    private final InputSource input;
    private final RenderSink sink;
    private final Pacer pacer;

    private long runEaten;
    private long bestRun;

    public GameLoop(GameEngine engine, InputSource input, RenderSink sink, Pacer pacer) {
        this.engine = engine;
        this.input = input;
        this.sink = sink;
        this.pacer = pacer;
    }

    /** @return number of ticks played */
    public long run() {
        LOG.info("Game started on a {} board", engine.board);
        sink.render(engine.drawables());

        while (drainInput()) {
            GameEngine.TickResult result = engine.tick();
            if (result.ate()) bestRun = Math.max(bestRun, ++runEaten);
            if (result.collided()) {
                LOG.debug("Run ended after {} food at tick {}", runEaten, engine.ticks());
                runEaten = 0;
            }
            sink.render(engine.drawables());
            try {
                pacer.awaitNextTick();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.info("Game loop interrupted");
                break;
            }
        }

        LOG.info("Game stopped after {} ticks: {} food eaten, {} resets, best run {}",
                engine.ticks(), engine.eaten(), engine.resets(), bestRun);
        return engine.ticks();
    }

    /** Most food eaten between two resets. */
    public long bestRun() { return bestRun; }

    /** @return false once quit was requested */
    private boolean drainInput() {
        for (LanternaInput.Input in : input.drain()) {
            if (in.action() == LanternaInput.Action.QUIT) return false;
            if (in.dir() != null) engine.steer(in.dir());
        }
        return true;
    }
}
