package snake.app;

public interface Pacer {
    /**
     * Blocks until the next tick boundary.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    void awaitNextTick() throws InterruptedException;
}
