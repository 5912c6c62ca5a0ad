package snake.app;

import java.io.Closeable;

public interface GameTerminal extends InputSource, RenderSink, Closeable {
}
