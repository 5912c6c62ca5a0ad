package snake.app;

import snake.core.Drawable;

import java.util.List;

public interface RenderSink {
    void render(List<? extends Drawable> drawables);
}
