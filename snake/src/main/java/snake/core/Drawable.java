package snake.core;

import java.util.List;

public interface Drawable {
    List<Cell> cells();

    Rgb color();
}
