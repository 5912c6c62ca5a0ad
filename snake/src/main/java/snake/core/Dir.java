package snake.core;

import java.util.Random;

public enum Dir {
    UP(0, -1), DOWN(0, 1), LEFT(-1, 0), RIGHT(1, 0);

    private static final Dir[] ALL = values();

    public final int dx, dy;
    Dir(int dx, int dy) { this.dx = dx; this.dy = dy; }

    public boolean opposite(Dir o) { return dx + o.dx == 0 && dy + o.dy == 0; }

    public static Dir random(Random rnd) { return ALL[rnd.nextInt(ALL.length)]; }
}
