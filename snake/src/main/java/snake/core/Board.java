package snake.core;

public final class Board {
    public final int w, h;

    public Board(int w, int h) {
        if (w <= 0 || h <= 0) throw new IllegalArgumentException("Board must be at least 1x1, got " + w + "x" + h);
        this.w = w;
        this.h = h;
    }

    public static int wrap(int coord, int axisLength) {
        int v = coord % axisLength;
        return v < 0 ? v + axisLength : v;
    }

    public Cell wrap(Cell p) { return new Cell(wrap(p.x(), w), wrap(p.y(), h)); }

    public Cell step(Cell from, Dir d) { return wrap(new Cell(from.x() + d.dx, from.y() + d.dy)); }

    public Cell center() { return new Cell(w / 2, h / 2); }

    public boolean contains(Cell p) { return p.x() >= 0 && p.x() < w && p.y() >= 0 && p.y() < h; }

    /** True if {@code b} is exactly one step from {@code a}, edges included. */
    public boolean adjacent(Cell a, Cell b) {
        for (Dir d : Dir.values()) {
            if (step(a, d).equals(b)) return true;
        }
        return false;
    }

    @Override public String toString() { return w + "x" + h; }
}
