package snake.core;

public record Cell(int x, int y) {
    @Override public String toString() { return "(" + x + ", " + y + ")"; }
}
