package snake.core;

import java.util.List;
import java.util.Random;

public final class Food implements Drawable {
    private final Board board;
    private final Random rnd;
    private final Rgb color;
    private Cell position;

    public Food(Board board, Random rnd, Rgb color) {
        this.board = board;
        this.rnd = rnd;
        this.color = color;
        relocatePosition();
    }

    public Food(Board board, Random rnd, Rgb color, Cell position) {
        if (!board.contains(position)) throw new IllegalArgumentException("Food " + position + " outside board " + board);
        this.board = board;
        this.rnd = rnd;
        this.color = color;
        this.position = position;
    }

    // may land on the snake's body
    public void relocatePosition() {
        position = new Cell(rnd.nextInt(board.w), rnd.nextInt(board.h));
    }

    public Cell position() { return position; }

    @Override public List<Cell> cells() { return List.of(position); }

    @Override public Rgb color() { return color; }
}
