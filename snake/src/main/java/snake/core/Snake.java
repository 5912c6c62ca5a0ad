package snake.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

/**
 * The player's snake: an ordered body (head first), a committed direction, at most one
 * buffered direction and the length the body is growing towards.
 *
 * <p>Not thread-safe; owned by the game loop thread.
 */
public final class Snake implements Drawable {

    /** Outcome of one {@link #advance()}. On collision {@code head} is the post-reset head. */
    public record Move(Cell head, boolean collided) {}

    private final Board board;
    private final Random rnd;
    private final Rgb color;

    private final Deque<Cell> body = new ArrayDeque<>();
    private Dir dir;
    private Dir pendingDir;
    private int growthTarget;

    /** New snake of length 1 at the board center, heading right. */
    public Snake(Board board, Random rnd, Rgb color) {
        this(board, rnd, color, List.of(board.center()), Dir.RIGHT);
    }

    /**
     * Snake with a given body (head first). {@code growthTarget} starts at the body length.
     */
    public Snake(Board board, Random rnd, Rgb color, List<Cell> initialBody, Dir dir) {
        if (initialBody.isEmpty()) throw new IllegalArgumentException("Snake body must not be empty");
        if (new HashSet<>(initialBody).size() != initialBody.size())
            throw new IllegalArgumentException("Snake body has repeated cells: " + initialBody);
        Cell prev = null;
        for (Cell c : initialBody) {
            if (!board.contains(c)) throw new IllegalArgumentException("Body cell " + c + " outside board " + board);
            if (prev != null && !board.adjacent(prev, c))
                throw new IllegalArgumentException("Body cells " + prev + " and " + c + " are not adjacent");
            prev = c;
        }
        this.board = board;
        this.rnd = rnd;
        this.color = color;
        this.body.addAll(initialBody);
        this.dir = dir;
        this.growthTarget = initialBody.size();
    }

    /** Last call before {@link #commitDirection()} wins. */
    public void bufferDirection(Dir d) { pendingDir = d; }

    /** Adopts the buffered direction unless it would reverse the snake; a reversal is dropped. */
    public void commitDirection() {
        if (pendingDir == null) return;
        if (!pendingDir.opposite(dir)) dir = pendingDir;
        pendingDir = null;
    }

    public Move advance() {
        Cell next = board.step(head(), dir);

        // head and neck are skipped: the neck is always adjacent to the new head
        Iterator<Cell> it = body.iterator();
        int i = 0;
        while (it.hasNext()) {
            Cell p = it.next();
            if (i++ >= 2 && p.equals(next)) {
                reset();
                return new Move(head(), true);
            }
        }

        body.addFirst(next);
        if (body.size() > growthTarget) body.removeLast();
        return new Move(next, false);
    }

    public void grow() { growthTarget++; }

    public void reset() {
        body.clear();
        body.addFirst(board.center());
        growthTarget = 1;
        pendingDir = null;
        dir = Dir.random(rnd);
    }

    public Cell head() { return body.peekFirst(); }

    public int length() { return body.size(); }

    public int growthTarget() { return growthTarget; }

    public Dir direction() { return dir; }

    /** Buffered direction, or {@code null} if none is waiting. */
    public Dir pendingDirection() { return pendingDir; }

    @Override public List<Cell> cells() { return List.copyOf(body); }

    @Override public Rgb color() { return color; }
}
