package snake.ui;

import com.googlecode.lanterna.input.KeyStroke;
import com.googlecode.lanterna.input.KeyType;
import snake.core.Dir;

public final class LanternaInput {
    public enum Action { NONE, QUIT }

    /** {@code dir} is null for anything that is not an arrow key. */
    public record Input(Action action, Dir dir) {
        public static final Input IGNORED = new Input(Action.NONE, null);
        public static final Input QUIT = new Input(Action.QUIT, null);

        public static Input steer(Dir d) { return new Input(Action.NONE, d); }
    }

    public Input map(KeyStroke k) {
        if (k == null) return Input.IGNORED;

        if (k.getKeyType() == KeyType.EOF || k.getKeyType() == KeyType.Escape)
            return Input.QUIT;

        if (k.getKeyType() == KeyType.Character) {
            char c = k.getCharacter();
            if (c == 'q' || c == 'Q') return Input.QUIT;
            return Input.IGNORED;
        }

        Dir d = switch (k.getKeyType()) {
            case ArrowUp -> Dir.UP;
            case ArrowDown -> Dir.DOWN;
            case ArrowLeft -> Dir.LEFT;
            case ArrowRight -> Dir.RIGHT;
            default -> null;
        };
        return d == null ? Input.IGNORED : Input.steer(d);
    }
}
