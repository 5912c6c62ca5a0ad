package snake.app;

import com.googlecode.lanterna.TextColor;
import com.googlecode.lanterna.graphics.SimpleTheme;
import com.googlecode.lanterna.gui2.BasicWindow;
import com.googlecode.lanterna.gui2.BorderLayout;
import com.googlecode.lanterna.gui2.Borders;
import com.googlecode.lanterna.gui2.DefaultWindowManager;
import com.googlecode.lanterna.gui2.EmptySpace;
import com.googlecode.lanterna.gui2.Label;
import com.googlecode.lanterna.gui2.MultiWindowTextGUI;
import com.googlecode.lanterna.gui2.Panel;
import com.googlecode.lanterna.gui2.Window;
import com.googlecode.lanterna.input.KeyStroke;
import com.googlecode.lanterna.screen.Screen;
import com.googlecode.lanterna.screen.TerminalScreen;
import com.googlecode.lanterna.terminal.DefaultTerminalFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import snake.config.GameSettings;
import snake.core.Board;
import snake.core.Drawable;
import snake.ui.GameView;
import snake.ui.LanternaInput;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

public final class TerminalSession implements GameTerminal {
    private static final Logger LOG = LoggerFactory.getLogger(TerminalSession.class);

    private final Screen screen;
    private final MultiWindowTextGUI gui;
    private final GameView view;
    private final LanternaInput keys = new LanternaInput();

    private TerminalSession(Screen screen, MultiWindowTextGUI gui, GameView view) {
        this.screen = screen;
        this.gui = gui;
        this.view = view;
    }

    public static TerminalSession open(GameSettings settings, Board board) throws IOException {
        Screen screen = new TerminalScreen(new DefaultTerminalFactory()
                .setTerminalEmulatorTitle(settings.title())
                .createTerminal());
        screen.startScreen();
        screen.setCursorPosition(null);

        try {
            MultiWindowTextGUI gui = new MultiWindowTextGUI(screen, new DefaultWindowManager(), new EmptySpace());
            gui.setTheme(new SimpleTheme(TextColor.ANSI.WHITE, TextColor.ANSI.BLACK));

            BasicWindow w = new BasicWindow(settings.title());
            w.setHints(List.of(Window.Hint.FULL_SCREEN));

            Panel root = new Panel(new BorderLayout());
            Label help = new Label("Arrows: steer   Q/Esc: quit");
            GameView view = new GameView(board, settings.cellWidth(), settings.background());
            root.addComponent(help.withBorder(Borders.singleLine()), BorderLayout.Location.TOP);
            root.addComponent(view.withBorder(Borders.singleLine("Field")), BorderLayout.Location.CENTER);

            w.setComponent(root);
            gui.addWindow(w);
            LOG.info("Terminal opened: {}", screen.getTerminalSize());
            return new TerminalSession(screen, gui, view);
        } catch (RuntimeException e) {
            screen.stopScreen();
            throw e;
        }
    }

    @Override public List<LanternaInput.Input> drain() {
        List<LanternaInput.Input> out = new ArrayList<>();
        try {
            for (KeyStroke k; (k = screen.pollInput()) != null; ) {
                LanternaInput.Input in = keys.map(k);
                if (in.action() != LanternaInput.Action.NONE || in.dir() != null) out.add(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read terminal input", e);
        }
        return out;
    }

    @Override public void render(List<? extends Drawable> drawables) {
        view.show(drawables);
        try {
            gui.updateScreen();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to draw frame", e);
        }
    }

    @Override public void close() throws IOException {
        screen.stopScreen();
        LOG.info("Terminal closed");
    }
}
