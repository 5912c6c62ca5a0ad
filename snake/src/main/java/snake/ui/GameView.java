package snake.ui;

import com.googlecode.lanterna.TerminalSize;
import com.googlecode.lanterna.TextColor;
import com.googlecode.lanterna.gui2.AbstractComponent;
import com.googlecode.lanterna.gui2.ComponentRenderer;
import com.googlecode.lanterna.gui2.TextGUIGraphics;
import snake.core.Board;
import snake.core.Cell;
import snake.core.Drawable;
import snake.core.Rgb;

import java.util.List;

public final class GameView extends AbstractComponent<GameView> {
    private static final TextColor BORDER = new TextColor.RGB(110, 110, 110);

    /** Copy of what was handed to {@link #show}; the renderer only reads this. */
    public record Layer(List<Cell> cells, TextColor color) {}

    private final Board board;
    private final int cellWidth;
    private final TextColor background;
    private final String cellFill;

    private volatile List<Layer> frame = List.of();

    public GameView(Board board, int cellWidth, Rgb background) {
        this.board = board;
        this.cellWidth = cellWidth;
        this.background = color(background);
        this.cellFill = " ".repeat(cellWidth);
    }

    public void show(List<? extends Drawable> drawables) {
        frame = drawables.stream()
                .map(d -> new Layer(d.cells(), color(d.color())))
                .toList();
        invalidate();
    }

    public List<Layer> frame() { return frame; }

    public static TextColor color(Rgb c) { return new TextColor.RGB(c.r(), c.g(), c.b()); }

    @Override protected ComponentRenderer<GameView> createDefaultRenderer() {
        return new ComponentRenderer<>() {
            @Override public TerminalSize getPreferredSize(GameView c) {
                return new TerminalSize(fieldW(), fieldH());
            }

            @Override public void drawComponent(TextGUIGraphics g, GameView c) {
                g.setBackgroundColor(background);
                g.setForegroundColor(background);
                g.fill(' ');

                int fw = fieldW(), fh = fieldH();
                int aw = g.getSize().getColumns(), ah = g.getSize().getRows();
                int ox = Math.max(0, (aw - fw) / 2);
                int oy = Math.max(0, (ah - fh) / 2);

                g.setForegroundColor(BORDER);
                g.setBackgroundColor(background);
                box(g, ox, oy, fw, fh);

                for (Layer layer : frame) {
                    for (Cell p : layer.cells()) cell(g, ox, oy, p, layer.color());
                }
            }
        };
    }

    private int fieldW() { return board.w * cellWidth + 2; }
    private int fieldH() { return board.h + 2; }

    private static void box(TextGUIGraphics g, int x, int y, int w, int h) {
        int x2 = x + w - 1, y2 = y + h - 1;
        g.drawLine(x, y, x2, y, '─');
        g.drawLine(x, y2, x2, y2, '─');
        g.drawLine(x, y, x, y2, '│');
        g.drawLine(x2, y, x2, y2, '│');
        g.setCharacter(x, y, '┌');
        g.setCharacter(x2, y, '┐');
        g.setCharacter(x, y2, '└');
        g.setCharacter(x2, y2, '┘');
    }

    private void cell(TextGUIGraphics g, int ox, int oy, Cell p, TextColor color) {
        int sx = ox + 1 + p.x() * cellWidth;
        int sy = oy + 1 + p.y();
        if (sx < 0 || sy < 0 || sx + cellWidth - 1 >= g.getSize().getColumns() || sy >= g.getSize().getRows()) return;
        g.setBackgroundColor(color);
        g.setForegroundColor(color);
        g.putString(sx, sy, cellFill);
    }
}
