package snake.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class FoodTest {

    private static final Rgb RED = new Rgb(255, 0, 0);
    private final Board board = new Board(7, 5);

    @Test
    void constructor_shouldPlaceAtRandomCell() {
        Food food = new Food(board, new ScriptedRandom(3, 4), RED);
        assertThat(food.position()).isEqualTo(new Cell(3, 4));
    }

    @Test
    void relocatePosition_shouldDrawXThenY() {
        Food food = new Food(board, new ScriptedRandom(0, 0, 6, 2), RED);
        food.relocatePosition();
        assertThat(food.position()).isEqualTo(new Cell(6, 2));
    }

    @Test
    @DisplayName("Relocation stays on the board and covers every cell")
    void relocatePosition_shouldStayInBoundsAndCoverBoard() {
        Food food = new Food(board, new Random(1), RED);
        boolean[][] hit = new boolean[board.w][board.h];
        for (int i = 0; i < 5000; i++) {
            food.relocatePosition();
            assertThat(board.contains(food.position())).isTrue();
            hit[food.position().x()][food.position().y()] = true;
        }
        for (int x = 0; x < board.w; x++)
            for (int y = 0; y < board.h; y++)
                assertThat(hit[x][y]).as("cell (%d,%d)", x, y).isTrue();
    }

    @Test
    void drawable_shouldExposeSingleCellAndColor() {
        Food food = new Food(board, new Random(), RED, new Cell(1, 2));
        assertThat(food.cells()).isEqualTo(List.of(new Cell(1, 2)));
        assertThat(food.color()).isEqualTo(RED);
    }

    @Test
    void constructor_shouldRejectPositionOutsideBoard() {
        assertThatThrownBy(() -> new Food(board, new Random(), RED, new Cell(7, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
