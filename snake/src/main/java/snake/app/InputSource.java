package snake.app;

import snake.ui.LanternaInput;

import java.util.List;

public interface InputSource {
    List<LanternaInput.Input> drain();
}
