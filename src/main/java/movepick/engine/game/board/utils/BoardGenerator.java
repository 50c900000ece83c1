package movepick.engine.game.board.utils;

import movepick.engine.game.board.Board;
import movepick.engine.utils.notations.BoardNotation;

public class BoardGenerator {
    // White starts on rows 0-1 and moves towards row 7
    public static final String STANDARD_GAME =
            "RNBQKBNR" +
            "PPPPPPPP" +
            "........" +
            "........" +
            "........" +
            "........" +
            "pppppppp" +
            "rnbqkbnr";
    public static final String EMPTY =
            "........" +
            "........" +
            "........" +
            "........" +
            "........" +
            "........" +
            "........" +
            "........";

    public static Board newStandardGameBoard() {
        return BoardNotation.load(STANDARD_GAME);
    }

    public static Board from(String symbols) {
        return BoardNotation.load(symbols);
    }
}
