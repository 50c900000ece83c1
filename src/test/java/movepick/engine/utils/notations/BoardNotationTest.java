package movepick.engine.utils.notations;

import movepick.engine.common.Color;
import movepick.engine.common.Piece;
import movepick.engine.game.board.Board;
import movepick.engine.game.board.utils.BoardGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class BoardNotationTest {

    @Test
    public void loadStandardBoard() {
        // When
        Board board = BoardNotation.load(BoardGenerator.STANDARD_GAME);

        // Then
        assertEquals(Piece.WHITE_ROOK, board.get(0, 0));
        assertEquals(Piece.WHITE_KING, board.get(0, 4));
        assertEquals(Piece.WHITE_PAWN, board.get(1, 7));
        assertEquals(Piece.EMPTY, board.get(4, 4));
        assertEquals(Piece.BLACK_PAWN, board.get(6, 0));
        assertEquals(Piece.BLACK_QUEEN, board.get(7, 3));
        assertEquals(Piece.BLACK_KNIGHT, board.get(7, 6));
    }

    @Test
    public void serializeGivesBackTheLoadedString() {
        String symbols = "R..P...." +
                         "p.k....." +
                         "........" +
                         "....Q..." +
                         "........" +
                         ".n......" +
                         "........" +
                         "k.r....K";
        assertEquals(symbols, BoardNotation.serialize(BoardNotation.load(symbols)));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 63, 65, 128})
    public void loadRejectsWrongLength(int length) {
        String symbols = ".".repeat(length);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> BoardNotation.load(symbols));
        assertTrue(e.getMessage().contains(String.valueOf(length)));
    }

    @ParameterizedTest
    @ValueSource(chars = {'x', 'X', ' ', '0', 'é'})
    public void loadRejectsUnknownSymbol(char symbol) {
        String symbols = BoardGenerator.EMPTY.substring(0, 10) + symbol + BoardGenerator.EMPTY.substring(11);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> BoardNotation.load(symbols));
        assertTrue(e.getMessage().contains("index 10"));
    }

    @Test
    public void loadRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> BoardNotation.load(null));
    }

    @Test
    public void sideToMoveTokens() {
        assertEquals(Color.WHITE, Color.fromToken("w"));
        assertEquals(Color.WHITE, Color.fromToken("White"));
        assertEquals(Color.BLACK, Color.fromToken("b"));
        assertEquals(Color.BLACK, Color.fromToken("BLACK"));
        assertThrows(IllegalArgumentException.class, () -> Color.fromToken("x"));
        assertThrows(IllegalArgumentException.class, () -> Color.fromToken(null));
    }

    @Test
    public void prettyStringHasOneLinePerRow() {
        String pretty = BoardNotation.toPrettyString(BoardGenerator.newStandardGameBoard());
        String[] lines = pretty.split("\n");

        assertEquals(8, lines.length);
        for(int row = 0; row < 8; row++) {
            assertTrue(lines[row].startsWith(String.valueOf(row)));
        }
        assertEquals("0 ♖ ♘ ♗ ♕ ♔ ♗ ♘ ♖", lines[0]);
        assertEquals("4 ▢ ▢ ▢ ▢ ▢ ▢ ▢ ▢", lines[4]);
    }
}
