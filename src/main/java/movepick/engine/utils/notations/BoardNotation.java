package movepick.engine.utils.notations;

import movepick.engine.common.Piece;
import movepick.engine.game.board.Board;

// Flat notation: 64 symbols, row 0 first, PRBQKN for white, prbqkn for black, '.' for empty
public class BoardNotation {
    public static final int LENGTH = Board.SIZE * Board.SIZE;

    private static final char[] PRETTY_SYMBOLS = new char[128];
    static {
        PRETTY_SYMBOLS['P'] = '♙';
        PRETTY_SYMBOLS['R'] = '♖';
        PRETTY_SYMBOLS['B'] = '♗';
        PRETTY_SYMBOLS['Q'] = '♕';
        PRETTY_SYMBOLS['K'] = '♔';
        PRETTY_SYMBOLS['N'] = '♘';
        PRETTY_SYMBOLS['p'] = '♟';
        PRETTY_SYMBOLS['r'] = '♜';
        PRETTY_SYMBOLS['b'] = '♝';
        PRETTY_SYMBOLS['q'] = '♛';
        PRETTY_SYMBOLS['k'] = '♚';
        PRETTY_SYMBOLS['n'] = '♞';
        PRETTY_SYMBOLS['.'] = '▢';
    }

    public static Board load(String symbols) {
        if(symbols == null) {
            throw new IllegalArgumentException("Missing board");
        }
        if(symbols.length() != LENGTH) {
            throw new IllegalArgumentException("Invalid board: expected " + LENGTH + " symbols, got " + symbols.length());
        }

        Board board = new Board();
        for(int i = 0; i < LENGTH; i++) {
            char symbol = symbols.charAt(i);
            Piece piece = Piece.fromSymbol(symbol);
            if(piece == null) {
                throw new IllegalArgumentException("Invalid board: unknown symbol '" + symbol + "' at index " + i);
            }
            board.set(i, piece);
        }
        return board;
    }

    public static String serialize(Board board) {
        StringBuilder symbols = new StringBuilder(LENGTH);
        for(int i = 0; i < LENGTH; i++) {
            symbols.append(board.get(i).symbol);
        }
        return symbols.toString();
    }

    // Debug view, one line per row prefixed with the row number
    public static String toPrettyString(Board board) {
        StringBuilder sb = new StringBuilder();
        for(int row = 0; row < Board.SIZE; row++) {
            sb.append(row);
            for(int column = 0; column < Board.SIZE; column++) {
                sb.append(' ').append(PRETTY_SYMBOLS[board.get(row, column).symbol]);
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
