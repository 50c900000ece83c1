package movepick.engine.movegen.utils;

import movepick.engine.common.Piece;
import movepick.engine.common.Square;
import movepick.engine.game.board.Board;
import movepick.engine.movegen.Move;

import java.util.List;

public final class DirectionalMoveUtils {
    public static final int[][] ORTHOGONAL_DIRECTIONS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
    public static final int[][] DIAGONAL_DIRECTIONS = {{-1, -1}, {-1, 1}, {1, -1}, {1, 1}};

    private DirectionalMoveUtils() {
    }

    /**
     * Walks from the piece on {@code from} in the (rowStep, columnStep) direction.
     * Sliding pieces keep going over empty squares, single steppers (king, knight) stop after one.
     */
    public static void addMovesInDirection(Board board, List<Move> moves, Square from, int rowStep, int columnStep) {
        Piece mover = board.get(from);
        for(int distance = 1; ; distance++) {
            Square to = Square.of(from.row + distance * rowStep, from.column + distance * columnStep);
            if(to == null) {
                return;
            }
            Piece target = board.get(to);
            // blocked by our own piece
            if(target.isColor(mover.color)) {
                return;
            }
            if(!target.isEmpty()) {
                addCapture(moves, Move.of(board, from, to, mover), mover, target);
                return;
            }

            moves.add(Move.of(board, from, to, mover));
            if(!mover.type.sliding) {
                return;
            }
        }
    }

    // Captures of a heavier piece go first, the rest is queued with the quiet moves
    static void addCapture(List<Move> moves, Move capture, Piece attacker, Piece victim) {
        if(Math.abs(victim.value()) > Math.abs(attacker.value())) {
            moves.add(0, capture);
        } else {
            moves.add(capture);
        }
    }
}
