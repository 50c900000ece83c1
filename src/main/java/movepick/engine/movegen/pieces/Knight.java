package movepick.engine.movegen.pieces;

import movepick.engine.common.Square;
import movepick.engine.game.board.Board;
import movepick.engine.movegen.Move;
import movepick.engine.movegen.utils.DirectionalMoveUtils;

import java.util.List;

public final class Knight {
    static final int[][] KNIGHT_OFFSETS = {
            {-2, -1}, {-2, 1}, {-1, -2}, {-1, 2},
            {1, -2}, {1, 2}, {2, -1}, {2, 1}
    };

    private Knight() {
    }

    public static void addPseudoLegalMoves(Board board, List<Move> moves, Square from) {
        for(int[] offset : KNIGHT_OFFSETS) {
            DirectionalMoveUtils.addMovesInDirection(board, moves, from, offset[0], offset[1]);
        }
    }
}
