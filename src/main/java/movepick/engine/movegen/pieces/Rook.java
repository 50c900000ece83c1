package movepick.engine.movegen.pieces;

import movepick.engine.common.Square;
import movepick.engine.game.board.Board;
import movepick.engine.movegen.Move;
import movepick.engine.movegen.utils.DirectionalMoveUtils;

import java.util.List;

public final class Rook {
    private Rook() {
    }

    public static void addPseudoLegalMoves(Board board, List<Move> moves, Square from) {
        for(int[] direction : DirectionalMoveUtils.ORTHOGONAL_DIRECTIONS) {
            DirectionalMoveUtils.addMovesInDirection(board, moves, from, direction[0], direction[1]);
        }
    }
}
