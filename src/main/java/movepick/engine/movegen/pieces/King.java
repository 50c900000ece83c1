package movepick.engine.movegen.pieces;

import movepick.engine.common.Square;
import movepick.engine.game.board.Board;
import movepick.engine.movegen.Move;
import movepick.engine.movegen.utils.DirectionalMoveUtils;

import java.util.List;

// No check safety: the king may step next to, or in front of, an enemy piece
public final class King {
    private King() {
    }

    public static void addPseudoLegalMoves(Board board, List<Move> moves, Square from) {
        for(int rowStep = -1; rowStep <= 1; rowStep++) {
            for(int columnStep = -1; columnStep <= 1; columnStep++) {
                if(rowStep == 0 && columnStep == 0) {
                    continue;
                }
                DirectionalMoveUtils.addMovesInDirection(board, moves, from, rowStep, columnStep);
            }
        }
    }
}
