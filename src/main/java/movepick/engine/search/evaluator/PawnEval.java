package movepick.engine.search.evaluator;

import movepick.engine.common.Color;
import movepick.engine.common.Piece;
import movepick.engine.common.PieceType;
import movepick.engine.game.board.Board;

public final class PawnEval {
    private PawnEval() {
    }

    /**
     * Counts, for every pawn of {@code color}, the own pawns standing diagonally one row behind it.
     * A pawn backed by two pawns counts twice.
     */
    public static double protectedPawns(Board board, Color color) {
        Piece pawn = Piece.of(PieceType.PAWN, color);
        int behind = -color.pawnDirection();
        double points = 0.0;
        for(int row = 0; row < Board.SIZE; row++) {
            for(int column = 0; column < Board.SIZE; column++) {
                if(board.get(row, column) != pawn) {
                    continue;
                }
                if(isPiece(board, row + behind, column - 1, pawn)) {
                    points += 1;
                }
                if(isPiece(board, row + behind, column + 1, pawn)) {
                    points += 1;
                }
            }
        }
        return points;
    }

    private static boolean isPiece(Board board, int row, int column, Piece piece) {
        return row >= 0 && row < Board.SIZE && column >= 0 && column < Board.SIZE
                && board.get(row, column) == piece;
    }
}
