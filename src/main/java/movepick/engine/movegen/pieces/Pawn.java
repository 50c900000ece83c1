package movepick.engine.movegen.pieces;

import movepick.engine.common.Color;
import movepick.engine.common.Piece;
import movepick.engine.common.PieceType;
import movepick.engine.common.Square;
import movepick.engine.game.board.Board;
import movepick.engine.movegen.Move;

import java.util.List;

public final class Pawn {
    private Pawn() {
    }

    /**
     * Diagonal captures always go to the front of the list, pushes to the back.
     * A pawn reaching the last row is always promoted to a queen.
     */
    public static void addPseudoLegalMoves(Board board, List<Move> moves, Square from) {
        Piece pawn = board.get(from);
        Color color = pawn.color;
        int nextRow = from.row + color.pawnDirection();
        if(!Square.isOnBoard(nextRow, from.column)) {
            return;
        }

        Piece placed = nextRow == color.promotionRow() ? Piece.of(PieceType.QUEEN, color) : pawn;
        Color enemy = color.getOppositeColor();

        // right diagonal first: the left one ends up in front of it
        Square rightCapture = Square.of(nextRow, from.column + 1);
        if(rightCapture != null && board.get(rightCapture).isColor(enemy)) {
            moves.add(0, Move.of(board, from, rightCapture, placed));
        }
        Square leftCapture = Square.of(nextRow, from.column - 1);
        if(leftCapture != null && board.get(leftCapture).isColor(enemy)) {
            moves.add(0, Move.of(board, from, leftCapture, placed));
        }

        Square push = Square.of(nextRow, from.column);
        if(board.get(push).isEmpty()) {
            moves.add(Move.of(board, from, push, placed));
        }

        if(from.row == color.pawnStartRow()) {
            Square doublePush = Square.of(from.row + 2 * color.pawnDirection(), from.column);
            if(board.get(push).isEmpty() && board.get(doublePush).isEmpty()) {
                moves.add(Move.of(board, from, doublePush, pawn));
            }
        }
    }
}
