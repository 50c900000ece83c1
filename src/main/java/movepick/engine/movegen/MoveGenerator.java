package movepick.engine.movegen;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import movepick.engine.common.Color;
import movepick.engine.common.Piece;
import movepick.engine.common.Square;
import movepick.engine.game.board.Board;
import movepick.engine.movegen.pieces.Bishop;
import movepick.engine.movegen.pieces.King;
import movepick.engine.movegen.pieces.Knight;
import movepick.engine.movegen.pieces.Pawn;
import movepick.engine.movegen.pieces.Rook;

import java.util.List;

/**
 * Pseudo-legal move generation. Nothing here looks at king safety, so a move leaving the
 * own king en prise is generated like any other.
 * <p>
 * The returned order is the search order: pawn captures and captures of a heavier piece
 * are pushed to the front, everything else follows in board scan order.
 */
public final class MoveGenerator {
    // Average branching factor is well below that
    private static final int INITIAL_CAPACITY = 48;

    private MoveGenerator() {
    }

    public static List<Move> generateMoves(Board board, Color color) {
        List<Move> moves = new ObjectArrayList<>(INITIAL_CAPACITY);
        for(int row = 0; row < Board.SIZE; row++) {
            for(int column = 0; column < Board.SIZE; column++) {
                Piece piece = board.get(row, column);
                if(!piece.isColor(color)) {
                    continue;
                }
                addPseudoLegalMoves(board, moves, Square.of(row, column), piece);
            }
        }
        return moves;
    }

    private static void addPseudoLegalMoves(Board board, List<Move> moves, Square from, Piece piece) {
        switch (piece.type) {
            case PAWN -> Pawn.addPseudoLegalMoves(board, moves, from);
            case ROOK -> Rook.addPseudoLegalMoves(board, moves, from);
            case BISHOP -> Bishop.addPseudoLegalMoves(board, moves, from);
            case KNIGHT -> Knight.addPseudoLegalMoves(board, moves, from);
            case QUEEN -> {
                Rook.addPseudoLegalMoves(board, moves, from);
                Bishop.addPseudoLegalMoves(board, moves, from);
            }
            case KING -> King.addPseudoLegalMoves(board, moves, from);
            case NONE -> throw new IllegalStateException("Empty square has no moves: " + from);
        }
    }
}
