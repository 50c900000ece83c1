package movepick.engine.movegen;

import it.unimi.dsi.fastutil.ints.Int2ObjectArrayMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import movepick.engine.common.Piece;
import movepick.engine.common.Square;
import movepick.engine.game.board.Board;

/**
 * Reversible set of cell writes. The previous content of every touched cell is captured when
 * the change is added, so apply/undo stay exact inverses whatever happened on the board since.
 * <p>
 * Calls must nest with the search: undo the last applied move before applying a sibling.
 */
public final class Move {
    // keys are flat square indexes, insertion ordered (destination first)
    private final Int2ObjectArrayMap<Piece> changes = new Int2ObjectArrayMap<>(2);
    private final Int2ObjectArrayMap<Piece> undoChanges = new Int2ObjectArrayMap<>(2);

    Move() {
    }

    public static Move of(Board board, Square from, Square to, Piece placed) {
        Move move = new Move();
        move.addChange(board, to, placed);
        move.addChange(board, from, Piece.EMPTY);
        return move;
    }

    void addChange(Board board, Square square, Piece piece) {
        undoChanges.put(square.flatIndex, board.get(square));
        changes.put(square.flatIndex, piece);
    }

    public void apply(Board board) {
        for(Int2ObjectMap.Entry<Piece> change : changes.int2ObjectEntrySet()) {
            board.set(change.getIntKey(), change.getValue());
        }
    }

    public void undo(Board board) {
        for(Int2ObjectMap.Entry<Piece> change : changes.int2ObjectEntrySet()) {
            board.set(change.getIntKey(), undoChanges.get(change.getIntKey()));
        }
    }

    /**
     * True when this move overwrites a king with a piece of the other color.
     */
    public boolean capturesKing() {
        for(Int2ObjectMap.Entry<Piece> previous : undoChanges.int2ObjectEntrySet()) {
            Piece before = previous.getValue();
            if(!before.isKing()) {
                continue;
            }
            Piece after = changes.get(previous.getIntKey());
            if(!after.isEmpty() && after.color != before.color) {
                return true;
            }
        }
        return false;
    }

    public Int2ObjectMap<Piece> changes() {
        return changes;
    }

    public Int2ObjectMap<Piece> undoChanges() {
        return undoChanges;
    }

    public Square destination() {
        return Square.of(changes.keySet().iterator().nextInt());
    }

    public Square origin() {
        int origin = -1;
        for(Int2ObjectMap.Entry<Piece> change : changes.int2ObjectEntrySet()) {
            if(change.getValue().isEmpty()) {
                origin = change.getIntKey();
            }
        }
        return origin == -1 ? null : Square.of(origin);
    }

    public Piece placedPiece() {
        return changes.get(destination().flatIndex);
    }

    public Piece capturedPiece() {
        return undoChanges.get(destination().flatIndex);
    }

    public boolean isCapture() {
        return !capturedPiece().isEmpty();
    }

    @Override
    public String toString() {
        Square from = origin();
        Square to = destination();
        StringBuilder sb = new StringBuilder();
        sb.append(placedPiece().symbol).append(' ');
        if(from != null) {
            sb.append(from.row).append(',').append(from.column);
        }
        sb.append(isCapture() ? 'x' : '-');
        sb.append(to.row).append(',').append(to.column);
        return sb.toString();
    }
}
