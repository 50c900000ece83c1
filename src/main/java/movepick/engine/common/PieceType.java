package movepick.engine.common;

public enum PieceType {
    PAWN(1.0, false), KNIGHT(3.5, false), BISHOP(3.5, true), ROOK(5.25, true), QUEEN(10.0, true), KING(200.0, false), NONE(0.0, false);

    // Unsigned material value, see Piece#value for the colored one
    public final double value;
    public final boolean sliding;

    PieceType(double value, boolean sliding) {
        this.value = value;
        this.sliding = sliding;
    }
}
