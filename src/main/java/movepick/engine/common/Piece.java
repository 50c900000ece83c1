package movepick.engine.common;

/**
 * Content of a board cell: one of the twelve colored pieces or {@link #EMPTY}.
 */
public enum Piece {
    EMPTY('.', PieceType.NONE, null),
    WHITE_PAWN('P', PieceType.PAWN, Color.WHITE),
    WHITE_ROOK('R', PieceType.ROOK, Color.WHITE),
    WHITE_BISHOP('B', PieceType.BISHOP, Color.WHITE),
    WHITE_QUEEN('Q', PieceType.QUEEN, Color.WHITE),
    WHITE_KING('K', PieceType.KING, Color.WHITE),
    WHITE_KNIGHT('N', PieceType.KNIGHT, Color.WHITE),
    BLACK_PAWN('p', PieceType.PAWN, Color.BLACK),
    BLACK_ROOK('r', PieceType.ROOK, Color.BLACK),
    BLACK_BISHOP('b', PieceType.BISHOP, Color.BLACK),
    BLACK_QUEEN('q', PieceType.QUEEN, Color.BLACK),
    BLACK_KING('k', PieceType.KING, Color.BLACK),
    BLACK_KNIGHT('n', PieceType.KNIGHT, Color.BLACK);

    private static final Piece[] BY_SYMBOL = new Piece[128];
    static {
        for(Piece piece : values()) {
            BY_SYMBOL[piece.symbol] = piece;
        }
    }

    public final char symbol;
    public final PieceType type;
    public final Color color;

    Piece(char symbol, PieceType type, Color color) {
        this.symbol = symbol;
        this.type = type;
        this.color = color;
    }

    public static Piece of(PieceType type, Color color) {
        if(type == PieceType.NONE) {
            return EMPTY;
        }
        for(Piece piece : values()) {
            if(piece.type == type && piece.color == color) {
                return piece;
            }
        }
        throw new IllegalStateException("Unexpected piece: " + type + " " + color);
    }

    /**
     * @return the piece for this symbol, or null when the symbol is unknown
     */
    public static Piece fromSymbol(char symbol) {
        return symbol < BY_SYMBOL.length ? BY_SYMBOL[symbol] : null;
    }

    public boolean isEmpty() {
        return this == EMPTY;
    }

    public boolean isKing() {
        return type == PieceType.KING;
    }

    public boolean isColor(Color other) {
        return color == other;
    }

    /** Signed material value: positive for white pieces, negative for black ones. */
    public double value() {
        if(color == null) {
            return 0.0;
        }
        return color == Color.WHITE ? type.value : -type.value;
    }
}
