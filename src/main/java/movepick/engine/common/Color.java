package movepick.engine.common;

public enum Color {
    BLACK, WHITE;

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    // White pawns walk up the rows, black ones walk down
    public int pawnDirection() {
        return this == WHITE ? 1 : -1;
    }

    public int pawnStartRow() {
        return this == WHITE ? 1 : 6;
    }

    public int promotionRow() {
        return this == WHITE ? 7 : 0;
    }

    public static Color fromToken(String token) {
        if(token == null) {
            throw new IllegalArgumentException("Missing side to move");
        }
        return switch (token.trim().toLowerCase()) {
            case "w", "white" -> WHITE;
            case "b", "black" -> BLACK;
            default -> throw new IllegalArgumentException("Unknown side to move: " + token);
        };
    }
}
