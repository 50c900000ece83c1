package movepick.engine.common;

// Board coordinate, row first. Instances are cached so identity comparison is fine
public final class Square {

    private static final Square[] SQUARE_CACHE = new Square[64];
    static {
        for(int row = 0; row < 8; row++) {
            for(int column = 0; column < 8; column++) {
                SQUARE_CACHE[row * 8 + column] = new Square(row, column);
            }
        }
    }

    public static Square of(int row, int column) {
        if(!isOnBoard(row, column)) {
            // Not supported, it is out of the board
            return null;
        }

        return SQUARE_CACHE[row * 8 + column];
    }

    public static Square of(int flatIndex) {
        return SQUARE_CACHE[flatIndex];
    }

    public static boolean isOnBoard(int row, int column) {
        return row >= 0 && row < 8 && column >= 0 && column < 8;
    }

    public final int row;
    public final int column;
    public final int flatIndex;

    private Square(int row, int column) {
        this.row = row;
        this.column = column;
        this.flatIndex = row * 8 + column;
    }

    @Override
    public String toString() {
        return "Square{" +
                "row=" + row +
                ", column=" + column +
                '}';
    }
}
