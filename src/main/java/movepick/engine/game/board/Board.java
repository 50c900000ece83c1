package movepick.engine.game.board;

import movepick.engine.common.Color;
import movepick.engine.common.Piece;
import movepick.engine.common.Square;

import java.util.Arrays;

/**
 * Mutable 8x8 grid shared by the whole search. Moves write into it and restore it,
 * nothing ever copies it on the search path.
 */
public class Board {
    public static final int SIZE = 8;

    private final Piece[] pieceAt;

    public Board() {
        this.pieceAt = new Piece[SIZE * SIZE];
        Arrays.fill(pieceAt, Piece.EMPTY);
    }

    public Board(Board other) {
        this.pieceAt = other.pieceAt.clone();
    }

    public Board(Piece[] snapshot) {
        if(snapshot.length != SIZE * SIZE) {
            throw new IllegalArgumentException("A board has " + SIZE * SIZE + " cells, got " + snapshot.length);
        }
        this.pieceAt = snapshot.clone();
    }

    public Piece get(int row, int column) {
        return pieceAt[row * SIZE + column];
    }

    public Piece get(Square square) {
        return pieceAt[square.flatIndex];
    }

    public Piece get(int flatIndex) {
        return pieceAt[flatIndex];
    }

    public void set(int row, int column, Piece piece) {
        pieceAt[row * SIZE + column] = piece;
    }

    public void set(Square square, Piece piece) {
        pieceAt[square.flatIndex] = piece;
    }

    public void set(int flatIndex, Piece piece) {
        pieceAt[flatIndex] = piece;
    }

    public boolean isEmpty(int row, int column) {
        return get(row, column).isEmpty();
    }

    public boolean hasPieceOf(int row, int column, Color color) {
        return get(row, column).isColor(color);
    }

    public Piece[] snapshot() {
        return pieceAt.clone();
    }

    public boolean matches(Piece[] snapshot) {
        return Arrays.equals(pieceAt, snapshot);
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        if(!(obj instanceof Board other)) {
            return false;
        }
        return Arrays.equals(pieceAt, other.pieceAt);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(pieceAt);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(SIZE * SIZE);
        for(Piece piece : pieceAt) {
            sb.append(piece.symbol);
        }
        return sb.toString();
    }
}
