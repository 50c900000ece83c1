package movepick.engine.search;

import movepick.engine.common.Piece;
import movepick.engine.game.board.Board;

final class DebugChecks {
    private DebugChecks() {}

    static void assertSameBoard(Board board, Piece[] expandedOn, SearchNode node) {
        if(expandedOn != null && !board.matches(expandedOn)) {
            throw new IllegalStateException("Cached children reused on a different board: " + node
                    + " expanded on " + new Board(expandedOn) + " but board is now " + board);
        }
    }

    static void assertBoardRestored(Board board, Piece[] before, int depth) {
        if(!board.matches(before)) {
            throw new IllegalStateException("Board not restored after search at depth " + depth
                    + ": " + board);
        }
    }
}
