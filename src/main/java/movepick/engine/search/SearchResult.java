package movepick.engine.search;

import movepick.engine.movegen.Move;

/**
 * Outcome of one completed iterative deepening round.
 *
 * @param board 64 symbols, the position after the recommended move
 */
public record SearchResult(int depth, double score, Move move, String board, long nodes, long timeMs) {
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SearchResult\n")
            .append("depth: ").append(depth).append("\n")
            .append("best move: ").append(move).append("\n")
            .append("score: ").append(score).append("\n")
            .append("search time (ms): ").append(timeMs).append("\n")
            .append("nodes: ").append(nodes).append("\n")
            .append("board: ").append(board);
        return sb.toString();
    }

    public String toInfo() {
        return "info" +
                " depth " + depth +
                " time " + timeMs +
                " score " + score +
                " nodes " + nodes +
                " move " + move;
    }
}
