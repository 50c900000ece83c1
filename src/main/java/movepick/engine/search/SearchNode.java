package movepick.engine.search;

import movepick.engine.common.Piece;
import movepick.engine.movegen.Move;
import movepick.engine.movegen.MoveGenerator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One ply of the game tree.
 * <p>
 * Children are generated once, against the board as it is when {@link #getChildren} is first
 * called, and cached for good. That is only right while the board is in the exact state this
 * node stands for, i.e. right after its move has been applied. The root relies on it to keep its
 * children (and their scores) across iterative deepening rounds.
 */
public final class SearchNode {
    private final Move move;
    private final boolean principalToMove;
    private double score;

    private List<SearchNode> children;
    // Board seen at expansion, only kept in debug mode
    private Piece[] expandedOn;

    public SearchNode(Move move, boolean principalToMove) {
        this.move = move;
        this.principalToMove = principalToMove;
    }

    public static SearchNode root() {
        return new SearchNode(null, true);
    }

    public List<SearchNode> getChildren(SearchContext ctx) {
        if(children != null) {
            if(ctx.cfg.debug) {
                DebugChecks.assertSameBoard(ctx.board, expandedOn, this);
            }
            return children;
        }

        List<Move> moves = MoveGenerator.generateMoves(ctx.board, ctx.colorToMove(principalToMove));
        List<SearchNode> expanded = new ArrayList<>(moves.size());
        for(Move childMove : moves) {
            expanded.add(new SearchNode(childMove, !principalToMove));
        }
        children = Collections.unmodifiableList(expanded);
        if(ctx.cfg.debug) {
            expandedOn = ctx.board.snapshot();
        }
        return children;
    }

    public boolean isExpanded() {
        return children != null;
    }

    // Does not expand
    public List<SearchNode> getCachedChildren() {
        return children == null ? Collections.emptyList() : children;
    }

    /** A king was taken by the move leading here: the game is over on this branch. */
    public boolean isTerminal() {
        return move != null && move.capturesKing();
    }

    public Move move() {
        return move;
    }

    public boolean isPrincipalToMove() {
        return principalToMove;
    }

    public double score() {
        return score;
    }

    void setScore(double score) {
        this.score = score;
    }

    @Override
    public String toString() {
        return "SearchNode{" +
                "move=" + move +
                ", principalToMove=" + principalToMove +
                ", score=" + score +
                '}';
    }
}
