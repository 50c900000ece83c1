package movepick.engine.search;

import movepick.engine.search.evaluator.PositionEvaluator;

import static movepick.engine.search.SearchConstants.ABORTED;
import static movepick.engine.search.SearchConstants.INF;

/**
 * Minimax with alpha-beta pruning over the lazily built tree.
 * The principal player maximizes, the opponent minimizes. Every node visited keeps its score.
 */
public final class AlphaBeta {
    private AlphaBeta() {
    }

    /**
     * @return the node's score, or {@link SearchConstants#ABORTED} (NaN) if the context asked to stop.
     * The board is restored in both cases.
     */
    public static double search(SearchNode node, int depth, double alpha, double beta, SearchContext ctx) {
        if(ctx.aborted()) {
            return ABORTED;
        }
        ctx.nodes++;
        ctx.totalNodes++;

        if(depth == 0 || node.isTerminal()) {
            node.setScore(PositionEvaluator.evaluate(node, ctx));
            return node.score();
        }

        if(node.isPrincipalToMove()) {
            node.setScore(-INF);
            for(SearchNode child : node.getChildren(ctx)) {
                child.move().apply(ctx.board);
                double score = search(child, depth - 1, alpha, beta, ctx);
                child.move().undo(ctx.board);
                if(Double.isNaN(score)) {
                    return ABORTED;
                }

                node.setScore(Math.max(node.score(), score));
                alpha = Math.max(alpha, node.score());
                if(beta <= alpha) break; // cut
            }
        } else {
            node.setScore(INF);
            for(SearchNode child : node.getChildren(ctx)) {
                child.move().apply(ctx.board);
                double score = search(child, depth - 1, alpha, beta, ctx);
                child.move().undo(ctx.board);
                if(Double.isNaN(score)) {
                    return ABORTED;
                }

                node.setScore(Math.min(node.score(), score));
                beta = Math.min(beta, node.score());
                if(beta <= alpha) break; // cut
            }
        }
        return node.score();
    }

    public static double search(SearchNode root, int depth, SearchContext ctx) {
        return search(root, depth, -INF, INF, ctx);
    }
}
