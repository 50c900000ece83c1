package movepick.engine.search;

import movepick.engine.common.Piece;
import movepick.engine.utils.notations.BoardNotation;

import java.util.function.Consumer;

final class IterativeDeepening {
    private IterativeDeepening() {
    }

    /**
     * Searches the root at increasing depths and publishes every completed round.
     * A round interrupted by the stop flag or the time budget is dropped.
     *
     * @return the last completed round, null if none completed
     */
    static SearchResult run(SearchNode root, SearchContext ctx, Consumer<SearchResult> onDepth, Consumer<String> out) {
        SearchResult last = null;

        for (ctx.currentDepth = ctx.cfg.startDepth; ctx.currentDepth <= ctx.cfg.maxDepth; ctx.currentDepth++) {
            if (ctx.aborted()) break;

            out.accept("string Searching at depth " + ctx.currentDepth);
            ctx.nodes = 0;
            Piece[] before = ctx.cfg.debug ? ctx.board.snapshot() : null;

            double score = AlphaBeta.search(root, ctx.currentDepth, ctx);
            if (ctx.cfg.debug) {
                DebugChecks.assertBoardRestored(ctx.board, before, ctx.currentDepth);
            }
            if (Double.isNaN(score)) break; // stopped during depth

            SearchNode best = pickBestChild(root);
            if (best == null) {
                out.accept("string No move available at depth " + ctx.currentDepth);
                break;
            }

            best.move().apply(ctx.board);
            String board = BoardNotation.serialize(ctx.board);
            best.move().undo(ctx.board);

            last = new SearchResult(ctx.currentDepth, score, best.move(), board, ctx.nodes, ctx.elapsedMs());
            out.accept(last.toInfo());
            onDepth.accept(last);
        }
        return last;
    }

    // First child carrying the root score; ties go to generation order
    static SearchNode pickBestChild(SearchNode root) {
        if (!root.isExpanded()) {
            return null;
        }
        for (SearchNode child : root.getCachedChildren()) {
            if (child.score() == root.score()) {
                return child;
            }
        }
        return null;
    }
}
