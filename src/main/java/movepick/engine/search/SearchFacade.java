package movepick.engine.search;

import movepick.engine.common.Color;
import movepick.engine.game.board.Board;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Entry point of the engine: recommends moves for one side of a board, deeper and deeper.
 * <p>
 * The board is searched in place and is back to its initial state when this returns.
 */
public final class SearchFacade {

    private final SearchConfig cfg;

    public SearchFacade(SearchConfig cfg) {
        this.cfg = cfg;
    }

    /**
     * Runs iterative deepening until the depth ceiling, the time budget or {@code stop}.
     *
     * @param onDepth receives each completed round, in order
     * @param out diagnostic lines
     * @return the last completed round, null if not even the first one completed
     */
    public SearchResult findBestMove(Board board, Color principal, AtomicBoolean stop,
                                     Consumer<SearchResult> onDepth, Consumer<String> out) {
        SearchContext ctx = new SearchContext(board, principal, cfg, stop);
        ctx.newSearch();
        SearchResult sr = IterativeDeepening.run(SearchNode.root(), ctx, onDepth, out);
        out.accept("string Search done after " + ctx.totalNodes + " nodes in " + ctx.elapsedMs() + " ms");
        return sr;
    }
}
