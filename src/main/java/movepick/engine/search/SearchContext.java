package movepick.engine.search;

import movepick.engine.common.Color;
import movepick.engine.game.board.Board;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything a search round shares: the one mutable board, the side we recommend moves for
 * and the stop conditions.
 */
public final class SearchContext {
    public final Board board;
    public final Color principal;
    public final SearchConfig cfg;

    private final AtomicBoolean stop;
    private long startNs;

    // Counters
    public long nodes, totalNodes;
    public int currentDepth;

    public SearchContext(Board board, Color principal, SearchConfig cfg) {
        this(board, principal, cfg, new AtomicBoolean(false));
    }

    public SearchContext(Board board, Color principal, SearchConfig cfg, AtomicBoolean stop) {
        this.board = board;
        this.principal = principal;
        this.cfg = cfg;
        this.stop = stop;
        this.startNs = System.nanoTime();
    }

    public Color colorToMove(boolean principalToMove) {
        return principalToMove ? principal : principal.getOppositeColor();
    }

    public void newSearch() {
        nodes = totalNodes = 0;
        currentDepth = 0;
        startNs = System.nanoTime();
    }

    public boolean aborted() {
        return TimeControl.aborted(stop, startNs, cfg.budgetNs());
    }

    public long elapsedMs() {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }
}
