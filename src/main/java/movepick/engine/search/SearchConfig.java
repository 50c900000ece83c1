package movepick.engine.search;

public final class SearchConfig {

    public final boolean debug;

    // Iterative deepening bounds, both inclusive
    public final int startDepth;
    public final int maxDepth;

    // -1 means no budget: rounds go on until maxDepth or an external stop
    public final long moveTimeMs;

    private SearchConfig(Builder b) {
        debug = b.debug;
        startDepth = b.startDepth;
        maxDepth = b.maxDepth;
        moveTimeMs = b.moveTimeMs;
    }

    public long budgetNs() {
        return moveTimeMs == -1 ? -1 : moveTimeMs * 1_000_000L;
    }

    public static class Builder {
        private boolean debug = false;
        private int startDepth = SearchConstants.START_DEPTH;
        private int maxDepth = SearchConstants.MAX_DEPTH;
        private long moveTimeMs = -1;

        public Builder debug(boolean v){debug=v;return this;}
        public Builder startDepth(int v){startDepth=v;return this;}
        public Builder maxDepth(int v){maxDepth=v;return this;}
        public Builder moveTimeMs(long v){moveTimeMs=v;return this;}

        public SearchConfig build(){
            if(startDepth < 1 || maxDepth < startDepth) {
                throw new IllegalArgumentException("Invalid depth range [" + startDepth + ", " + maxDepth + "]");
            }
            if(moveTimeMs < -1) {
                throw new IllegalArgumentException("Invalid move time: " + moveTimeMs);
            }
            return new SearchConfig(this);
        }
    }
}
