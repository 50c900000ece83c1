package movepick.engine.search;

public class SearchConstants {
    public static final double INF = Double.POSITIVE_INFINITY;

    // Returned by the recursion when the round was stopped, never a real score
    public static final double ABORTED = Double.NaN;

    // The first round already looks at the opponent's reply
    public static final int START_DEPTH = 2;
    public static final int MAX_DEPTH = 101;
}
