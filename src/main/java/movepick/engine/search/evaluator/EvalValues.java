package movepick.engine.search.evaluator;

public final class EvalValues {
    public static final double MATERIAL_WEIGHT = 10;
    public static final double PAWN_STRUCTURE_WEIGHT = 1;
    public static final double MOBILITY_WEIGHT = 5;

    // Bonus for reaching a square, row-major from row 0. Only rows 2-5, columns 1-6 count
    public static final double[] CENTER_BONUS = {
            0, 0,    0,    0,    0,    0,    0,    0,
            0, 0,    0,    0,    0,    0,    0,    0,
            0, 0.25, 0.5,  0.5,  0.5,  0.5,  0.25, 0,
            0, 0.25, 0.5,  1.0,  1.0,  0.5,  0.25, 0,
            0, 0.25, 0.5,  1.0,  1.0,  0.5,  0.25, 0,
            0, 0.25, 0.5,  0.5,  0.5,  0.5,  0.25, 0,
            0, 0,    0,    0,    0,    0,    0,    0,
            0, 0,    0,    0,    0,    0,    0,    0
    };

    private EvalValues() {
    }
}
