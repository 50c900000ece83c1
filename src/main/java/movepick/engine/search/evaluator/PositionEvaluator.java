package movepick.engine.search.evaluator;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import movepick.engine.common.Color;
import movepick.engine.common.Piece;
import movepick.engine.game.board.Board;
import movepick.engine.search.SearchContext;
import movepick.engine.search.SearchNode;

import static movepick.engine.search.evaluator.EvalValues.*;

/**
 * Scores a node from the principal player's point of view:
 * {@code 10 * material + 1 * pawn structure + 5 * mobility}.
 */
public final class PositionEvaluator {
    private PositionEvaluator() {
    }

    public static double evaluate(SearchNode node, SearchContext ctx) {
        return MATERIAL_WEIGHT * material(ctx.board, ctx.principal)
                + PAWN_STRUCTURE_WEIGHT * pawnStructure(node, ctx)
                + MOBILITY_WEIGHT * mobility(node, ctx);
    }

    /** Material balance, positive when {@code principal} is ahead. */
    public static double material(Board board, Color principal) {
        double whitePoints = 0.0;
        for(int square = 0; square < Board.SIZE * Board.SIZE; square++) {
            whitePoints += board.get(square).value();
        }
        return principal == Color.WHITE ? whitePoints : -whitePoints;
    }

    // Only scored on the principal player's own plies, 0 on the opponent's
    public static double pawnStructure(SearchNode node, SearchContext ctx) {
        if(!node.isPrincipalToMove()) {
            return 0.0;
        }
        return PawnEval.protectedPawns(ctx.board, ctx.principal);
    }

    /**
     * Central squares reachable by the side to move, king moves excluded.
     * Expands the node's children as a side effect.
     */
    public static double mobility(SearchNode node, SearchContext ctx) {
        double mobility = 0.0;
        for(SearchNode child : node.getChildren(ctx)) {
            for(Int2ObjectMap.Entry<Piece> change : child.move().changes().int2ObjectEntrySet()) {
                Piece placed = change.getValue();
                if(placed.isEmpty() || placed.isKing()) {
                    continue;
                }
                mobility += CENTER_BONUS[change.getIntKey()];
            }
        }
        return node.isPrincipalToMove() ? mobility : -mobility;
    }
}
