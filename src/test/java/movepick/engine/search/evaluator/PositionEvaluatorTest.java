package movepick.engine.search.evaluator;

import movepick.engine.common.Color;
import movepick.engine.common.Piece;
import movepick.engine.game.board.Board;
import movepick.engine.game.board.utils.BoardGenerator;
import movepick.engine.search.SearchConfig;
import movepick.engine.search.SearchContext;
import movepick.engine.search.SearchNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PositionEvaluatorTest {
    private static final SearchConfig CFG = new SearchConfig.Builder().build();

    private static SearchContext ctx(Board board, Color principal) {
        return new SearchContext(board, principal, CFG);
    }

    @Test
    public void standardBoardIsMaterialBalanced() {
        Board board = BoardGenerator.newStandardGameBoard();
        assertEquals(0.0, PositionEvaluator.material(board, Color.WHITE), 0.0);
        // Black material is the negated white sum, -0.0 here
        assertEquals(0.0, PositionEvaluator.material(board, Color.BLACK), 0.0);
    }

    @Test
    public void materialIsFromPrincipalPointOfView() {
        // Given white has an extra queen
        Board board = new Board();
        board.set(0, 4, Piece.WHITE_KING);
        board.set(7, 4, Piece.BLACK_KING);
        board.set(3, 3, Piece.WHITE_QUEEN);

        assertEquals(10.0, PositionEvaluator.material(board, Color.WHITE));
        assertEquals(-10.0, PositionEvaluator.material(board, Color.BLACK));
    }

    @Test
    public void protectedWhitePawnIsCountedOnlyOnPrincipalPlies() {
        // Given (2,3) is protected by (1,2)
        Board board = new Board();
        board.set(1, 2, Piece.WHITE_PAWN);
        board.set(2, 3, Piece.WHITE_PAWN);
        // black pawns never count for white
        board.set(5, 5, Piece.BLACK_PAWN);
        board.set(6, 4, Piece.BLACK_PAWN);
        SearchContext ctx = ctx(board, Color.WHITE);

        assertEquals(1.0, PositionEvaluator.pawnStructure(new SearchNode(null, true), ctx));
        assertEquals(0.0, PositionEvaluator.pawnStructure(new SearchNode(null, false), ctx));
    }

    @Test
    public void protectedBlackPawnLooksUpTheBoard() {
        // Given (5,3) is protected by (6,2) and (6,4)
        Board board = new Board();
        board.set(6, 2, Piece.BLACK_PAWN);
        board.set(6, 4, Piece.BLACK_PAWN);
        board.set(5, 3, Piece.BLACK_PAWN);
        board.set(4, 4, Piece.WHITE_PAWN);

        assertEquals(2.0, PawnEval.protectedPawns(board, Color.BLACK));
        assertEquals(0.0, PawnEval.protectedPawns(board, Color.WHITE));
        assertEquals(2.0, PositionEvaluator.pawnStructure(new SearchNode(null, true), ctx(board, Color.BLACK)));
    }

    @Test
    public void pawnsOnTheEdgeAreHandled() {
        Board board = new Board();
        board.set(0, 0, Piece.WHITE_PAWN);
        board.set(1, 1, Piece.WHITE_PAWN);
        board.set(2, 0, Piece.WHITE_PAWN);
        board.set(7, 7, Piece.BLACK_PAWN);

        // (1,1) is backed by (0,0), (2,0) by (1,1)
        assertEquals(2.0, PawnEval.protectedPawns(board, Color.WHITE));
        assertEquals(0.0, PawnEval.protectedPawns(board, Color.BLACK));
    }

    @Test
    public void mobilityCountsCentralDestinations() {
        // Given a lone knight in the corner reaching (1,2) worth 0 and (2,1) worth 0.25
        Board board = new Board();
        board.set(0, 0, Piece.WHITE_KNIGHT);

        assertEquals(0.25, PositionEvaluator.mobility(SearchNode.root(), ctx(board, Color.WHITE)));
    }

    @Test
    public void mobilityIsNegatedOnOpponentPlies() {
        Board board = new Board();
        board.set(0, 0, Piece.WHITE_KNIGHT);

        // black is the principal player, so white moves on the non principal ply
        SearchNode opponentPly = new SearchNode(null, false);
        assertEquals(-0.25, PositionEvaluator.mobility(opponentPly, ctx(board, Color.BLACK)));
        assertTrue(opponentPly.isExpanded());
    }

    @Test
    public void kingMovesDoNotCountForMobility() {
        Board board = new Board();
        board.set(3, 3, Piece.WHITE_KING);

        assertEquals(0.0, PositionEvaluator.mobility(SearchNode.root(), ctx(board, Color.WHITE)));
    }

    @Test
    public void standardBoardMobility() {
        // pawns reaching row 2 and 3, knights reaching (2,0), (2,2), (2,5), (2,7)
        Board board = BoardGenerator.newStandardGameBoard();
        double row2 = 0.25 + 0.5 + 0.5 + 0.5 + 0.5 + 0.25;
        double row3 = 0.25 + 0.5 + 1.0 + 1.0 + 0.5 + 0.25;
        double knights = 0.5 + 0.5;

        assertEquals(row2 + row3 + knights, PositionEvaluator.mobility(SearchNode.root(), ctx(board, Color.WHITE)), 1e-9);
    }

    @Test
    public void evaluationCombinesTheWeightedTerms() {
        // Given
        Board board = new Board();
        board.set(0, 0, Piece.WHITE_KNIGHT);
        board.set(0, 7, Piece.WHITE_KING);
        board.set(7, 0, Piece.BLACK_KING);

        // When
        double score = PositionEvaluator.evaluate(SearchNode.root(), ctx(board, Color.WHITE));

        // Then 10 * 3.5 + 1 * 0 + 5 * 0.25
        assertEquals(36.25, score);
    }
}
