package movepick;

import movepick.engine.common.Color;
import movepick.engine.game.board.Board;
import movepick.engine.search.SearchConfig;
import movepick.engine.search.SearchFacade;
import movepick.engine.utils.notations.BoardNotation;

import java.io.BufferedWriter;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Usage: {@code java -jar chess-move-recommender.jar <w|b> <64 board symbols>}
 * <p>
 * Prints the board after the recommended move once per completed depth. Diagnostics go to stderr.
 */
public class Main {
    public static void main(String[] args) {
        if(args.length != 2) {
            usage("Expected 2 arguments, got " + args.length);
            return;
        }

        Color principal;
        Board board;
        SearchConfig cfg;
        try {
            principal = Color.fromToken(args[0]);
            board = BoardNotation.load(args[1]);
            cfg = configFromProperties();
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            usage(e.getMessage());
            return;
        }

        if(cfg.debug) {
            System.err.print(BoardNotation.toPrettyString(board));
        }

        PrintWriter out = new PrintWriter(new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.US_ASCII)), true);
        new SearchFacade(cfg).findBestMove(board, principal, new AtomicBoolean(false),
                result -> {
                    out.println(result.board());
                    if(cfg.debug) {
                        System.err.print(BoardNotation.toPrettyString(BoardNotation.load(result.board())));
                    }
                },
                System.err::println);
    }

    static SearchConfig configFromProperties() {
        return new SearchConfig.Builder()
                .debug(Boolean.parseBoolean(System.getProperty("debug", "false")))
                .startDepth(Integer.parseInt(System.getProperty("search.start", "2")))
                .maxDepth(Integer.parseInt(System.getProperty("search.depth", "101")))
                .moveTimeMs(Long.parseLong(System.getProperty("search.movetime", "-1")))
                .build();
    }

    private static void usage(String error) {
        System.err.println(error);
        System.err.println("Usage: <w|b> <64 board symbols, row 0 first, '.' for empty>");
        System.exit(1);
    }
}
