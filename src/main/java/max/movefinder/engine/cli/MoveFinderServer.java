package max.movefinder.engine.cli;

import max.movefinder.engine.common.Color;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.movegen.MoveGenerator;
import max.movefinder.engine.movegen.PieceMoves;
import max.movefinder.engine.utils.notations.BoardIOUtils;
import max.movefinder.engine.utils.notations.FENUtils;
import max.movefinder.engine.utils.notations.InvalidTokenException;
import max.movefinder.engine.utils.notations.MoveIOUtils;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Line based driver. Each position is given either as 8 grid rows followed by the color to play,
 * or as a single {@code fen <record>} line. Reads positions until end of input or {@code quit}.
 */
public final class MoveFinderServer {
    private static final String FEN_COMMAND = "fen";
    private static final String QUIT_COMMAND = "quit";

    private final MoveFinderConfig config;
    private final BufferedReader in;
    private final PrintWriter out;
    private final PrintWriter err;

    public MoveFinderServer(MoveFinderConfig config) {
        this(config, System.in, System.out, System.err);
    }

    public MoveFinderServer(MoveFinderConfig config, InputStream in, OutputStream out, OutputStream err) {
        this.config = Objects.requireNonNull(config);
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = new PrintWriter(new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8)), true);
        this.err = new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8), true);
    }

    /** Run the input loop on the current thread. Returns the number of positions reported. */
    public int run() {
        int reported = 0;
        try {
            while (true) {
                if (config.showPrompts) {
                    send("");
                    send("Please provide the current configuration of a chess board:");
                }
                String line = nextNonBlankLine();
                if (line == null || line.equals(QUIT_COMMAND)) {
                    break;
                }

                try {
                    if (line.equals(FEN_COMMAND) || line.startsWith(FEN_COMMAND + " ")) {
                        String fen = line.substring(FEN_COMMAND.length()).trim();
                        if (fen.isEmpty()) {
                            throw new InvalidTokenException("fen command needs a FEN record");
                        }
                        report(FENUtils.getBoardFrom(fen), FENUtils.getActiveColor(fen));
                        reported++;
                    } else {
                        List<String> rows = readGridRows(line);
                        if (rows == null) {
                            break;
                        }
                        if (config.showPrompts) {
                            send("");
                            send("Who's turn is it? Type w or b for white or black: ");
                        }
                        String colorLine = nextNonBlankLine();
                        if (colorLine == null) {
                            err.println("Invalid input: missing color to play");
                            break;
                        }
                        // The whole position is read before parsing so a bad one doesn't shift the next
                        report(BoardIOUtils.parseBoard(rows), BoardIOUtils.parseColor(colorLine));
                        reported++;
                    }
                } catch (InvalidTokenException e) {
                    err.println("Invalid input: " + e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input", e);
        } finally {
            out.flush();
        }
        return reported;
    }

    // Returns null when input ends before the 8th row
    private List<String> readGridRows(String firstRow) throws IOException {
        List<String> rows = new ArrayList<>(Board.SIZE);
        rows.add(firstRow);
        while (rows.size() < Board.SIZE) {
            String row = in.readLine();
            if (row == null) {
                err.println("Invalid input: expected " + Board.SIZE + " rows, got " + rows.size());
                return null;
            }
            rows.add(row.trim());
        }
        return rows;
    }

    private void report(Board board, Color color) {
        long start = System.nanoTime();
        List<PieceMoves> pieceMoves = MoveGenerator.generateMoves(board, color, config.parallel);
        if (config.debug) {
            err.println("Generated " + MoveGenerator.countMoves(pieceMoves) + " moves for " + pieceMoves.size()
                    + " " + color + " pieces in " + (System.nanoTime() - start) / 1000 + " us");
        }

        if (config.showBoard) {
            send("");
            send("***** CURRENT BOARD *****");
            send("");
            send(BoardIOUtils.labeledBoard(board));
        }

        send("");
        send("***** AVAILABLE MOVES *****");
        send("");
        for (PieceMoves moves : pieceMoves) {
            send(MoveIOUtils.writePieceMoves(moves));
        }
    }

    private String nextNonBlankLine() throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            line = line.trim();
            if (!line.isEmpty()) {
                return line;
            }
        }
        return null;
    }

    private synchronized void send(String line) {
        out.println(line);
        out.flush();
    }
}
