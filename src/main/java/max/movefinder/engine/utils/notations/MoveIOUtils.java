package max.movefinder.engine.utils.notations;

import max.movefinder.engine.common.Position;
import max.movefinder.engine.game.Piece;
import max.movefinder.engine.movegen.Move;
import max.movefinder.engine.movegen.PieceMoves;

import java.util.StringJoiner;

public class MoveIOUtils {
    private static final String FILES = "abcdefgh";
    private static final String RANKS = "87654321";

    // (6, 0) -> "g8"
    public static String getSquareFromPosition(int column, int row) {
        return getLetterFromColumn(column) + getNumberFromRow(row);
    }

    public static String getSquareFromPosition(Position position) {
        return getSquareFromPosition(position.getColumn(), position.getRow());
    }

    public static String getLetterFromColumn(int column) {
        if(column < 0 || column > 7) {
            throw new IllegalArgumentException("column should be in [0-7], got " + column);
        }
        return String.valueOf(FILES.charAt(column));
    }

    public static String getNumberFromRow(int row) {
        if(row < 0 || row > 7) {
            throw new IllegalArgumentException("row should be in [0-7], got " + row);
        }
        return String.valueOf(RANKS.charAt(row));
    }

    public static Position getPositionFromSquare(String square) {
        if(square == null || square.length() != 2) {
            throw new InvalidTokenException("square should be format 'a1', got '" + square + "'");
        }

        int column = FILES.indexOf(square.charAt(0));
        if(column < 0) {
            throw new InvalidTokenException("square letter should be in [a-h], got '" + square + "'");
        }
        int row = RANKS.indexOf(square.charAt(1));
        if(row < 0) {
            throw new InvalidTokenException("square digit should be in [1-8], got '" + square + "'");
        }

        return Position.of(column, row);
    }

    // f3, e5 (Capture Pawn), Promote on a8, Promote on b8 (Capture Rook)
    public static String writeMove(Move move) {
        StringBuilder sb = new StringBuilder();
        if(move.promotion()) {
            sb.append("Promote on ");
        }
        sb.append(getSquareFromPosition(move.targetColumn(), move.targetRow()));
        move.getCapturedPiece()
                .ifPresent(captured -> sb.append(" (Capture ").append(captured.displayName).append(')'));
        return sb.toString();
    }

    // Knight (g1)
    public static String writePiece(Piece piece) {
        return piece.pieceType().displayName + " (" + getSquareFromPosition(piece.column(), piece.row()) + ")";
    }

    // Knight (g1): f3, h3
    public static String writePieceMoves(PieceMoves pieceMoves) {
        StringJoiner moves = new StringJoiner(", ");
        for(Move move : pieceMoves.moves()) {
            moves.add(writeMove(move));
        }
        return writePiece(pieceMoves.piece()) + ": " + moves;
    }
}
