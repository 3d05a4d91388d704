package max.movefinder.engine.utils.notations;

import max.movefinder.engine.common.Color;
import max.movefinder.engine.common.PieceType;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.game.board.utils.BoardUtils;

import java.util.List;

/**
 * Reads and writes the comma separated grid format: 8 lines of 8 tokens, row 1 being rank 8.
 * A token is a color letter followed by a piece letter ("wp", "bn") or {@value #EMPTY_TOKEN} for an empty square.
 * <pre>
 * br,bn,bb,bq,bk,bb,bn,br
 * bp,bp,bp,bp,bp,bp,bp,bp
 * x,x,x,x,x,x,x,x
 * ...
 * </pre>
 */
public class BoardIOUtils {
    public static final String EMPTY_TOKEN = "x";
    private static final String TOKEN_SEPARATOR = ",";

    public static Board parseBoard(List<String> rows) {
        if(rows.size() != Board.SIZE) {
            throw new InvalidTokenException("Expected " + Board.SIZE + " rows, got " + rows.size());
        }

        Board.Builder builder = new Board.Builder();
        for(int row = 0; row < Board.SIZE; row++) {
            String[] tokens = rows.get(row).split(TOKEN_SEPARATOR, -1);
            if(tokens.length != Board.SIZE) {
                throw new InvalidTokenException("Row " + (row + 1) + " should have " + Board.SIZE
                        + " squares, got " + tokens.length);
            }
            for(int column = 0; column < Board.SIZE; column++) {
                String token = tokens[column].trim();
                if(EMPTY_TOKEN.equals(token)) {
                    continue;
                }
                if(token.length() != 2) {
                    throw invalidSquare(token, column, row);
                }
                Color color = Color.fromCode(token.charAt(0));
                PieceType pieceType = PieceType.fromLetter(token.charAt(1));
                if(color == null || pieceType == null) {
                    throw invalidSquare(token, column, row);
                }
                builder.piece(column, row, color, pieceType);
            }
        }

        return builder.build();
    }

    public static Color parseColor(String token) {
        String trimmed = token == null ? "" : token.trim();
        Color color = trimmed.length() == 1 ? Color.fromCode(trimmed.charAt(0)) : null;
        if(color == null) {
            throw new InvalidTokenException("Color should be 'w' or 'b', got '" + trimmed + "'");
        }
        return color;
    }

    public static String writeSquare(byte square) {
        if(BoardUtils.isEmptySquare(square)) {
            return EMPTY_TOKEN;
        }
        return "" + BoardUtils.getSquareColor(square).code + BoardUtils.getSquarePieceType(square).letter;
    }

    public static String writeBoard(Board board) {
        StringBuilder sb = new StringBuilder();
        for(int row = 0; row < Board.SIZE; row++) {
            for(int column = 0; column < Board.SIZE; column++) {
                if(column > 0) {
                    sb.append(TOKEN_SEPARATOR);
                }
                sb.append(writeSquare(board.squareAt(column, row)));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Board with file letters on top and rank numbers on the left, empty squares shown as x.
     */
    public static String labeledBoard(Board board) {
        StringBuilder sb = new StringBuilder("   a   b   c   d   e   f   g   h");
        for(int row = 0; row < Board.SIZE; row++) {
            sb.append('\n').append(MoveIOUtils.getNumberFromRow(row));
            for(int column = 0; column < Board.SIZE; column++) {
                byte square = board.squareAt(column, row);
                sb.append(' ');
                if(BoardUtils.isEmptySquare(square)) {
                    sb.append(' ').append(EMPTY_TOKEN).append(' ');
                } else {
                    sb.append(' ').append(writeSquare(square));
                }
            }
        }
        return sb.toString();
    }

    private static InvalidTokenException invalidSquare(String token, int column, int row) {
        return new InvalidTokenException("Unknown piece '" + token + "' at row " + (row + 1)
                + ", column " + (column + 1));
    }
}
