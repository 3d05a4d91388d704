package max.movefinder.engine.utils.notations;

import max.movefinder.engine.common.Color;
import max.movefinder.engine.common.PieceType;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.game.board.utils.BoardUtils;

// https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
// Only piece placement and side to move are used, castling rights, en passant and clocks are ignored
public class FENUtils {
    private record PieceTypeAndColor(PieceType pieceType, Color color) {}

    public static Board getBoardFrom(String FEN) {
        String[] fenFields = splitFields(FEN);
        Board.Builder builder = new Board.Builder();
        injectPiecePlacement(builder, fenFields[0]);
        return builder.build();
    }

    public static Color getActiveColor(String FEN) {
        String[] fenFields = splitFields(FEN);
        if(fenFields.length < 2) {
            throw new InvalidTokenException("FEN record has no active color");
        }
        return BoardIOUtils.parseColor(fenFields[1]);
    }

    public static String getFENPiecePlacement(Board board) {
        StringBuilder fen = new StringBuilder();
        for(int row = 0; row < Board.SIZE; row++) {
            int emptySpaceCounter = 0;
            if(row != 0) {
                fen.append('/');
            }
            for(int column = 0; column < Board.SIZE; column++) {
                byte square = board.squareAt(column, row);
                if(BoardUtils.isEmptySquare(square)) {
                    emptySpaceCounter++;
                    continue;
                }
                if(emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(getFENLetterFromPiece(BoardUtils.getSquarePieceType(square), BoardUtils.getSquareColor(square)));
            }

            if(emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
        return fen.toString();
    }

    private static String[] splitFields(String FEN) {
        String trimmed = FEN == null ? "" : FEN.trim();
        if(trimmed.isEmpty()) {
            throw new InvalidTokenException("Invalid FEN record: empty");
        }
        String[] fenFields = trimmed.split("\\s+");
        if(fenFields.length > 6) {
            throw new InvalidTokenException("Invalid FEN record: " + FEN);
        }
        return fenFields;
    }

    private static void injectPiecePlacement(Board.Builder builder, String piecePlacement) {
        String[] piecePlacementRows = piecePlacement.split("/", -1);
        if(piecePlacementRows.length != Board.SIZE) {
            throw new InvalidTokenException("FEN piece placement should have 8 ranks, got " + piecePlacementRows.length);
        }

        for(int row = 0; row < Board.SIZE; row++) {
            int column = 0;
            for(char character : piecePlacementRows[row].toCharArray()) {
                if(column >= Board.SIZE) {
                    throw new InvalidTokenException("FEN rank " + (Board.SIZE - row) + " is too long");
                }
                switch (character) {
                    case '1', '2', '3', '4', '5', '6', '7', '8' -> column += character - '0';
                    default -> {
                        PieceTypeAndColor pieceTypeAndColor = getPieceTypeAndColorFromFENLetter(character);
                        builder.piece(column, row, pieceTypeAndColor.color(), pieceTypeAndColor.pieceType());
                        column++;
                    }
                }
            }
            if(column != Board.SIZE) {
                throw new InvalidTokenException("FEN rank " + (Board.SIZE - row) + " should cover 8 squares, got " + column);
            }
        }
    }

    private static char getFENLetterFromPiece(PieceType pieceType, Color color) {
        return color == Color.WHITE ? Character.toUpperCase(pieceType.letter) : pieceType.letter;
    }

    private static PieceTypeAndColor getPieceTypeAndColorFromFENLetter(char letter) {
        PieceType pieceType = PieceType.fromLetter(Character.toLowerCase(letter));
        if(pieceType == null) {
            throw new InvalidTokenException("Unexpected fen letter " + letter);
        }
        Color color = Character.isUpperCase(letter) ? Color.WHITE : Color.BLACK;
        return new PieceTypeAndColor(pieceType, color);
    }
}
