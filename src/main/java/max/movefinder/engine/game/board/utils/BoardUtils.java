package max.movefinder.engine.game.board.utils;

import max.movefinder.engine.common.Color;
import max.movefinder.engine.common.PieceType;

/**
 * One byte per square: bit 0 set when occupied, bit 1 set for black, bits 2-4 hold the piece type
 * ({@code ordinal + 1}). An empty square is 0.
 */
public class BoardUtils {
    private static final int OCCUPIED_BIT = 0b00001;
    private static final int BLACK_BIT = 0b00010;
    private static final int PIECE_TYPE_SHIFT = 2;
    private static final int PIECE_TYPE_MASK = 0b111 << PIECE_TYPE_SHIFT;

    public static byte encodePiece(Color color, PieceType pieceType) {
        int colorBit = color == Color.BLACK ? BLACK_BIT : 0;
        return (byte) (OCCUPIED_BIT | colorBit | (pieceType.ordinal() + 1) << PIECE_TYPE_SHIFT);
    }

    public static byte encodeEmptySquare() {
        return 0;
    }

    public static boolean isEmptySquare(byte square) {
        return (square & OCCUPIED_BIT) == 0;
    }

    public static PieceType getSquarePieceType(byte square) {
        if(isEmptySquare(square)) {
            throw new IllegalStateException("Empty square has no piece type");
        }

        int pieceTypeCode = ((square & PIECE_TYPE_MASK) >> PIECE_TYPE_SHIFT) - 1;
        if(pieceTypeCode < 0 || pieceTypeCode >= PieceType.VALUES.length) {
            throw new IllegalStateException("Unexpected value: " + square);
        }
        return PieceType.VALUES[pieceTypeCode];
    }

    public static Color getSquareColor(byte square) {
        if(isEmptySquare(square)) {
            throw new IllegalStateException("Empty square has no color");
        }

        return (square & BLACK_BIT) != 0 ? Color.BLACK : Color.WHITE;
    }

    public static boolean isOccupiedBy(byte square, Color color) {
        return !isEmptySquare(square) && getSquareColor(square) == color;
    }
}
