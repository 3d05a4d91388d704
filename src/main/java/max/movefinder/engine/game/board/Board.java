package max.movefinder.engine.game.board;

import max.movefinder.engine.common.Color;
import max.movefinder.engine.common.PieceType;
import max.movefinder.engine.common.Position;
import max.movefinder.engine.game.board.utils.BoardUtils;

import java.util.Arrays;

/**
 * Read-only 8x8 board. Squares are encoded as bytes (see {@link BoardUtils}) and indexed by
 * {@code column + 8 * row}, row 0 being rank 8.
 * Use {@link Builder} to place pieces, a built board never changes.
 */
public final class Board {
    public static final int SIZE = 8;

    private final byte[] pieceAt;

    public Board(byte[] squares) {
        if(squares.length != SIZE * SIZE) {
            throw new IllegalArgumentException("A board has 64 squares, got " + squares.length);
        }
        this.pieceAt = squares.clone();
    }

    public static boolean isOnBoard(int column, int row) {
        return Position.isOnBoard(column, row);
    }

    public byte squareAt(int column, int row) {
        if(!isOnBoard(column, row)) {
            throw new BoardBoundsException(column, row);
        }
        return pieceAt[Position.getFlatIndex(column, row)];
    }

    public boolean isEmpty(int column, int row) {
        return BoardUtils.isEmptySquare(squareAt(column, row));
    }

    public PieceType pieceTypeAt(int column, int row) {
        return BoardUtils.getSquarePieceType(squareAt(column, row));
    }

    public Color colorAt(int column, int row) {
        return BoardUtils.getSquareColor(squareAt(column, row));
    }

    public byte[] generateSquares() {
        return pieceAt.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        if(!(obj instanceof Board other)) {
            return false;
        }
        return Arrays.equals(pieceAt, other.pieceAt);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(pieceAt);
    }

    public static final class Builder {
        private final byte[] squares = new byte[SIZE * SIZE];

        public Builder() {
            Arrays.fill(squares, BoardUtils.encodeEmptySquare());
        }

        public Builder piece(int column, int row, Color color, PieceType pieceType) {
            if(!isOnBoard(column, row)) {
                throw new BoardBoundsException(column, row);
            }
            squares[Position.getFlatIndex(column, row)] = BoardUtils.encodePiece(color, pieceType);
            return this;
        }

        public Board build() {
            return new Board(squares);
        }
    }
}
