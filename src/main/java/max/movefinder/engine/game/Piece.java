package max.movefinder.engine.game;

import max.movefinder.engine.common.Color;
import max.movefinder.engine.common.PieceType;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.game.board.BoardBoundsException;
import max.movefinder.engine.game.board.utils.BoardUtils;

/**
 * A piece standing on a given square. Plain data, its moves are computed by
 * {@link max.movefinder.engine.movegen.MoveGenerator}.
 */
public record Piece(Color color, PieceType pieceType, int column, int row) {
    public Piece {
        if(color == null || pieceType == null) {
            throw new IllegalArgumentException("Piece needs a color and a type");
        }
        if(!Board.isOnBoard(column, row)) {
            throw new BoardBoundsException(column, row);
        }
    }

    /**
     * Reads the piece standing at (column, row) on the board.
     * @throws IllegalStateException if the square is empty
     */
    public static Piece at(Board board, int column, int row) {
        byte square = board.squareAt(column, row);
        if(BoardUtils.isEmptySquare(square)) {
            throw new IllegalStateException("No piece at (" + column + "," + row + ")");
        }
        return new Piece(BoardUtils.getSquareColor(square), BoardUtils.getSquarePieceType(square), column, row);
    }

    public boolean isOn(Board board) {
        byte square = board.squareAt(column, row);
        return BoardUtils.isOccupiedBy(square, color) && BoardUtils.getSquarePieceType(square) == pieceType;
    }
}
