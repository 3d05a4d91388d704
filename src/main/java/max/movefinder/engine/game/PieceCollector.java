package max.movefinder.engine.game;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import max.movefinder.engine.common.Color;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.game.board.utils.BoardUtils;

import java.util.List;

public final class PieceCollector {
    private PieceCollector() {}

    // Most advanced rows first: black reads from rank 1 up, white from rank 8 down
    public static List<Piece> collect(Board board, Color color) {
        List<Piece> pieces = new ObjectArrayList<>(16);

        for(int i = 0; i < Board.SIZE; i++) {
            int row = color == Color.BLACK ? Board.SIZE - 1 - i : i;
            for(int column = 0; column < Board.SIZE; column++) {
                byte square = board.squareAt(column, row);
                if(BoardUtils.isOccupiedBy(square, color)) {
                    pieces.add(new Piece(color, BoardUtils.getSquarePieceType(square), column, row));
                }
            }
        }

        return pieces;
    }
}
