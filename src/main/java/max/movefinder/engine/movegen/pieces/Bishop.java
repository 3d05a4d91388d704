package max.movefinder.engine.movegen.pieces;

import max.movefinder.engine.game.Piece;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.movegen.Direction;
import max.movefinder.engine.movegen.Move;
import max.movefinder.engine.movegen.RayWalker;

import java.util.List;

public final class Bishop {
    private Bishop() {}

    public static List<Move> getPseudoLegalMoves(Board board, Piece bishop) {
        return Rook.slide(board, bishop, Direction.DIAGONALS, RayWalker.MAX_DISTANCE);
    }
}
