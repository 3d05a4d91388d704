package max.movefinder.engine.movegen.pieces;

import max.movefinder.engine.game.Piece;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.movegen.Direction;
import max.movefinder.engine.movegen.Move;
import max.movefinder.engine.movegen.RayWalker;

import java.util.List;

public final class Queen {
    private Queen() {}

    // Orthogonal rays first, then diagonals
    public static List<Move> getPseudoLegalMoves(Board board, Piece queen) {
        return Rook.slide(board, queen, Direction.ALL, RayWalker.MAX_DISTANCE);
    }
}
