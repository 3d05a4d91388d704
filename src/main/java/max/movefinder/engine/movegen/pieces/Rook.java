package max.movefinder.engine.movegen.pieces;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import max.movefinder.engine.game.Piece;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.movegen.Direction;
import max.movefinder.engine.movegen.Move;
import max.movefinder.engine.movegen.RayWalker;

import java.util.List;

public final class Rook {
    private Rook() {}

    public static List<Move> getPseudoLegalMoves(Board board, Piece rook) {
        return slide(board, rook, Direction.ORTHOGONALS, RayWalker.MAX_DISTANCE);
    }

    // Shared by every piece moving along rays
    static List<Move> slide(Board board, Piece piece, List<Direction> directions, int maxDistance) {
        List<Move> moves = new ObjectArrayList<>();
        for(Direction direction : directions) {
            RayWalker.walk(board, piece, direction.columnStep, direction.rowStep, maxDistance, moves);
        }
        return moves;
    }
}
