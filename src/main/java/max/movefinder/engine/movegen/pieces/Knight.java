package max.movefinder.engine.movegen.pieces;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import max.movefinder.engine.game.Piece;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.movegen.Move;
import max.movefinder.engine.movegen.RayWalker;

import java.util.List;

public final class Knight {
    // {column step, row step}
    static final int[][] KNIGHT_JUMPS = {
            {-1, -2}, {1, -2},  // up 2 rows, left / right 1 column
            {2, -1}, {2, 1},    // right 2 columns, up / down 1 row
            {1, 2}, {-1, 2},    // down 2 rows, right / left 1 column
            {-2, 1}, {-2, -1}   // left 2 columns, down / up 1 row
    };

    private Knight() {}

    public static List<Move> getPseudoLegalMoves(Board board, Piece knight) {
        List<Move> moves = new ObjectArrayList<>(KNIGHT_JUMPS.length);
        for(int[] jump : KNIGHT_JUMPS) {
            RayWalker.walk(board, knight, jump[0], jump[1], 1, moves);
        }
        return moves;
    }
}
