package max.movefinder.engine.movegen.pieces;

import max.movefinder.engine.game.Piece;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.movegen.Direction;
import max.movefinder.engine.movegen.Move;

import java.util.List;

// No castling, and no check on whether the destination is attacked
public final class King {
    private King() {}

    public static List<Move> getPseudoLegalMoves(Board board, Piece king) {
        return Rook.slide(board, king, Direction.ALL, 1);
    }
}
