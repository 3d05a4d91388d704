package max.movefinder.engine.movegen;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import max.movefinder.engine.game.Piece;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.game.board.utils.BoardUtils;

import java.util.List;

/**
 * Walks a ray from a piece, one step at a time, until the board edge, the step limit or the first occupied square.
 * An enemy piece ends the ray with a capture, a friendly piece ends it without a move.
 */
public final class RayWalker {
    public static final int MAX_DISTANCE = 7;

    private RayWalker() {}

    public static List<Move> walk(Board board, Piece origin, Direction direction, int maxSteps) {
        return walk(board, origin, direction.columnStep, direction.rowStep, maxSteps);
    }

    public static List<Move> walk(Board board, Piece origin, int columnStep, int rowStep, int maxSteps) {
        List<Move> moves = new ObjectArrayList<>(MAX_DISTANCE);
        walk(board, origin, columnStep, rowStep, maxSteps, moves);
        return moves;
    }

    // Appends to an existing buffer, moves are added by increasing distance
    public static void walk(Board board, Piece origin, int columnStep, int rowStep, int maxSteps, List<Move> moves) {
        int column = origin.column();
        int row = origin.row();

        for(int step = 0; step < maxSteps; step++) {
            column += columnStep;
            row += rowStep;
            if(!Board.isOnBoard(column, row)) {
                return;
            }

            byte square = board.squareAt(column, row);
            if(BoardUtils.isEmptySquare(square)) {
                moves.add(Move.quiet(column, row));
                continue;
            }

            if(BoardUtils.getSquareColor(square) != origin.color()) {
                moves.add(Move.capture(column, row, BoardUtils.getSquarePieceType(square)));
            }
            return;
        }
    }
}
