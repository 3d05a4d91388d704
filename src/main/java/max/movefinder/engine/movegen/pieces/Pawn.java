package max.movefinder.engine.movegen.pieces;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import max.movefinder.engine.common.Color;
import max.movefinder.engine.game.Piece;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.movegen.Move;
import max.movefinder.engine.movegen.RayWalker;

import java.util.List;

public final class Pawn {
    private Pawn() {}

    public static List<Move> getPseudoLegalMoves(Board board, Piece pawn) {
        Color color = pawn.color();
        int forward = color.forwardRowStep;
        int maxDistance = pawn.row() == color.pawnStartRow ? 2 : 1;

        List<Move> moves = new ObjectArrayList<>(4);

        // Pushes never capture: the walk stops on the first occupant and we drop it if it's an enemy
        for(Move move : RayWalker.walk(board, pawn, 0, forward, maxDistance)) {
            if(!move.isCapture()) {
                moves.add(move);
            }
        }

        // Diagonals are capture only
        for(Move move : RayWalker.walk(board, pawn, 1, forward, 1)) {
            if(move.isCapture()) {
                moves.add(move);
            }
        }
        for(Move move : RayWalker.walk(board, pawn, -1, forward, 1)) {
            if(move.isCapture()) {
                moves.add(move);
            }
        }

        for(int i = 0; i < moves.size(); i++) {
            Move move = moves.get(i);
            if(move.targetRow() == color.promotionRow) {
                moves.set(i, move.asPromotion());
            }
        }

        return moves;
    }
}
