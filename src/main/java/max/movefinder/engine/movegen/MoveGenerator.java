package max.movefinder.engine.movegen;

import max.movefinder.engine.common.Color;
import max.movefinder.engine.game.Piece;
import max.movefinder.engine.game.PieceCollector;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.movegen.pieces.Bishop;
import max.movefinder.engine.movegen.pieces.King;
import max.movefinder.engine.movegen.pieces.Knight;
import max.movefinder.engine.movegen.pieces.Pawn;
import max.movefinder.engine.movegen.pieces.Queen;
import max.movefinder.engine.movegen.pieces.Rook;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Pseudo-legal move generation: moves follow each piece's movement pattern, blockers and captures,
 * but checks, pins, castling and en passant are ignored.
 */
public final class MoveGenerator {
    private MoveGenerator() {}

    /**
     * @throws IllegalStateException if the piece doesn't stand on the board at its square
     */
    public static List<Move> generateMoves(Board board, Piece piece) {
        if(!piece.isOn(board)) {
            throw new IllegalStateException(piece + " is not on the board");
        }
        return switch (piece.pieceType()) {
            case PAWN -> Pawn.getPseudoLegalMoves(board, piece);
            case KNIGHT -> Knight.getPseudoLegalMoves(board, piece);
            case BISHOP -> Bishop.getPseudoLegalMoves(board, piece);
            case ROOK -> Rook.getPseudoLegalMoves(board, piece);
            case QUEEN -> Queen.getPseudoLegalMoves(board, piece);
            case KING -> King.getPseudoLegalMoves(board, piece);
        };
    }

    public static List<PieceMoves> generateMoves(Board board, Color side) {
        return generateMoves(board, side, false);
    }

    /**
     * Generates the moves of every piece of {@code side}, in {@link PieceCollector} order.
     * Pieces are independent so they can be processed in parallel, the result order is the same either way.
     */
    public static List<PieceMoves> generateMoves(Board board, Color side, boolean parallel) {
        List<Piece> pieces = PieceCollector.collect(board, side);
        if(parallel) {
            return pieces.parallelStream()
                    .map(piece -> new PieceMoves(piece, generateMoves(board, piece)))
                    .collect(Collectors.toUnmodifiableList());
        }

        return pieces.stream()
                .map(piece -> new PieceMoves(piece, generateMoves(board, piece)))
                .collect(Collectors.toUnmodifiableList());
    }

    public static int countMoves(List<PieceMoves> pieceMoves) {
        int count = 0;
        for(PieceMoves moves : pieceMoves) {
            count += moves.moves().size();
        }
        return count;
    }
}
