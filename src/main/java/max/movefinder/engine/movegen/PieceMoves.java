package max.movefinder.engine.movegen;

import max.movefinder.engine.game.Piece;

import java.util.List;

public record PieceMoves(Piece piece, List<Move> moves) {
    public PieceMoves {
        moves = List.copyOf(moves);
    }
}
