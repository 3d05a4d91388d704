package max.movefinder.engine.movegen;

import max.movefinder.engine.common.PieceType;
import max.movefinder.engine.utils.notations.MoveIOUtils;

import java.util.Optional;

/**
 * Pseudo-legal destination of a piece.
 * @param capturedPiece type of the enemy piece on the target square, null for a quiet move
 * @param promotion only set for a pawn reaching its promotion row
 */
public record Move(int targetColumn, int targetRow, PieceType capturedPiece, boolean promotion) {

    public static Move quiet(int targetColumn, int targetRow) {
        return new Move(targetColumn, targetRow, null, false);
    }

    public static Move capture(int targetColumn, int targetRow, PieceType capturedPiece) {
        return new Move(targetColumn, targetRow, capturedPiece, false);
    }

    public boolean isCapture() {
        return capturedPiece != null;
    }

    public Optional<PieceType> getCapturedPiece() {
        return Optional.ofNullable(capturedPiece);
    }

    public Move asPromotion() {
        return promotion ? this : new Move(targetColumn, targetRow, capturedPiece, true);
    }

    @Override
    public String toString() {
        return MoveIOUtils.writeMove(this);
    }
}
