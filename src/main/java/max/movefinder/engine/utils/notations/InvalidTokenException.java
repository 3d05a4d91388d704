package max.movefinder.engine.utils.notations;

/**
 * Raised while reading user input (board grid, FEN, color, square) when a token can't be understood.
 */
public class InvalidTokenException extends IllegalArgumentException {
    public InvalidTokenException(String message) {
        super(message);
    }
}
