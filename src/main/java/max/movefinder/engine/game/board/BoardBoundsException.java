package max.movefinder.engine.game.board;

/**
 * Thrown when a square outside of the 8x8 board is dereferenced.
 * Callers are expected to check {@link Board#isOnBoard(int, int)} first, so this always denotes a bug.
 */
public class BoardBoundsException extends IndexOutOfBoundsException {
    public BoardBoundsException(int column, int row) {
        super("Square (" + column + "," + row + ") is out of the board");
    }
}
