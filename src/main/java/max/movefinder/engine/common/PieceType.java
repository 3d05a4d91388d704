package max.movefinder.engine.common;

public enum PieceType {
    PAWN('p', "Pawn"),
    KNIGHT('n', "Knight"),
    BISHOP('b', "Bishop"),
    ROOK('r', "Rook"),
    QUEEN('q', "Queen"),
    KING('k', "King");

    public static final PieceType[] VALUES = PieceType.values();

    public final char letter;
    public final String displayName;

    PieceType(char letter, String displayName) {
        this.letter = letter;
        this.displayName = displayName;
    }

    public static PieceType fromLetter(char letter) {
        return switch (letter) {
            case 'p' -> PAWN;
            case 'n' -> KNIGHT;
            case 'b' -> BISHOP;
            case 'r' -> ROOK;
            case 'q' -> QUEEN;
            case 'k' -> KING;
            default -> null;
        };
    }
}
