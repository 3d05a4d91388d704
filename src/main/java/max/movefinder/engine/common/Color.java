package max.movefinder.engine.common;

public enum Color {
    WHITE('w', -1, 6, 0),
    BLACK('b', 1, 1, 7);

    public final char code;
    // Row delta of a pawn step, rows are stored from rank 8 (row 0) down to rank 1 (row 7)
    public final int forwardRowStep;
    public final int pawnStartRow;
    public final int promotionRow;

    Color(char code, int forwardRowStep, int pawnStartRow, int promotionRow) {
        this.code = code;
        this.forwardRowStep = forwardRowStep;
        this.pawnStartRow = pawnStartRow;
        this.promotionRow = promotionRow;
    }

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    public static Color fromCode(char code) {
        return switch (code) {
            case 'w' -> WHITE;
            case 'b' -> BLACK;
            default -> null;
        };
    }
}
