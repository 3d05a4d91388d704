package max.movefinder.engine.common;

/**
 * A square of the board as (column, row). Column 0 is file a, row 0 is rank 8.
 * Only the 64 on-board positions exist, they are cached and shared.
 */
public final class Position {
    private final static Position[] POSITION_CACHE = new Position[64];
    static {
        for(int row = 0; row < 8; row++) {
            for(int column = 0; column < 8; column++) {
                Position position = new Position(column, row);
                POSITION_CACHE[position.flatIndex] = position;
            }
        }
    }

    public static boolean isOnBoard(int column, int row) {
        return column >= 0 && column < 8 && row >= 0 && row < 8;
    }

    // Returns null when the coordinates are out of the board
    public static Position of(int column, int row) {
        if(!isOnBoard(column, row)) {
            return null;
        }

        return POSITION_CACHE[getFlatIndex(column, row)];
    }

    public static int getFlatIndex(int column, int row) {
        return column + 8 * row;
    }

    public final int column;
    public final int row;
    public final int flatIndex;

    private Position(int column, int row) {
        this.column = column;
        this.row = row;
        this.flatIndex = getFlatIndex(column, row);
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this;
    }

    @Override
    public int hashCode() {
        return flatIndex;
    }

    @Override
    public String toString() {
        return "Position{" +
                "column=" + column +
                ", row=" + row +
                '}';
    }
}
