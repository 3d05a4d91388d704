package max.movefinder.engine.movegen;

import java.util.List;

// Rows grow towards rank 1, so UP is a negative row step
public enum Direction {
    UP(0, -1),
    RIGHT(1, 0),
    DOWN(0, 1),
    LEFT(-1, 0),
    UP_RIGHT(1, -1),
    DOWN_RIGHT(1, 1),
    DOWN_LEFT(-1, 1),
    UP_LEFT(-1, -1);

    // Ray order of the sliding pieces, immutable since it fixes the report order
    public static final List<Direction> ORTHOGONALS = List.of(UP, RIGHT, DOWN, LEFT);
    public static final List<Direction> DIAGONALS = List.of(UP_RIGHT, DOWN_RIGHT, DOWN_LEFT, UP_LEFT);
    public static final List<Direction> ALL = List.of(UP, RIGHT, DOWN, LEFT, UP_RIGHT, DOWN_RIGHT, DOWN_LEFT, UP_LEFT);

    public final int columnStep;
    public final int rowStep;

    Direction(int columnStep, int rowStep) {
        this.columnStep = columnStep;
        this.rowStep = rowStep;
    }
}
