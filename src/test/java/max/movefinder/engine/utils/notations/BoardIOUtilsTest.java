package max.movefinder.engine.utils.notations;

import max.movefinder.engine.common.Color;
import max.movefinder.engine.common.PieceType;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.game.board.utils.BoardGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BoardIOUtilsTest {

    private static List<String> standardGridWithRow(int row, String replacement) {
        List<String> rows = new ArrayList<>(BoardGenerator.STANDARD_GRID);
        rows.set(row, replacement);
        return rows;
    }

    @Test
    public void standardGridShouldBeParsed() {
        // When
        Board board = BoardIOUtils.parseBoard(BoardGenerator.STANDARD_GRID);

        // Then
        assertEquals(PieceType.ROOK, board.pieceTypeAt(0, 0));
        assertEquals(Color.BLACK, board.colorAt(0, 0));
        assertEquals(PieceType.KNIGHT, board.pieceTypeAt(6, 7));
        assertEquals(Color.WHITE, board.colorAt(6, 7));
        for(int column = 0; column < 8; column++) {
            for(int row = 2; row < 6; row++) {
                assertTrue(board.isEmpty(column, row));
            }
        }
        assertEquals(String.join("\n", BoardGenerator.STANDARD_GRID) + "\n", BoardIOUtils.writeBoard(board));
    }

    @Test
    public void tokensMayBeSurroundedBySpaces() {
        // Given
        List<String> rows = standardGridWithRow(4, " x , x ,wq, x,x ,x,x,x");

        // When
        Board board = BoardIOUtils.parseBoard(rows);

        // Then
        assertEquals(PieceType.QUEEN, board.pieceTypeAt(2, 4));
    }

    @Test
    public void wrongRowCountShouldBeRejected() {
        List<String> rows = new ArrayList<>(BoardGenerator.STANDARD_GRID);
        rows.remove(3);

        InvalidTokenException exception = assertThrows(InvalidTokenException.class, () -> BoardIOUtils.parseBoard(rows));
        assertTrue(exception.getMessage().contains("8 rows"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"x,x,x,x,x,x,x", "x,x,x,x,x,x,x,x,x", "x,x,x,x,x,x,x,"})
    public void wrongColumnCountShouldBeRejected(String row) {
        assertThrows(InvalidTokenException.class, () -> BoardIOUtils.parseBoard(standardGridWithRow(3, row)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"wx", "gp", "WP", "wP", "bz", "w", "wpp", "X"})
    public void unknownTokensShouldBeRejected(String token) {
        // Given
        List<String> rows = standardGridWithRow(3, "x,x,x," + token + ",x,x,x,x");

        // Then
        InvalidTokenException exception = assertThrows(InvalidTokenException.class, () -> BoardIOUtils.parseBoard(rows));
        assertTrue(exception.getMessage().contains("row 4, column 4"), exception.getMessage());
    }

    @Test
    public void colorShouldBeParsed() {
        assertEquals(Color.WHITE, BoardIOUtils.parseColor("w"));
        assertEquals(Color.BLACK, BoardIOUtils.parseColor(" b "));
        assertThrows(InvalidTokenException.class, () -> BoardIOUtils.parseColor("white"));
        assertThrows(InvalidTokenException.class, () -> BoardIOUtils.parseColor("W"));
        assertThrows(InvalidTokenException.class, () -> BoardIOUtils.parseColor(""));
        assertThrows(InvalidTokenException.class, () -> BoardIOUtils.parseColor(null));
    }

    @Test
    public void labeledBoardShouldShowFilesAndRanks() {
        // When
        String[] lines = BoardIOUtils.labeledBoard(BoardGenerator.newStandardBoard()).split("\n");

        // Then
        assertEquals(9, lines.length);
        assertEquals("   a   b   c   d   e   f   g   h", lines[0]);
        assertEquals("8  br  bn  bb  bq  bk  bb  bn  br", lines[1]);
        assertEquals("5  x   x   x   x   x   x   x   x ", lines[4]);
        assertEquals("1  wr  wn  wb  wq  wk  wb  wn  wr", lines[8]);
    }
}
