package max.movefinder.engine.movegen.pieces;

import max.movefinder.engine.common.Color;
import max.movefinder.engine.common.PieceType;
import max.movefinder.engine.game.Piece;
import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.game.board.utils.BoardGenerator;
import max.movefinder.engine.movegen.Move;
import max.movefinder.engine.movegen.MoveTestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PawnTest {

    private static List<String> pawnMoves(Board board, int column, int row) {
        return MoveTestUtils.write(Pawn.getPseudoLegalMoves(board, Piece.at(board, column, row)));
    }

    @Test
    public void whitePawnShouldDoubleStepFromStartRow() {
        // Given
        Board board = BoardGenerator.newStandardBoard();

        // When
        List<Move> moves = Pawn.getPseudoLegalMoves(board, Piece.at(board, 0, 6));

        // Then
        assertEquals(List.of(Move.quiet(0, 5), Move.quiet(0, 4)), moves);
    }

    @Test
    public void blackPawnShouldNotDoubleStepOntoOccupiedSquare() {
        // Given
        // Black pawn on d7, white knight on d5
        Board board = new Board.Builder()
                .piece(3, 1, Color.BLACK, PieceType.PAWN)
                .piece(3, 3, Color.WHITE, PieceType.KNIGHT)
                .build();

        // Then
        assertEquals(List.of("d6"), pawnMoves(board, 3, 1));
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    public void pawnShouldBeBlockedByAnyPieceInFront(boolean enemyBlocker) {
        // Given
        Color blockerColor = enemyBlocker ? Color.BLACK : Color.WHITE;
        Board board = new Board.Builder()
                .piece(4, 6, Color.WHITE, PieceType.PAWN)
                .piece(4, 5, blockerColor, PieceType.BISHOP)
                .build();

        // Then
        assertTrue(pawnMoves(board, 4, 6).isEmpty());
    }

    @Test
    public void pawnShouldSingleStepOutsideStartRow() {
        // Given
        Board board = new Board.Builder()
                .piece(2, 4, Color.WHITE, PieceType.PAWN)
                .piece(5, 5, Color.BLACK, PieceType.PAWN)
                .build();

        // Then
        assertEquals(List.of("c5"), pawnMoves(board, 2, 4));
        assertEquals(List.of("f2"), pawnMoves(board, 5, 5));
    }

    @Test
    public void pawnShouldOnlyMoveDiagonallyToCapture() {
        // Given
        // White pawn on e4, black knight on f5, white bishop on d5, black rook on e5
        Board board = new Board.Builder()
                .piece(4, 4, Color.WHITE, PieceType.PAWN)
                .piece(5, 3, Color.BLACK, PieceType.KNIGHT)
                .piece(3, 3, Color.WHITE, PieceType.BISHOP)
                .piece(4, 3, Color.BLACK, PieceType.ROOK)
                .build();

        // Then
        assertEquals(List.of("f5 (Capture Knight)"), pawnMoves(board, 4, 4));
    }

    @Test
    public void pawnCapturesShouldComeAfterPushes() {
        // Given
        Board board = new Board.Builder()
                .piece(3, 1, Color.BLACK, PieceType.PAWN)
                .piece(2, 2, Color.WHITE, PieceType.QUEEN)
                .piece(4, 2, Color.WHITE, PieceType.PAWN)
                .build();

        // Then
        assertEquals(List.of("d6", "d5", "e6 (Capture Pawn)", "c6 (Capture Queen)"), pawnMoves(board, 3, 1));
    }

    @Test
    public void whitePawnShouldPromoteOnRank8() {
        // Given
        Board board = new Board.Builder()
                .piece(0, 1, Color.WHITE, PieceType.PAWN)
                .piece(1, 0, Color.BLACK, PieceType.ROOK)
                .build();

        // When
        List<Move> moves = Pawn.getPseudoLegalMoves(board, Piece.at(board, 0, 1));

        // Then
        assertEquals(List.of(new Move(0, 0, null, true), new Move(1, 0, PieceType.ROOK, true)), moves);
        assertEquals(List.of("Promote on a8", "Promote on b8 (Capture Rook)"), MoveTestUtils.write(moves));
    }

    @Test
    public void blackPawnShouldPromoteOnRank1() {
        // Given
        Board board = new Board.Builder()
                .piece(4, 6, Color.BLACK, PieceType.PAWN)
                .piece(5, 7, Color.WHITE, PieceType.KNIGHT)
                .build();

        // Then
        assertEquals(List.of("Promote on e1", "Promote on f1 (Capture Knight)"), pawnMoves(board, 4, 6));
    }

    @Test
    public void pawnShouldNotPromoteBeforeLastRow() {
        // Given
        Board board = new Board.Builder().piece(6, 6, Color.BLACK, PieceType.PAWN).build();

        // When
        List<Move> moves = Pawn.getPseudoLegalMoves(board, Piece.at(board, 6, 6));

        // Then
        assertEquals(1, moves.size());
        assertTrue(moves.get(0).promotion());

        Board earlier = new Board.Builder().piece(6, 5, Color.BLACK, PieceType.PAWN).build();
        assertFalse(Pawn.getPseudoLegalMoves(earlier, Piece.at(earlier, 6, 5)).get(0).promotion());
    }
}
