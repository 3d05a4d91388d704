package max.movefinder.engine.game.board.utils;

import max.movefinder.engine.game.board.Board;
import max.movefinder.engine.utils.notations.BoardIOUtils;
import max.movefinder.engine.utils.notations.FENUtils;

import java.util.List;

public class BoardGenerator {
    public static final String STANDARD_GAME = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";
    public static final List<String> STANDARD_GRID = List.of(
            "br,bn,bb,bq,bk,bb,bn,br",
            "bp,bp,bp,bp,bp,bp,bp,bp",
            "x,x,x,x,x,x,x,x",
            "x,x,x,x,x,x,x,x",
            "x,x,x,x,x,x,x,x",
            "x,x,x,x,x,x,x,x",
            "wp,wp,wp,wp,wp,wp,wp,wp",
            "wr,wn,wb,wq,wk,wb,wn,wr");

    public static Board newStandardBoard() {
        return BoardIOUtils.parseBoard(STANDARD_GRID);
    }

    public static Board newEmptyBoard() {
        return new Board.Builder().build();
    }

    public static Board from(String FEN) {
        return FENUtils.getBoardFrom(FEN);
    }
}
