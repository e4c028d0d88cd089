package work.robolab.sketch.board;

public final class UnknownBoardException extends RuntimeException {
    public UnknownBoardException(String boardId) {
        super("Unknown board '" + boardId + "'");
    }
}
