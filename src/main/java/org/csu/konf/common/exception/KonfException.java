package org.csu.konf.common.exception;

/**
 * @author hidyouth
 * @description: konf 流水线唯一的错误通道
 *
 * 所有阶段抛出的异常都继承自此类，调用方只需捕获这一种类型，
 * 再通过 {@link #getKind()} 区分出错的阶段。
 */
public abstract class KonfException extends RuntimeException {

    private final ErrorKind kind;
    private final int line;
    private final int column;

    protected KonfException(ErrorKind kind, String message, int line, int column) {
        super(message);
        this.kind = kind;
        this.line = line;
        this.column = column;
    }

    protected KonfException(ErrorKind kind, String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.line = line;
        this.column = column;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return 出错的行号 (从1开始)，没有位置信息时为 -1
     */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasPosition() {
        return line > 0;
    }
}
