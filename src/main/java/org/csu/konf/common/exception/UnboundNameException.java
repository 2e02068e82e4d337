package org.csu.konf.common.exception;

/**
 * @author hidyouth
 * @description: 求值阶段的异常，引用的常量在求值顺序上还没有被声明
 */
public class UnboundNameException extends KonfException {

    private final String name;

    public UnboundNameException(String name, int line, int column) {
        super(ErrorKind.UNBOUND_NAME,
                String.format("Unbound Name Error at line %d, column %d: constant '%s' is not declared before this reference",
                        line, column, name),
                line, column);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
