package org.csu.konf.common.model;

/**
 * 常量声明求值的结果，序列化为两个元素的数组 {@code ["name", value]}。
 *
 * @param name  常量名
 * @param value 求值后绑定的值
 */
public record DeclarationValue(String name, ConfigValue value) implements ConfigValue {

    @Override
    public String toString() {
        return "[" + name + ", " + value + "]";
    }
}
