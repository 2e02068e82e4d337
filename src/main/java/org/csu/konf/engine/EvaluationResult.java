package org.csu.konf.engine;

import org.csu.konf.common.model.ConfigValue;

import java.util.List;

/**
 * 一次求值的结果。
 *
 * @param values      与顶层值一一对应的求值结果
 * @param environment 求值结束时的常量环境
 */
public record EvaluationResult(List<ConfigValue> values, Environment environment) {

    public EvaluationResult {
        values = List.copyOf(values);
    }
}
