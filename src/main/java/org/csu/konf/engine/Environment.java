package org.csu.konf.engine;

import org.csu.konf.common.model.ConfigValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * @author hidyouth
 * @description: 常量环境
 *
 * 常量名到已求值结果的映射。每次运行一个实例，由常量声明原地修改，
 * 同名声明覆盖之前的绑定。不同的求值之间不共享，也不是线程安全的。
 */
public class Environment {

    private final Map<String, ConfigValue> bindings = new LinkedHashMap<>();

    /**
     * 绑定常量，覆盖之前同名的绑定。
     */
    public void define(String name, ConfigValue value) {
        bindings.put(name, value);
    }

    public Optional<ConfigValue> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    public boolean isDefined(String name) {
        return bindings.containsKey(name);
    }

    /**
     * @return 按首次声明顺序排列的常量名
     */
    public List<String> names() {
        return List.copyOf(bindings.keySet());
    }

    public Map<String, ConfigValue> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public int size() {
        return bindings.size();
    }

    @Override
    public String toString() {
        return "Environment" + bindings;
    }
}
