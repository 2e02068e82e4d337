package org.csu.konf.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 求值后的记录，保持键的插入顺序。
 * 重复的键保留第一次出现的位置，值为最后一次求值的结果。
 */
public final class RecordValue implements ConfigValue {

    private final Map<String, ConfigValue> entries;

    public RecordValue(LinkedHashMap<String, ConfigValue> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public Map<String, ConfigValue> getEntries() {
        return entries;
    }

    public ConfigValue get(String key) {
        return entries.get(key);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordValue that = (RecordValue) o;
        // 顺序也是值的一部分
        return entries.equals(that.entries)
                && entries.keySet().stream().toList().equals(that.entries.keySet().stream().toList());
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
