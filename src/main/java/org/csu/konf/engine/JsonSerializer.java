package org.csu.konf.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.csu.konf.common.model.ConfigValue;
import org.csu.konf.common.model.DeclarationValue;
import org.csu.konf.common.model.NumberValue;
import org.csu.konf.common.model.RecordValue;

import java.util.List;
import java.util.Map;

/**
 * 把求值结果渲染为 JSON：数值为 JSON 数字，记录为保持插入顺序的对象，
 * 常量声明为两个元素的数组 ["name", value]。
 *
 * 输出只是值的转储，不能再作为 konf 源码解析。
 */
public class JsonSerializer {

    private final ObjectMapper mapper;

    public JsonSerializer() {
        this(false);
    }

    public JsonSerializer(boolean prettyPrint) {
        JsonMapper.Builder builder = JsonMapper.builder();
        if (prettyPrint) {
            builder.enable(SerializationFeature.INDENT_OUTPUT);
        }
        this.mapper = builder.build();
    }

    public String serialize(List<ConfigValue> values) {
        try {
            return mapper.writeValueAsString(toTree(values));
        } catch (JsonProcessingException e) {
            // 树全部由 Jackson 自己的节点构成，写入 String 不应失败
            throw new IllegalStateException("Failed to serialize evaluated values", e);
        }
    }

    public ArrayNode toTree(List<ConfigValue> values) {
        ArrayNode array = mapper.createArrayNode();
        for (ConfigValue value : values) {
            array.add(toTree(value));
        }
        return array;
    }

    public JsonNode toTree(ConfigValue value) {
        if (value instanceof NumberValue number) {
            return mapper.getNodeFactory().numberNode(number.value());
        }
        if (value instanceof RecordValue record) {
            ObjectNode object = mapper.createObjectNode();
            for (Map.Entry<String, ConfigValue> entry : record.getEntries().entrySet()) {
                object.set(entry.getKey(), toTree(entry.getValue()));
            }
            return object;
        }
        if (value instanceof DeclarationValue declaration) {
            ArrayNode pair = mapper.createArrayNode();
            pair.add(declaration.name());
            pair.add(toTree(declaration.value()));
            return pair;
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getSimpleName());
    }
}
