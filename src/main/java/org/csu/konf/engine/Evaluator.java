package org.csu.konf.engine;

import org.csu.konf.common.exception.UnboundNameException;
import org.csu.konf.common.model.ConfigValue;
import org.csu.konf.common.model.DeclarationValue;
import org.csu.konf.common.model.NumberValue;
import org.csu.konf.common.model.RecordValue;
import org.csu.konf.compiler.parser.ast.ConfigNode;
import org.csu.konf.compiler.parser.ast.ConstDeclNode;
import org.csu.konf.compiler.parser.ast.NodeVisitor;
import org.csu.konf.compiler.parser.ast.NumberNode;
import org.csu.konf.compiler.parser.ast.Program;
import org.csu.konf.compiler.parser.ast.RecordEntry;
import org.csu.konf.compiler.parser.ast.RecordNode;
import org.csu.konf.compiler.parser.ast.ReferenceNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * 求值器。
 * 严格从左到右单遍遍历语义树，每个子节点 (连同它的常量声明副作用) 求值完毕后才开始下一个。
 * 引用只查全局环境，不查所在记录的键；在求值顺序上先声明后使用。
 */
public class Evaluator implements NodeVisitor<ConfigValue> {

    private final Environment environment;

    public Evaluator(Environment environment) {
        this.environment = environment;
    }

    /**
     * 依次求值程序的顶层值。
     * @return 与顶层值一一对应的求值结果
     * @throws UnboundNameException 引用了尚未声明的常量，整个求值中止
     */
    public List<ConfigValue> evaluate(Program program) {
        List<ConfigValue> results = new ArrayList<>();
        for (ConfigNode node : program.values()) {
            results.add(evaluate(node));
        }
        return results;
    }

    public ConfigValue evaluate(ConfigNode node) {
        return node.accept(this);
    }

    @Override
    public ConfigValue visitNumber(NumberNode node) {
        return new NumberValue(node.value());
    }

    @Override
    public ConfigValue visitRecord(RecordNode node) {
        LinkedHashMap<String, ConfigValue> entries = new LinkedHashMap<>();
        for (RecordEntry entry : node.entries()) {
            // 重复的键也要求值 (副作用生效)，只保留最后一个值
            entries.put(entry.key(), evaluate(entry.value()));
        }
        return new RecordValue(entries);
    }

    @Override
    public ConfigValue visitConstDecl(ConstDeclNode node) {
        ConfigValue value = evaluate(node.value());
        environment.define(node.name(), value);
        return new DeclarationValue(node.name(), value);
    }

    @Override
    public ConfigValue visitReference(ReferenceNode node) {
        return environment.lookup(node.name())
                .orElseThrow(() -> new UnboundNameException(node.name(), node.line(), node.column()));
    }
}
