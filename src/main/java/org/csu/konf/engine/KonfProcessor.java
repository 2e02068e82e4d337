package org.csu.konf.engine;

import lombok.Getter;
import org.csu.konf.compiler.lexer.Lexer;
import org.csu.konf.compiler.lexer.Token;
import org.csu.konf.compiler.normalizer.AstNormalizer;
import org.csu.konf.compiler.parser.ParseNode;
import org.csu.konf.compiler.parser.Parser;
import org.csu.konf.compiler.parser.ast.Program;
import org.csu.konf.common.model.ConfigValue;

import java.util.List;

/**
 * @author hidyouth
 * @description: konf 流水线入口
 *
 * 源文本 -> Token -> 语法分析树 -> 语义树 -> 求值结果 -> JSON。
 * 构造后无状态，可以共享；每次 {@link #evaluate(String)} 都使用新的 {@link Environment}。
 * 任何阶段的 {@link org.csu.konf.common.exception.KonfException} 都直接抛给调用方，不返回部分结果。
 */
public class KonfProcessor {

    @Getter
    private final KonfOptions options;
    private final AstNormalizer normalizer;
    private final JsonSerializer serializer;

    public KonfProcessor() {
        this(KonfOptions.defaults());
    }

    public KonfProcessor(KonfOptions options) {
        this.options = options;
        this.normalizer = new AstNormalizer();
        this.serializer = new JsonSerializer(options.isPrettyPrint());
    }

    /**
     * 词法分析、语法分析和规范化，不求值。
     */
    public Program compile(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        trace("Tokens: " + tokens);

        ParseNode tree = new Parser(tokens, options.getMaxNestingDepth()).parse();
        trace("Parse tree:\n" + tree.toTreeString());

        Program program = normalizer.normalize(tree);
        trace("AST: " + program);
        return program;
    }

    public EvaluationResult evaluate(String source) {
        return evaluate(source, new Environment());
    }

    /**
     * 在调用方提供的环境中求值，之前绑定的常量对本次求值可见。
     */
    public EvaluationResult evaluate(String source, Environment environment) {
        Program program = compile(source);
        List<ConfigValue> values = new Evaluator(environment).evaluate(program);
        trace("Environment: " + environment);
        return new EvaluationResult(values, environment);
    }

    /**
     * 完整执行一次流水线。
     * @return 序列化后的 JSON 文本
     */
    public String execute(String source) {
        return serialize(evaluate(source).values());
    }

    public String serialize(List<ConfigValue> values) {
        return serializer.serialize(values);
    }

    private void trace(String message) {
        if (options.isTrace()) {
            options.getTraceOut().println("[TRACE] " + message);
        }
    }
}
