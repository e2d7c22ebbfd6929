package org.featuretree.parse;

import org.featuretree.model.FeatureNode;
import org.featuretree.model.FeatureReference;
import org.featuretree.model.FeatureTree;
import org.featuretree.model.FeatureType;
import org.featuretree.model.Parameter;
import org.featuretree.script.Expr;
import org.featuretree.script.ExprPrinter;
import org.featuretree.script.ScriptModule;
import org.featuretree.script.ScriptParser;
import org.featuretree.script.ScriptSyntaxException;
import org.featuretree.script.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 脚本 -> 特征树。
 * <p>
 * 处理流程：
 * <ol>
 *   <li>语法分析（语法错误抛出 {@link ScriptParseException}）。</li>
 *   <li>{@link VariableResolver} 解析顶层变量，得到 {@link ResolvedVariables}。</li>
 *   <li>按源码顺序遍历所有赋值语句（包括嵌套代码块），把 {@code x = <方法链>} 分解成有序调用；
 *       映射表内的每个调用生成一个节点，表外调用直接丢弃。</li>
 * </ol>
 * 节点的第一个父引用是同一条链中的上一个节点；链的第一个节点以链起点变量所绑定的节点为父。
 * 实参中引用了其他节点的变量会成为 {@code SOLID} 结构引用，永远不会被当成数值。
 * <p>
 * 语义上奇怪的脚本不会报错，尽力建树，交给后续校验。
 */
public class FeatureTreeParser {

    private static final Logger log = LoggerFactory.getLogger(FeatureTreeParser.class);

    static final String SELECTOR_PARAMETER = "selector";

    private final VariableResolver variableResolver;

    public FeatureTreeParser() {
        this(new VariableResolver());
    }

    public FeatureTreeParser(VariableResolver variableResolver) {
        this.variableResolver = variableResolver;
    }

    /**
     * 解析脚本并构建特征树（版本号为 1）。
     *
     * @throws ScriptParseException 脚本存在语法错误
     */
    public FeatureTree parse(String script, String projectId, String createdBy) {
        ScriptModule module;
        try {
            module = ScriptParser.parse(script);
        } catch (ScriptSyntaxException e) {
            throw new ScriptParseException(e, script);
        }
        ResolvedVariables variables = variableResolver.resolve(module);

        FeatureTree tree = new FeatureTree(projectId, 1, createdBy);
        tree.setSourceScript(script);
        Map<String, String> bindings = new HashMap<>();
        for (Stmt stmt : module.allStatements()) {
            if (stmt instanceof Stmt.Assign assign) {
                handleAssignment(tree, variables, bindings, assign.targets(), assign.value());
            } else if (stmt instanceof Stmt.AnnAssign annAssign && annAssign.value() != null) {
                handleAssignment(tree, variables, bindings, List.of(annAssign.target()), annAssign.value());
            } else if (stmt instanceof Stmt.ExprStmt exprStmt) {
                buildChain(tree, variables, bindings, null, exprStmt.value());
            }
        }
        log.debug("脚本解析完成：项目 {}，变量 {} 个，节点 {} 个", projectId, variables.size(), tree.getNodes().size());
        return tree;
    }

    private void handleAssignment(FeatureTree tree, ResolvedVariables variables, Map<String, String> bindings,
                                  List<Expr> targets, Expr value) {
        String variable = firstName(targets);
        Optional<String> lastNodeId = buildChain(tree, variables, bindings, variable, value);
        String aliased = value instanceof Expr.Name name ? bindings.get(name.id()) : null;
        for (Expr target : targets) {
            if (!(target instanceof Expr.Name name)) {
                continue;
            }
            if (lastNodeId.isPresent()) {
                bindings.put(name.id(), lastNodeId.get());
            } else if (aliased != null) {
                bindings.put(name.id(), aliased);
            } else {
                // 重新赋值为非几何值
                bindings.remove(name.id());
            }
        }
    }

    /**
     * 为一条方法链创建节点。
     *
     * @return 链中最后一个节点的 id；链中没有映射表内的调用时为空
     */
    private Optional<String> buildChain(FeatureTree tree, ResolvedVariables variables, Map<String, String> bindings,
                                        String variable, Expr value) {
        Optional<CallChain> chain = CallChain.of(value);
        if (chain.isEmpty()) {
            return Optional.empty();
        }
        String parentId = chain.get().rootName().map(bindings::get).orElse(null);
        String pendingSelector = null;
        String lastId = null;
        int index = 0;
        for (CallChain.Link link : chain.get().links()) {
            Optional<FeatureType> type = CadQueryCalls.featureTypeOf(link.method());
            if (type.isEmpty()) {
                pendingSelector = selectorOf(link);
                continue;
            }
            FeatureType featureType = type.get();
            List<Parameter> parameters = new ArrayList<>();
            List<FeatureReference> references = new ArrayList<>();
            if (parentId != null) {
                references.add(FeatureReference.feature(parentId));
            }
            convertArguments(link.call(), variables, bindings, parameters, references);
            if (pendingSelector != null && acceptsSelector(featureType)) {
                parameters.add(Parameter.of(SELECTOR_PARAMETER, pendingSelector));
            }
            pendingSelector = null;

            String name = variable == null ? featureType.value()
                    : index == 0 ? variable : variable + "_" + index;
            FeatureNode node = new FeatureNode(null, name, featureType, null, parameters, references, null,
                    ExprPrinter.printCallFragment(link.method(), link.call()), link.method(), true, null);
            tree.addNode(node, null);
            parentId = node.id();
            lastId = node.id();
            index++;
        }
        return Optional.ofNullable(lastId);
    }

    private void convertArguments(Expr.Call call, ResolvedVariables variables, Map<String, String> bindings,
                                  List<Parameter> parameters, List<FeatureReference> references) {
        List<Expr> args = call.args();
        for (int i = 0; i < args.size(); i++) {
            Expr arg = args.get(i);
            if (arg instanceof Expr.Starred) {
                log.debug("忽略星号实参：{}", ExprPrinter.print(arg));
                continue;
            }
            String referenced = referencedNode(arg, bindings);
            if (referenced != null) {
                addReference(references, referenced);
            } else {
                parameters.add(toParameter("arg_" + i, arg, variables));
            }
        }
        for (Expr.Keyword keyword : call.keywords()) {
            if (keyword.name() == null) {
                continue;
            }
            String referenced = referencedNode(keyword.value(), bindings);
            if (referenced != null) {
                addReference(references, referenced);
            } else {
                parameters.add(toParameter(keyword.name(), keyword.value(), variables));
            }
        }
    }

    private static void addReference(List<FeatureReference> references, String nodeId) {
        for (FeatureReference existing : references) {
            if (existing.targetNodeId().equals(nodeId)) {
                return;
            }
        }
        references.add(FeatureReference.solid(nodeId));
    }

    /** 实参是否引用了某个节点：绑定到节点的变量名，或以这样的变量为起点的方法链。 */
    private static String referencedNode(Expr arg, Map<String, String> bindings) {
        if (arg instanceof Expr.Name name) {
            return bindings.get(name.id());
        }
        if (arg instanceof Expr.Call) {
            return CallChain.of(arg).flatMap(CallChain::rootName).map(bindings::get).orElse(null);
        }
        return null;
    }

    private static Parameter toParameter(String name, Expr expr, ResolvedVariables variables) {
        String sourceName = expr instanceof Expr.Name n ? n.id() : null;
        Optional<Object> value = ExpressionEvaluator.evaluate(expr, variables);
        if (value.isPresent()) {
            return Parameter.fromSource(name, value.get(), sourceName);
        }
        if (ExpressionEvaluator.isArithmetic(expr)) {
            log.debug("实参 {} 无法求值，使用默认值 {}", ExprPrinter.print(expr), VariableResolver.DEFAULT_VALUE);
            return Parameter.fromSource(name, VariableResolver.DEFAULT_VALUE, sourceName);
        }
        return Parameter.expression(name, ExprPrinter.print(expr));
    }

    /** {@code edges(">Z")}/{@code faces(">Z")} 的选择器字符串，其他调用返回 null。 */
    private static String selectorOf(CallChain.Link link) {
        if (!link.method().equals("edges") && !link.method().equals("faces")) {
            return null;
        }
        List<Expr> args = link.call().args();
        if (args.size() == 1 && args.get(0) instanceof Expr.Constant constant && constant.value() instanceof String s) {
            return s;
        }
        return null;
    }

    private static boolean acceptsSelector(FeatureType type) {
        return type == FeatureType.FILLET || type == FeatureType.CHAMFER || type == FeatureType.WORKPLANE;
    }

    private static String firstName(List<Expr> targets) {
        for (Expr target : targets) {
            if (target instanceof Expr.Name name) {
                return name.id();
            }
        }
        return null;
    }
}
