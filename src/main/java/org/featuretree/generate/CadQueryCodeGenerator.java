package org.featuretree.generate;

import org.featuretree.model.FeatureNode;
import org.featuretree.model.FeatureReference;
import org.featuretree.model.FeatureRole;
import org.featuretree.model.FeatureTree;
import org.featuretree.model.FeatureType;
import org.featuretree.model.Parameter;
import org.featuretree.model.ParameterType;
import org.featuretree.model.ParameterValues;
import org.featuretree.parse.CadQueryCalls;
import org.featuretree.resolve.DependencyResolver;
import org.featuretree.script.PythonLiterals;
import org.featuretree.script.ScriptParser;
import org.featuretree.script.ScriptSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 特征树 -> CadQuery 脚本。
 * <p>
 * 先用 {@link DependencyResolver} 排序，再按顺序为每个节点分配 {@code {type}_{n}} 标识符并输出一条赋值语句，
 * 最后选出结果变量。找不到合法基底的节点输出 {@code # WARNING:} 注释后继续，不中断生成。
 * <p>
 * 生成器本身无状态，每次调用的中间状态都在 {@link Emission} 中。
 */
public class CadQueryCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CadQueryCodeGenerator.class);

    public static final String DEFAULT_RESULT_VARIABLE = "result";

    static final String FRESH_WORKPLANE = "cq.Workplane('XY')";
    static final String TOP_FACE_WORKPLANE = ".faces('>Z').workplane()";

    private static final Pattern POSITIONAL = Pattern.compile("arg_(\\d+)");
    private static final String SELECTOR = "selector";

    /** 结果变量的优先级分组：布尔 > 圆角/倒角 > 体生成操作 > 基本体。 */
    private static final List<Set<FeatureType>> RESULT_PRIORITY = List.of(
            Set.of(FeatureType.UNION, FeatureType.DIFFERENCE, FeatureType.INTERSECTION),
            Set.of(FeatureType.FILLET, FeatureType.CHAMFER),
            Set.of(FeatureType.EXTRUDE, FeatureType.REVOLVE, FeatureType.LOFT, FeatureType.SWEEP),
            Set.of(FeatureType.BOX, FeatureType.CYLINDER, FeatureType.SPHERE, FeatureType.CONE, FeatureType.TORUS));

    private final DependencyResolver resolver;
    private final String resultVariable;

    public CadQueryCodeGenerator() {
        this(new DependencyResolver(), DEFAULT_RESULT_VARIABLE);
    }

    public CadQueryCodeGenerator(DependencyResolver resolver, String resultVariable) {
        if (!PythonLiterals.isIdentifier(resultVariable)) {
            throw new IllegalArgumentException("结果变量名不是合法标识符：" + resultVariable);
        }
        this.resolver = resolver;
        this.resultVariable = resultVariable;
    }

    public String generate(FeatureTree tree) {
        return generateScript(tree).code();
    }

    public GeneratedScript generateScript(FeatureTree tree) {
        List<String> order = resolver.resolveOrFallback(tree);
        Emission emission = new Emission(tree);
        emission.declareDesignParameters();
        for (String nodeId : order) {
            FeatureNode node = tree.getNodes().get(nodeId);
            if (node != null) {
                emission.emit(node);
            }
        }
        String result = emission.selectResult();
        emission.lines.add("");
        emission.lines.add(resultVariable + " = " + result);
        String code = String.join("\n", emission.lines) + "\n";
        log.debug("生成脚本：项目 {} 版本 {}，节点 {} 个，结果 {}", tree.getProjectId(), tree.getVersion(),
                emission.variables.size(), result);
        return new GeneratedScript(code, result, emission.variables, emission.warnings);
    }

    /** 一次生成过程的状态。 */
    private final class Emission {

        private final FeatureTree tree;
        private final List<String> lines = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final Map<String, String> variables = new LinkedHashMap<>();
        private final Set<String> reserved = new HashSet<>();
        private final Map<FeatureType, Integer> counters = new HashMap<>();
        /** 设计参数：标识符 -> 值。 */
        private final Map<String, Object> designParameters = new LinkedHashMap<>();

        Emission(FeatureTree tree) {
            this.tree = tree;
            reserved.add("cq");
            reserved.add(resultVariable);
            lines.add("import cadquery as cq");
            lines.add("");
        }

        void declareDesignParameters() {
            List<String> declarations = new ArrayList<>();
            for (Parameter parameter : tree.getGlobalParameters()) {
                String identifier = designIdentifier(parameter);
                if (identifier == null || reserved.contains(identifier)) {
                    log.warn("设计参数 {} 无法作为脚本变量输出，已跳过", parameter.name());
                    continue;
                }
                reserved.add(identifier);
                // 声明右侧必须是字面量，登记放在生成声明之后
                declarations.add(identifier + " = " + literal(parameter));
                designParameters.put(identifier, parameter.value());
            }
            if (!declarations.isEmpty()) {
                lines.add("# Design parameters");
                lines.addAll(declarations);
                lines.add("");
            }
        }

        void emit(FeatureNode node) {
            String identifier = nextIdentifier(node.featureType());
            String expression = switch (EmissionRule.of(node.featureType())) {
                case WORKPLANE -> workplane(node);
                case SKETCH -> sketch(node);
                case PROFILE_OPERATION -> profileOperation(node);
                case PRIMITIVE -> primitive(node);
                case BOOLEAN -> booleanOperation(node);
                case EDGE_FINISH -> edgeFinish(node);
                case TRANSFORM -> transform(node);
                case ASSEMBLY_ROOT -> "cq.Assembly(" + arguments(node, CallSignature.forMethod("Assembly"),
                        List.of(), Set.of()) + ")";
                case COMPONENT -> component(node);
                case CONSTRAINT -> constraint(node);
                case DATUM_VECTOR -> datumVector(node);
            };
            variables.put(node.id(), identifier);
            lines.add(identifier + " = " + expression);
        }

        // -----------------------------------------------------------------
        // 各类规则
        // -----------------------------------------------------------------

        private String workplane(FeatureNode node) {
            FeatureNode parent = emittedParent(node).orElse(null);
            String selector = stringParameter(node, SELECTOR);
            if (parent == null) {
                if ("workplane".equals(node.sourceCall())) {
                    return FRESH_WORKPLANE + ".workplane(" + arguments(node, CallSignature.forMethod("workplane"),
                            List.of(), Set.of(SELECTOR)) + ")";
                }
                return "cq.Workplane(" + arguments(node, CallSignature.forMethod("Workplane"), List.of(),
                        Set.of(SELECTOR)) + ")";
            }
            String base = variables.get(parent.id());
            String args = arguments(node, CallSignature.forMethod("workplane"), List.of(),
                    Set.of(SELECTOR, "plane", "inPlane"));
            if (parent.featureType().producesSolid()) {
                String faces = selector != null ? PythonLiterals.quote(selector) : "'>Z'";
                return base + ".faces(" + faces + ").workplane(" + args + ")";
            }
            return base + ".workplane(" + args + ")";
        }

        private String sketch(FeatureNode node) {
            String method = node.sourceCall() != null
                    && CadQueryCalls.featureTypeOf(node.sourceCall()).orElse(null) == FeatureType.SKETCH
                    ? node.sourceCall() : inferSketchMethod(node);
            return sketchBase(node) + "." + method + "("
                    + arguments(node, CallSignature.forMethod(method), List.of(), Set.of(SELECTOR)) + ")";
        }

        /** 草图只能建在工作平面上：跳过连续的草图父节点，找不到则新建工作平面。 */
        private String sketchBase(FeatureNode node) {
            Set<String> seen = new HashSet<>();
            FeatureNode parent = emittedParent(node).orElse(null);
            while (parent != null && parent.featureType() == FeatureType.SKETCH && seen.add(parent.id())) {
                parent = emittedParent(parent).orElse(null);
            }
            if (parent == null || parent.featureType() == FeatureType.SKETCH) {
                return FRESH_WORKPLANE;
            }
            String base = variables.get(parent.id());
            if (parent.featureType() == FeatureType.WORKPLANE || parent.featureType() == FeatureType.DATUM_PLANE) {
                return base;
            }
            if (parent.featureType().producesSolid()) {
                return base + TOP_FACE_WORKPLANE;
            }
            return FRESH_WORKPLANE;
        }

        private String profileOperation(FeatureNode node) {
            String method = methodOf(node);
            FeatureNode parent = emittedParent(node).orElse(null);
            if (parent == null) {
                warn(node, "has no sketch or workplane to operate on");
                return FRESH_WORKPLANE;
            }
            String base = variables.get(parent.id());
            boolean onSolid = (node.featureType() == FeatureType.EXTRUDE || node.featureType() == FeatureType.REVOLVE)
                    && parent.featureType().producesSolid();
            if (onSolid) {
                base = base + TOP_FACE_WORKPLANE;
            }
            return base + "." + method + "(" + arguments(node, CallSignature.forMethod(method),
                    extraReferences(node, parent.id()), Set.of(SELECTOR)) + ")";
        }

        private String primitive(FeatureNode node) {
            String method = methodOf(node);
            String base = emittedParent(node).map(p -> variables.get(p.id())).orElse(FRESH_WORKPLANE);
            return base + "." + method + "(" + arguments(node, CallSignature.forMethod(method), List.of(),
                    Set.of(SELECTOR)) + ")";
        }

        private String booleanOperation(FeatureNode node) {
            String method = methodOf(node);
            List<String> operands = new ArrayList<>();
            for (String targetId : referencedIds(node)) {
                FeatureNode operand = originalGeometry(tree.getNodes().get(targetId));
                String variable = variables.get(operand.id());
                if (variable != null) {
                    operands.add(variable);
                }
            }
            if (operands.size() < 2) {
                warn(node, "needs two solid operands but found " + operands.size());
                return operands.isEmpty() ? FRESH_WORKPLANE : operands.get(0);
            }
            StringBuilder sb = new StringBuilder(operands.get(0)).append('.').append(method).append('(')
                    .append(arguments(node, CallSignature.forMethod(method), List.of(operands.get(1)), Set.of()))
                    .append(')');
            for (int i = 2; i < operands.size(); i++) {
                sb.append('.').append(method).append('(').append(operands.get(i)).append(')');
            }
            return sb.toString();
        }

        /** 越过圆角/倒角，取其体积父节点。 */
        private FeatureNode originalGeometry(FeatureNode node) {
            FeatureNode current = node;
            Set<String> seen = new HashSet<>();
            while (current.featureType().isEdgeFinish() && seen.add(current.id())) {
                Optional<FeatureNode> parent = emittedParent(current);
                if (parent.isEmpty()) {
                    break;
                }
                current = parent.get();
            }
            return current;
        }

        private String edgeFinish(FeatureNode node) {
            String method = methodOf(node);
            FeatureNode parent = emittedParent(node).orElse(null);
            if (parent == null) {
                warn(node, "has no solid to finish");
                return FRESH_WORKPLANE;
            }
            String selector = stringParameter(node, SELECTOR);
            String edges = selector == null ? ".edges()" : ".edges(" + PythonLiterals.quote(selector) + ")";
            return variables.get(parent.id()) + edges + "." + method + "("
                    + arguments(node, CallSignature.forMethod(method), List.of(), Set.of(SELECTOR)) + ")";
        }

        private String transform(FeatureNode node) {
            String method = methodOf(node);
            FeatureNode parent = emittedParent(node).orElse(null);
            if (parent == null) {
                warn(node, "has no geometry to transform");
                return FRESH_WORKPLANE;
            }
            return variables.get(parent.id()) + "." + method + "(" + arguments(node, CallSignature.forMethod(method),
                    extraReferences(node, parent.id()), Set.of(SELECTOR)) + ")";
        }

        private String component(FeatureNode node) {
            String assembly = firstReferenced(node, t -> t.role() == FeatureRole.ASSEMBLY);
            String solid = firstReferenced(node, FeatureType::producesSolid);
            if (assembly == null) {
                warn(node, "is not attached to an assembly");
                assembly = "cq.Assembly()";
            }
            if (solid == null) {
                warn(node, "has no solid to add to the assembly");
                return assembly;
            }
            Set<String> skip = Set.of(SELECTOR);
            String args = arguments(node, CallSignature.forMethod("add"), List.of(solid), skip);
            if (node.parameter("name").isEmpty()) {
                args = args + ", name=" + PythonLiterals.quote(node.name());
            }
            return assembly + ".add(" + args + ")";
        }

        private String constraint(FeatureNode node) {
            String assembly = firstReferenced(node, t -> t.role() == FeatureRole.ASSEMBLY);
            if (assembly == null) {
                warn(node, "is not attached to an assembly");
                return "cq.Assembly()";
            }
            return assembly + ".constrain(" + arguments(node, CallSignature.forMethod("constrain"), List.of(),
                    Set.of(SELECTOR)) + ")";
        }

        private String datumVector(FeatureNode node) {
            List<Double> fallback = node.featureType() == FeatureType.DATUM_AXIS
                    ? List.of(0.0, 0.0, 1.0) : List.of(0.0, 0.0, 0.0);
            Object vector = null;
            for (String name : List.of("arg_0", "direction", "point", "vector")) {
                Optional<Parameter> parameter = node.parameter(name);
                if (parameter.isPresent() && parameter.get().value() instanceof List<?> list && list.size() == 3) {
                    vector = list;
                    break;
                }
            }
            List<?> components = vector instanceof List<?> list ? list : fallback;
            List<String> parts = new ArrayList<>();
            for (Object component : components) {
                parts.add(PythonLiterals.format(component));
            }
            return "cq.Vector(" + String.join(", ", parts) + ")";
        }

        // -----------------------------------------------------------------
        // 参数
        // -----------------------------------------------------------------

        /**
         * 组装实参列表。
         *
         * @param leading 需要放入位置参数空位（或追加在位置参数末尾）的引用变量
         * @param skip    不输出的参数名
         */
        private String arguments(FeatureNode node, CallSignature signature, List<String> leading, Set<String> skip) {
            Map<String, Parameter> params = new LinkedHashMap<>();
            Map<Integer, Parameter> positional = new HashMap<>();
            int maxIndex = -1;
            for (Parameter parameter : node.parameters()) {
                if (skip.contains(parameter.name())) {
                    continue;
                }
                Matcher m = POSITIONAL.matcher(parameter.name());
                if (m.matches()) {
                    int index = Integer.parseInt(m.group(1));
                    positional.put(index, parameter);
                    maxIndex = Math.max(maxIndex, index);
                } else {
                    params.put(parameter.name(), parameter);
                }
            }

            List<CallSignature.Slot> slots = signature.slots();
            int last = maxIndex;
            for (int i = 0; i < slots.size(); i++) {
                CallSignature.Slot slot = slots.get(i);
                boolean named = slot.aliases().stream().anyMatch(params::containsKey);
                if (slot.required() || named) {
                    last = Math.max(last, i);
                }
            }

            Deque<String> references = new ArrayDeque<>(leading);
            Set<String> consumed = new HashSet<>();
            List<String> out = new ArrayList<>();
            for (int i = 0; i <= last; i++) {
                Parameter parameter = positional.get(i);
                if (parameter == null && i < slots.size()) {
                    for (String alias : slots.get(i).aliases()) {
                        if (params.containsKey(alias) && !consumed.contains(alias)) {
                            parameter = params.get(alias);
                            consumed.add(alias);
                            break;
                        }
                    }
                }
                if (parameter != null) {
                    out.add(literal(parameter));
                } else if (!references.isEmpty()) {
                    out.add(references.removeFirst());
                } else if (i < slots.size() && slots.get(i).required()) {
                    out.add(slots.get(i).defaultLiteral());
                } else {
                    out.add("None");
                }
            }
            out.addAll(references);
            for (Parameter parameter : params.values()) {
                if (consumed.contains(parameter.name())) {
                    continue;
                }
                if (!PythonLiterals.isIdentifier(parameter.name())) {
                    log.warn("节点 {} 的参数名 {} 不是合法关键字，已忽略", node.id(), parameter.name());
                    continue;
                }
                out.add(parameter.name() + "=" + literal(parameter));
            }
            return String.join(", ", out);
        }

        /** 参数值的脚本写法：来源于设计参数且值未变时写标识符，表达式原样输出。 */
        private String literal(Parameter parameter) {
            String source = parameter.originalSourceName();
            if (source != null && designParameters.containsKey(source)
                    && ParameterValues.sameValue(designParameters.get(source), parameter.value())) {
                return source;
            }
            if (parameter.type() == ParameterType.EXPRESSION && parameter.value() instanceof String text) {
                try {
                    ScriptParser.parseExpression(text);
                    return text;
                } catch (ScriptSyntaxException e) {
                    log.warn("参数 {} 的表达式无法解析（{}），按字符串输出", parameter.name(), e.getReason());
                    return PythonLiterals.quote(text);
                }
            }
            return PythonLiterals.format(parameter.value());
        }

        private String designIdentifier(Parameter parameter) {
            if (parameter.originalSourceName() != null && PythonLiterals.isIdentifier(parameter.originalSourceName())) {
                return parameter.originalSourceName();
            }
            String derived = parameter.name().trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]+", "_");
            return PythonLiterals.isIdentifier(derived) ? derived : null;
        }

        // -----------------------------------------------------------------
        // 结果变量
        // -----------------------------------------------------------------

        String selectResult() {
            Set<String> referenced = new HashSet<>();
            for (String nodeId : variables.keySet()) {
                referenced.addAll(referencedIds(tree.getNodes().get(nodeId)));
            }
            List<String> leaves = new ArrayList<>();
            for (String nodeId : variables.keySet()) {
                FeatureNode node = tree.getNodes().get(nodeId);
                if (!referenced.contains(nodeId) && node.featureType() != FeatureType.WORKPLANE) {
                    leaves.add(nodeId);
                }
            }
            for (Set<FeatureType> group : RESULT_PRIORITY) {
                for (int i = leaves.size() - 1; i >= 0; i--) {
                    if (group.contains(tree.getNodes().get(leaves.get(i)).featureType())) {
                        return variables.get(leaves.get(i));
                    }
                }
            }
            if (!leaves.isEmpty()) {
                return variables.get(leaves.get(leaves.size() - 1));
            }
            if (!variables.isEmpty()) {
                List<String> emitted = new ArrayList<>(variables.values());
                return emitted.get(emitted.size() - 1);
            }
            return FRESH_WORKPLANE;
        }

        // -----------------------------------------------------------------
        // 工具方法
        // -----------------------------------------------------------------

        private String nextIdentifier(FeatureType type) {
            String identifier;
            do {
                int n = counters.merge(type, 1, Integer::sum);
                identifier = type.value() + "_" + n;
            } while (reserved.contains(identifier));
            reserved.add(identifier);
            return identifier;
        }

        /** 第一个已输出的父节点。 */
        private Optional<FeatureNode> emittedParent(FeatureNode node) {
            for (FeatureReference ref : node.parentReferences()) {
                if (variables.containsKey(ref.targetNodeId())) {
                    return Optional.of(tree.getNodes().get(ref.targetNodeId()));
                }
            }
            return Optional.empty();
        }

        /** 父引用中除主父节点外、已输出的节点变量（例如 sweep 的路径）。 */
        private List<String> extraReferences(FeatureNode node, String primaryId) {
            List<String> out = new ArrayList<>();
            for (String targetId : referencedIds(node)) {
                if (!targetId.equals(primaryId) && variables.containsKey(targetId)) {
                    out.add(variables.get(targetId));
                }
            }
            return out;
        }

        private Set<String> referencedIds(FeatureNode node) {
            Set<String> ids = new LinkedHashSet<>();
            for (FeatureReference ref : node.parentReferences()) {
                if (tree.containsNode(ref.targetNodeId())) {
                    ids.add(ref.targetNodeId());
                }
            }
            return ids;
        }

        private String firstReferenced(FeatureNode node, Predicate<FeatureType> filter) {
            for (String targetId : referencedIds(node)) {
                FeatureNode target = tree.getNodes().get(targetId);
                if (variables.containsKey(targetId) && filter.test(target.featureType())) {
                    return variables.get(targetId);
                }
            }
            return null;
        }

        private String methodOf(FeatureNode node) {
            String call = node.sourceCall();
            if (call != null && CadQueryCalls.featureTypeOf(call).orElse(null) == node.featureType()) {
                return call;
            }
            return EmissionRule.defaultMethod(node.featureType());
        }

        private String inferSketchMethod(FeatureNode node) {
            if (node.parameter("sides").isPresent() || node.parameter("nSides").isPresent()) {
                return "polygon";
            }
            if (node.parameter("width").isPresent() || node.parameter("xLen").isPresent()) {
                return "rect";
            }
            return "circle";
        }

        private String stringParameter(FeatureNode node, String name) {
            return node.parameter(name)
                    .map(Parameter::value)
                    .filter(String.class::isInstance)
                    .map(String.class::cast)
                    .orElse(null);
        }

        private void warn(FeatureNode node, String problem) {
            String message = node.featureType().value() + " '" + node.name() + "' " + problem;
            warnings.add(message);
            lines.add("# WARNING: " + message.replace('\n', ' '));
            log.warn("生成代码时节点 {} 缺少基底：{}", node.id(), message);
        }
    }
}
