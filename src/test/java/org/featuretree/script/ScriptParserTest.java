package org.featuretree.script;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptParserTest {

    @Test
    void parse_assignmentRecordsSourceSpan() {
        ScriptModule module = ScriptParser.parse("radius = 5\nheight = 10.0\n");

        assertThat(module.body()).hasSize(2);
        Stmt.Assign second = (Stmt.Assign) module.body().get(1);
        assertThat(second.targets()).containsExactly(new Expr.Name("height"));
        assertThat(((Expr.Constant) second.value()).value()).isEqualTo(10.0);
        assertThat(second.span()).isEqualTo(new SourceSpan(2, 0, 2, 13));
    }

    @Test
    void parse_semicolonSeparatedStatements() {
        ScriptModule module = ScriptParser.parse("radius=5; height=10; result=Workplane(\"XY\").cylinder(radius,height)");

        assertThat(module.body()).hasSize(3);
        assertThat(module.body()).allMatch(s -> s instanceof Stmt.Assign);
    }

    @Test
    void parse_methodChainIsNestedCalls() {
        ScriptModule module = ScriptParser.parse("r = cq.Workplane('XY').box(1, 2, 3).edges('|Z').fillet(radius=0.5)");

        Stmt.Assign assign = (Stmt.Assign) module.body().get(0);
        Expr.Call fillet = (Expr.Call) assign.value();
        assertThat(((Expr.Attribute) fillet.func()).attr()).isEqualTo("fillet");
        assertThat(fillet.args()).isEmpty();
        assertThat(fillet.keywords()).hasSize(1);
        assertThat(fillet.keywords().get(0).name()).isEqualTo("radius");
        Expr.Call edges = (Expr.Call) ((Expr.Attribute) fillet.func()).value();
        assertThat(((Expr.Attribute) edges.func()).attr()).isEqualTo("edges");
    }

    @Test
    void parse_compoundStatementsAreWalkedInSourceOrder() {
        String script = """
                import cadquery as cq
                from math import pi

                def make(size: float = 2.0) -> cq.Workplane:
                    return cq.Workplane().box(size, size, size)

                for i in range(3):
                    if i % 2 == 0:
                        part = make(i)
                    else:
                        pass

                with open('x') as f:
                    data = f.read()

                try:
                    value = int(data)
                except ValueError as e:
                    value = 0
                finally:
                    done = True
                """;

        ScriptModule module = ScriptParser.parse(script);

        assertThat(module.body()).hasSize(6);
        assertThat(module.body().get(0)).isInstanceOf(Stmt.Import.class);
        assertThat(module.body().get(1)).isInstanceOf(Stmt.ImportFrom.class);
        assertThat(module.body().get(2)).isInstanceOf(Stmt.FunctionDef.class);
        assertThat(module.body().get(3)).isInstanceOf(Stmt.For.class);
        assertThat(module.body().get(4)).isInstanceOf(Stmt.With.class);
        assertThat(module.body().get(5)).isInstanceOf(Stmt.Try.class);

        List<String> assigned = module.allStatements().stream()
                .filter(s -> s instanceof Stmt.Assign)
                .map(s -> ((Expr.Name) ((Stmt.Assign) s).targets().get(0)).id())
                .toList();
        assertThat(assigned).containsExactly("part", "data", "value", "value", "done");
    }

    @Test
    void parse_annotatedAndAugmentedAssignments() {
        ScriptModule module = ScriptParser.parse("size: float = 2.5\nsize += 1\n");

        Stmt.AnnAssign ann = (Stmt.AnnAssign) module.body().get(0);
        assertThat(ann.target()).isEqualTo(new Expr.Name("size"));
        assertThat(ann.annotation()).isEqualTo(new Expr.Name("float"));
        Stmt.AugAssign aug = (Stmt.AugAssign) module.body().get(1);
        assertThat(aug.op()).isEqualTo(BinaryOperator.ADD);
    }

    @Test
    void parse_syntaxErrorCarriesLineAndColumn() {
        assertThatThrownBy(() -> ScriptParser.parse("a = 1\nb = = 2\n"))
                .isInstanceOfSatisfying(ScriptSyntaxException.class, e -> {
                    assertThat(e.getLine()).isEqualTo(2);
                    assertThat(e.getColumn()).isEqualTo(4);
                });
    }

    @Test
    void parseExpression_rejectsTrailingTokens() {
        assertThat(ScriptParser.parseExpression("width * 2")).isInstanceOf(Expr.BinOp.class);
        assertThatThrownBy(() -> ScriptParser.parseExpression("width * 2 )"))
                .isInstanceOf(ScriptSyntaxException.class);
        assertThatThrownBy(() -> ScriptParser.parseExpression("x = 1"))
                .isInstanceOf(ScriptSyntaxException.class);
    }

    @Test
    void exprPrinter_keepsRequiredParenthesesOnly() {
        assertThat(ExprPrinter.print(ScriptParser.parseExpression("(a + b) * c"))).isEqualTo("(a + b) * c");
        assertThat(ExprPrinter.print(ScriptParser.parseExpression("a - (b - c)"))).isEqualTo("a - (b - c)");
        assertThat(ExprPrinter.print(ScriptParser.parseExpression("a + (b * c)"))).isEqualTo("a + b * c");
        assertThat(ExprPrinter.print(ScriptParser.parseExpression("f(x, *rest, key=[1, 2], **kw)")))
                .isEqualTo("f(x, *rest, key=[1, 2], **kw)");
    }

    @Test
    void exprPrinter_outputParsesBackToSameTree() {
        String[] sources = {
                "cq.Workplane('XY').box(w, h, d).faces('>Z').hole(2)",
                "[p for p in pts if p[0] > 0]",
                "lambda x, y=2: x ** -y",
                "a if cond else {'k': (1,), **extra}",
        };
        for (String source : sources) {
            Expr parsed = ScriptParser.parseExpression(source);
            Expr reparsed = ScriptParser.parseExpression(ExprPrinter.print(parsed));
            assertThat(ExprPrinter.print(reparsed)).isEqualTo(ExprPrinter.print(parsed));
        }
    }
}
