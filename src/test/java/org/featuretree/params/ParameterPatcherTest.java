package org.featuretree.params;

import org.featuretree.model.Parameter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterPatcherTest {

    private final ParameterPatcher patcher = new ParameterPatcher();

    @Test
    void patch_changesExactlyOneLineAndKeepsComment() {
        String script = """
                import cadquery as cq

                width = 10  # overall width
                height = 5
                result = cq.Workplane("XY").box(width, height, 1)
                """;

        String patched = patcher.patch(script, "width", 12.5);

        List<String> before = List.of(script.split("\n", -1));
        List<String> after = List.of(patched.split("\n", -1));
        assertThat(after).hasSameSizeAs(before);
        List<Integer> changed = new ArrayList<>();
        for (int i = 0; i < before.size(); i++) {
            if (!before.get(i).equals(after.get(i))) {
                changed.add(i);
            }
        }
        assertThat(changed).containsExactly(2);
        assertThat(after.get(2)).isEqualTo("width = 12.5  # overall width");

        List<Parameter> reextracted = new ParameterExtractor().extract(patched);
        assertThat(reextracted.get(0).value()).isEqualTo(12.5);
    }

    @Test
    void patch_onlyFirstAssignmentAmongSemicolonStatements() {
        assertThat(patcher.patch("a = 1; b = 2\nb = 9\n", "b", 3)).isEqualTo("a = 1; b = 3\nb = 9\n");
    }

    @Test
    void patch_keepsAnnotationAndLineEndings() {
        assertThat(patcher.patch("size: float = 2.0\r\nother = 1\r\n", "size", 4.5))
                .isEqualTo("size: float = 4.5\r\nother = 1\r\n");
        assertThat(patcher.patch("x = 1\r\ny = 2\r\n", "y", 7)).isEqualTo("x = 1\r\ny = 7\r\n");
    }

    @Test
    void patch_quotesStringsAndBooleans() {
        assertThat(patcher.patch("label = 'a'\n", "label", "it's")).isEqualTo("label = \"it's\"\n");
        assertThat(patcher.patch("flag = False\n", "flag", true)).isEqualTo("flag = True\n");
    }

    @Test
    void patch_unknownOrMultilineAssignmentIsRejected() {
        assertThatThrownBy(() -> patcher.patch("x = 1\n", "y", 2))
                .isInstanceOfSatisfying(ParameterPatchException.class, e -> {
                    assertThat(e.getSourceName()).isEqualTo("y");
                    assertThat(e.getReason()).isEqualTo("脚本中没有对该变量的顶层赋值");
                });
        assertThatThrownBy(() -> patcher.patch("pts = [\n    1,\n    2]\n", "pts", 3))
                .isInstanceOf(ParameterPatchException.class)
                .hasMessageContaining("跨越多行");
    }
}
