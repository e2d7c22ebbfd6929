package org.featuretree.params;

import org.featuretree.model.Parameter;
import org.featuretree.model.ParameterType;
import org.featuretree.parse.ScriptParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterExtractorTest {

    private final ParameterExtractor extractor = new ParameterExtractor();

    @Test
    void extract_literalAssignmentsBeforeFirstModelingCall() {
        List<Parameter> parameters = extractor.extract("""
                import cadquery as cq

                # Design parameters
                wall_thickness = 2.5
                hole_angle = 45
                count = 6
                label = "bracket"
                big = 250
                tiny = 0.5
                wall_thickness = 9
                derived = count * 2
                body = cq.Workplane("XY").box(10, 10, wall_thickness)
                after = 3
                """);

        assertThat(parameters).extracting(Parameter::originalSourceName)
                .containsExactly("wall_thickness", "hole_angle", "count", "label", "big", "tiny");

        Parameter wall = parameters.get(0);
        assertThat(wall.name()).isEqualTo("Wall Thickness");
        assertThat(wall.value()).isEqualTo(2.5);
        assertThat(wall.type()).isEqualTo(ParameterType.FLOAT);
        assertThat(wall.units()).isEqualTo("mm");
        assertThat(wall.minValue()).isEqualTo(0.1);
        assertThat(wall.maxValue()).isEqualTo(5.0);
        assertThat(wall.description()).isEqualTo("Design parameter: Wall Thickness");

        Parameter angle = parameters.get(1);
        assertThat(angle.units()).isEqualTo("degrees");
        assertThat(angle.minValue()).isEqualTo(1.0);
        assertThat(angle.maxValue()).isEqualTo(100.0);

        assertThat(parameters.get(2).units()).isNull();
        assertThat(parameters.get(2).maxValue()).isEqualTo(12.0);
        assertThat(parameters.get(3).value()).isEqualTo("bracket");
        assertThat(parameters.get(3).minValue()).isNull();
        assertThat(parameters.get(4).maxValue()).isEqualTo(500.0);
        assertThat(parameters.get(5).maxValue()).isEqualTo(1.0);
    }

    @Test
    void extract_stopsAtFunctionDefinition() {
        List<Parameter> parameters = extractor.extract("""
                size = 4
                def make():
                    return size
                later = 2
                """);

        assertThat(parameters).extracting(Parameter::originalSourceName).containsExactly("size");
    }

    @Test
    void extract_annotatedAndNegativeLiterals() {
        List<Parameter> parameters = extractor.extract("offset: float = -1.5\npoints = [1, 2, 3]\n");

        assertThat(parameters).extracting(Parameter::value).containsExactly(-1.5, List.of(1L, 2L, 3L));
        assertThat(parameters.get(0).minValue()).isNull();
        assertThat(parameters.get(1).type()).isEqualTo(ParameterType.VECTOR3D);
    }

    @Test
    void extract_syntaxErrorIsReported() {
        assertThatThrownBy(() -> extractor.extract("x = (1,"))
                .isInstanceOf(ScriptParseException.class);
    }
}
