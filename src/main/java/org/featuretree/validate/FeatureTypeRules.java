package org.featuretree.validate;

import org.featuretree.model.FeatureRole;
import org.featuretree.model.FeatureType;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * 特征类型之间的静态规则：合法父类型表、可作为根的类型、建议理由。
 * <p>
 * 均为对 {@link FeatureType} 的穷举 switch 表达式，新增类型时编译器会要求补齐。
 */
public final class FeatureTypeRules {

    private static final Set<FeatureType> SOLIDS = solidProducing();
    private static final Set<FeatureType> VOLUMES = withRole(FeatureRole.VOLUME);
    private static final Set<FeatureType> BOOLEANS = withRole(FeatureRole.BOOLEAN);

    private FeatureTypeRules() {
    }

    /** 允许作为 {@code type} 父节点的类型。 */
    public static Set<FeatureType> validParents(FeatureType type) {
        return switch (type) {
            case WORKPLANE -> with(SOLIDS, FeatureType.WORKPLANE, FeatureType.DATUM_PLANE);
            // 草图画在工作平面或实体的面上
            case SKETCH -> with(VOLUMES, FeatureType.WORKPLANE, FeatureType.DATUM_PLANE);
            case EXTRUDE, REVOLVE, LOFT, SWEEP -> EnumSet.of(FeatureType.SKETCH);
            case BOX, CYLINDER, SPHERE, CONE, TORUS ->
                    EnumSet.of(FeatureType.WORKPLANE, FeatureType.PATTERN_LINEAR, FeatureType.PATTERN_CIRCULAR);
            case UNION, DIFFERENCE, INTERSECTION -> EnumSet.copyOf(VOLUMES);
            case FILLET, CHAMFER -> union(VOLUMES, BOOLEANS);
            case MIRROR, PATTERN_LINEAR, PATTERN_CIRCULAR -> with(SOLIDS, FeatureType.WORKPLANE);
            case ASSEMBLY_ROOT -> EnumSet.noneOf(FeatureType.class);
            case COMPONENT -> with(SOLIDS, FeatureType.ASSEMBLY_ROOT, FeatureType.COMPONENT);
            case CONSTRAINT -> EnumSet.of(FeatureType.ASSEMBLY_ROOT, FeatureType.COMPONENT);
            case DATUM_PLANE, DATUM_AXIS, DATUM_POINT -> with(SOLIDS, FeatureType.WORKPLANE,
                    FeatureType.DATUM_PLANE, FeatureType.DATUM_AXIS, FeatureType.DATUM_POINT);
        };
    }

    public static boolean isValidParent(FeatureType child, FeatureType parent) {
        return validParents(child).contains(parent);
    }

    /** 可以没有任何父节点（树的起点）。 */
    public static boolean allowsRoot(FeatureType type) {
        return switch (type) {
            case WORKPLANE, ASSEMBLY_ROOT, DATUM_PLANE, DATUM_AXIS, DATUM_POINT -> true;
            default -> false;
        };
    }

    /** 本身不产生实体、允许暂时“无影响”的类型。 */
    public static boolean isInertAllowed(FeatureType type) {
        return type.isConstruction() || type.role() == FeatureRole.DATUM || type.role() == FeatureRole.ASSEMBLY;
    }

    public static String rationale(FeatureType type) {
        return switch (type) {
            case WORKPLANE -> "Establish a coordinate system or a working plane on a face";
            case SKETCH -> "Create a 2D profile for extrusion or revolution";
            case EXTRUDE -> "Convert the sketch into a 3D solid";
            case REVOLVE -> "Revolve the sketch around an axis";
            case LOFT -> "Blend between several profiles";
            case SWEEP -> "Sweep the profile along a path";
            case BOX -> "Create a rectangular solid";
            case CYLINDER -> "Create a cylindrical solid";
            case SPHERE -> "Create a spherical solid";
            case CONE -> "Create a conical solid";
            case TORUS -> "Create a toroidal solid";
            case UNION -> "Combine with another solid";
            case DIFFERENCE -> "Cut using another solid";
            case INTERSECTION -> "Keep only the volume shared with another solid";
            case FILLET -> "Round sharp edges";
            case CHAMFER -> "Cut angular edges";
            case MIRROR -> "Mirror the geometry across a plane";
            case PATTERN_LINEAR -> "Repeat the feature along a grid";
            case PATTERN_CIRCULAR -> "Repeat the feature around a center";
            case ASSEMBLY_ROOT -> "Start an assembly";
            case COMPONENT -> "Add a part to the assembly";
            case CONSTRAINT -> "Constrain components relative to each other";
            case DATUM_PLANE -> "Add a reference plane";
            case DATUM_AXIS -> "Add a reference axis";
            case DATUM_POINT -> "Add a reference point";
        };
    }

    private static Set<FeatureType> solidProducing() {
        Set<FeatureType> set = EnumSet.noneOf(FeatureType.class);
        for (FeatureType type : FeatureType.values()) {
            if (type.producesSolid()) {
                set.add(type);
            }
        }
        return set;
    }

    private static Set<FeatureType> withRole(FeatureRole role) {
        Set<FeatureType> set = EnumSet.noneOf(FeatureType.class);
        for (FeatureType type : FeatureType.values()) {
            if (type.role() == role) {
                set.add(type);
            }
        }
        return set;
    }

    private static Set<FeatureType> union(Set<FeatureType> a, Set<FeatureType> b) {
        Set<FeatureType> out = EnumSet.noneOf(FeatureType.class);
        out.addAll(a);
        out.addAll(b);
        return out;
    }

    private static Set<FeatureType> with(Set<FeatureType> base, FeatureType... extra) {
        Set<FeatureType> out = EnumSet.noneOf(FeatureType.class);
        out.addAll(base);
        out.addAll(Arrays.asList(extra));
        return out;
    }
}
