package org.featuretree.generate;

import org.featuretree.model.FeatureType;

/**
 * 每种特征类型对应的代码生成规则。
 */
public enum EmissionRule {
    /** 根工作平面 {@code cq.Workplane(plane)}，或在父节点上派生的 {@code .workplane()}。 */
    WORKPLANE,
    /** 草图必须落在工作平面上。 */
    SKETCH,
    /** 拉伸/旋转/放样/扫掠：作用于草图；以实体为父时先取顶面工作平面。 */
    PROFILE_OPERATION,
    PRIMITIVE,
    /** 布尔运算的操作数总是越过圆角/倒角取原始实体。 */
    BOOLEAN,
    EDGE_FINISH,
    TRANSFORM,
    ASSEMBLY_ROOT,
    COMPONENT,
    CONSTRAINT,
    DATUM_VECTOR;

    public static EmissionRule of(FeatureType type) {
        return switch (type) {
            case WORKPLANE, DATUM_PLANE -> WORKPLANE;
            case SKETCH -> SKETCH;
            case EXTRUDE, REVOLVE, LOFT, SWEEP -> PROFILE_OPERATION;
            case BOX, CYLINDER, SPHERE, CONE, TORUS -> PRIMITIVE;
            case UNION, DIFFERENCE, INTERSECTION -> BOOLEAN;
            case FILLET, CHAMFER -> EDGE_FINISH;
            case MIRROR, PATTERN_LINEAR, PATTERN_CIRCULAR -> TRANSFORM;
            case ASSEMBLY_ROOT -> ASSEMBLY_ROOT;
            case COMPONENT -> COMPONENT;
            case CONSTRAINT -> CONSTRAINT;
            case DATUM_AXIS, DATUM_POINT -> DATUM_VECTOR;
        };
    }

    /** 特征类型在脚本中的默认方法名（节点没有记录来源调用时使用）。 */
    public static String defaultMethod(FeatureType type) {
        return switch (type) {
            case WORKPLANE, DATUM_PLANE -> "Workplane";
            case SKETCH -> "circle";
            case EXTRUDE -> "extrude";
            case REVOLVE -> "revolve";
            case LOFT -> "loft";
            case SWEEP -> "sweep";
            case BOX -> "box";
            case CYLINDER -> "cylinder";
            case SPHERE -> "sphere";
            case CONE -> "cone";
            case TORUS -> "torus";
            case UNION -> "union";
            case DIFFERENCE -> "cut";
            case INTERSECTION -> "intersect";
            case FILLET -> "fillet";
            case CHAMFER -> "chamfer";
            case MIRROR -> "mirror";
            case PATTERN_LINEAR -> "rarray";
            case PATTERN_CIRCULAR -> "polarArray";
            case ASSEMBLY_ROOT -> "Assembly";
            case COMPONENT -> "add";
            case CONSTRAINT -> "constrain";
            case DATUM_AXIS, DATUM_POINT -> "Vector";
        };
    }
}
