package org.featuretree.model;

/**
 * 特征类型在建模历史中的角色分组。
 */
public enum FeatureRole {
    /** 构造类：工作平面、草图。本身不产生实体。 */
    CONSTRUCTION,
    /** 产生体积的操作：拉伸、旋转、放样、扫掠以及各类基本体。 */
    VOLUME,
    /** 布尔运算：并、差、交。 */
    BOOLEAN,
    /** 表面修饰：圆角、倒角、镜像、阵列。 */
    SURFACE,
    /** 装配：根、组件、约束。 */
    ASSEMBLY,
    /** 基准：基准面、基准轴、基准点。 */
    DATUM
}
