package org.featuretree.model;

/**
 * 产生一个树版本的逻辑编辑类型。
 */
public enum OperationType {
    IMPORT,
    ADD,
    REMOVE,
    MODIFY,
    REORDER,
    PATCH,
    REGENERATE
}
