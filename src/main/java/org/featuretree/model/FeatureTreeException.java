package org.featuretree.model;

/**
 * 特征树子系统所有业务异常的基类（非受检）。
 */
public class FeatureTreeException extends RuntimeException {

    public FeatureTreeException(String message) {
        super(message);
    }

    public FeatureTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
