package org.featuretree.params;

import org.featuretree.model.FeatureTreeException;

/**
 * 无法原位修改指定变量：脚本中没有对应赋值，或赋值跨越多行。
 */
public class ParameterPatchException extends FeatureTreeException {

    private final String sourceName;
    private final String reason;

    public ParameterPatchException(String sourceName, String reason) {
        super("无法修改参数 " + sourceName + "：" + reason);
        this.sourceName = sourceName;
        this.reason = reason;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getReason() {
        return reason;
    }
}
