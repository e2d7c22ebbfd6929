package org.featuretree.service;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * 特征树服务的业务配置（{@code app.feature-tree.*}）。
 */
@Validated
@ConfigurationProperties(prefix = "app.feature-tree")
public class FeatureTreeProperties {

    /**
     * 版本存储方式：{@code memory}（进程内，默认）或 {@code file}（JSON 文件）。
     */
    @NotNull
    private StoreType store = StoreType.MEMORY;

    /**
     * {@code store=file} 时的存储根目录，每个项目一个子目录。
     */
    @NotBlank
    private String storageDir = "./feature-trees";

    /**
     * 解析/修改参数时允许的最大脚本大小（按 UTF-8 字节计）。
     */
    @NotNull
    private DataSize maxScriptSize = DataSize.ofKilobytes(256);

    /**
     * 修改被拒绝时附带的替代建议条数。
     */
    @Min(0)
    @Max(50)
    private int suggestionLimit = 3;

    /**
     * 生成脚本中结果变量的名称。
     */
    @NotBlank
    @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*")
    private String resultVariable = "result";

    /**
     * 工具调用未指定作者时记录的默认作者。
     */
    @NotBlank
    private String defaultCreatedBy = "mcp";

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public String getStorageDir() {
        return storageDir;
    }

    public void setStorageDir(String storageDir) {
        this.storageDir = storageDir;
    }

    public DataSize getMaxScriptSize() {
        return maxScriptSize;
    }

    public void setMaxScriptSize(DataSize maxScriptSize) {
        this.maxScriptSize = maxScriptSize;
    }

    public int getSuggestionLimit() {
        return suggestionLimit;
    }

    public void setSuggestionLimit(int suggestionLimit) {
        this.suggestionLimit = suggestionLimit;
    }

    public String getResultVariable() {
        return resultVariable;
    }

    public void setResultVariable(String resultVariable) {
        this.resultVariable = resultVariable;
    }

    public String getDefaultCreatedBy() {
        return defaultCreatedBy;
    }

    public void setDefaultCreatedBy(String defaultCreatedBy) {
        this.defaultCreatedBy = defaultCreatedBy;
    }

    public enum StoreType {
        MEMORY,
        FILE
    }
}
