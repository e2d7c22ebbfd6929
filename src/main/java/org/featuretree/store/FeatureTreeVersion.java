package org.featuretree.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.featuretree.model.FeatureTree;
import org.featuretree.model.FeatureTreeOperation;
import org.featuretree.model.OperationType;

import java.time.Instant;

/**
 * 版本列表中的一项。产生该版本的操作一并列出，版本列表即操作历史。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FeatureTreeVersion(
        String projectId,
        int version,
        String treeId,
        int nodeCount,
        Instant createdAt,
        String createdBy,
        OperationType operation,
        String summary,
        String sha256
) {

    static FeatureTreeVersion of(FeatureTree tree, String sha256) {
        FeatureTreeOperation op = tree.getLastOperation();
        return new FeatureTreeVersion(
                tree.getProjectId(),
                tree.getVersion(),
                tree.getId(),
                tree.getNodes().size(),
                tree.getCreatedAt(),
                tree.getCreatedBy(),
                op == null ? null : op.type(),
                op == null ? null : op.summary(),
                sha256
        );
    }
}
