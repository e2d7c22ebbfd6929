package org.featuretree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 特征树中的一个节点：一次离散的 CAD 操作（不可变）。
 * <p>
 * 不变式：
 * <ul>
 *   <li>{@code parentReferences} 中的每个目标都必须存在于所属的树中。</li>
 *   <li>{@code childIds} 是其他节点指向本节点的父引用的精确逆关系，由 {@link FeatureTree} 维护。</li>
 * </ul>
 *
 * @param id               唯一标识
 * @param name             名称（解析时取脚本变量名）
 * @param featureType      特征类型
 * @param description      说明（可选）
 * @param parameters       参数列表（有序）
 * @param parentReferences 父引用（有序：第一个是“基体”，布尔运算的第二个是另一个操作数）
 * @param childIds         依赖本节点的子节点 id
 * @param sourceFragment   来源脚本片段（可选，例如 {@code .circle(5)}）
 * @param sourceCall       来源调用名（可选，例如 {@code circle}/{@code polarArray}）
 * @param valid            是否有效
 * @param error            无效时的原因（可选）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FeatureNode(
        String id,
        String name,
        FeatureType featureType,
        String description,
        List<Parameter> parameters,
        List<FeatureReference> parentReferences,
        List<String> childIds,
        String sourceFragment,
        String sourceCall,
        boolean valid,
        String error
) {

    public FeatureNode {
        Objects.requireNonNull(featureType, "featureType");
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        if (name == null || name.isBlank()) {
            name = featureType.value();
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        parentReferences = parentReferences == null ? List.of() : List.copyOf(parentReferences);
        childIds = childIds == null ? List.of() : List.copyOf(childIds);
    }

    public static FeatureNode create(String name, FeatureType featureType) {
        return new FeatureNode(null, name, featureType, null, null, null, null, null, null, true, null);
    }

    public static FeatureNode create(String id, String name, FeatureType featureType,
                                     List<Parameter> parameters, List<FeatureReference> parentReferences) {
        return new FeatureNode(id, name, featureType, null, parameters, parentReferences, null, null, null, true, null);
    }

    public Optional<Parameter> parameter(String parameterName) {
        for (Parameter p : parameters) {
            if (p.name().equals(parameterName)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /** 按参数名建立索引（保持参数顺序）。 */
    @JsonIgnore
    public Map<String, Parameter> parameterMap() {
        Map<String, Parameter> map = new LinkedHashMap<>();
        for (Parameter p : parameters) {
            map.put(p.name(), p);
        }
        return map;
    }

    /** 第一个父引用（基体）。 */
    @JsonIgnore
    public Optional<String> primaryParentId() {
        return parentReferences.isEmpty() ? Optional.empty() : Optional.of(parentReferences.get(0).targetNodeId());
    }

    public boolean references(String nodeId) {
        for (FeatureReference ref : parentReferences) {
            if (ref.targetNodeId().equals(nodeId)) {
                return true;
            }
        }
        return false;
    }

    public FeatureNode withParameters(List<Parameter> newParameters) {
        return new FeatureNode(id, name, featureType, description, newParameters, parentReferences, childIds,
                sourceFragment, sourceCall, valid, error);
    }

    public FeatureNode withParentReferences(List<FeatureReference> newReferences) {
        return new FeatureNode(id, name, featureType, description, parameters, newReferences, childIds,
                sourceFragment, sourceCall, valid, error);
    }

    /**
     * 把 reference 放到父引用的首位（基体）。节点已引用同一目标时沿用原引用的角色，只调整位置。
     */
    public FeatureNode withPrimaryParent(FeatureReference reference) {
        FeatureReference primary = reference;
        List<FeatureReference> refs = new ArrayList<>(parentReferences.size() + 1);
        for (FeatureReference ref : parentReferences) {
            if (ref.targetNodeId().equals(reference.targetNodeId())) {
                if (primary == reference) {
                    primary = ref;
                }
            } else {
                refs.add(ref);
            }
        }
        refs.add(0, primary);
        return refs.equals(parentReferences) ? this : withParentReferences(refs);
    }

    public FeatureNode withChildIds(List<String> newChildIds) {
        return new FeatureNode(id, name, featureType, description, parameters, parentReferences, newChildIds,
                sourceFragment, sourceCall, valid, error);
    }

    public FeatureNode withSource(String fragment, String call) {
        return new FeatureNode(id, name, featureType, description, parameters, parentReferences, childIds,
                fragment, call, valid, error);
    }

    public FeatureNode withDescription(String newDescription) {
        return new FeatureNode(id, name, featureType, newDescription, parameters, parentReferences, childIds,
                sourceFragment, sourceCall, valid, error);
    }

    public FeatureNode markInvalid(String reason) {
        return new FeatureNode(id, name, featureType, description, parameters, parentReferences, childIds,
                sourceFragment, sourceCall, false, reason);
    }
}
