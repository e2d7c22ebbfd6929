package org.featuretree.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.featuretree.model.FeatureTree;

import java.io.IOException;

/**
 * 特征树文档的 JSON 编解码（时间写成 ISO-8601 字符串，忽略未知字段）。
 */
public final class FeatureTreeJson {

    private final ObjectMapper mapper;

    public FeatureTreeJson() {
        this(createMapper());
    }

    public FeatureTreeJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        om.enable(SerializationFeature.INDENT_OUTPUT);
        return om;
    }

    public byte[] write(FeatureTree tree) {
        try {
            return mapper.writeValueAsBytes(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("特征树序列化失败：" + tree.getProjectId() + " v" + tree.getVersion(), e);
        }
    }

    public FeatureTree read(byte[] bytes) throws IOException {
        return mapper.readValue(bytes, FeatureTree.class);
    }
}
