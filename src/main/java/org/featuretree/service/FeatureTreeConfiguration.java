package org.featuretree.service;

import org.featuretree.generate.CadQueryCodeGenerator;
import org.featuretree.params.ParameterChangeValidator;
import org.featuretree.params.ParameterExtractor;
import org.featuretree.params.ParameterPatcher;
import org.featuretree.parse.FeatureTreeParser;
import org.featuretree.resolve.DependencyResolver;
import org.featuretree.store.FeatureTreeJson;
import org.featuretree.store.FeatureTreeStore;
import org.featuretree.store.InMemoryFeatureTreeStore;
import org.featuretree.store.JsonFileFeatureTreeStore;
import org.featuretree.validate.FeatureTreeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * 特征树服务的 Bean 装配。
 * <p>
 * 核心组件（解析、校验、排序、生成）都是无状态的普通对象，这里只负责把它们和配置、存储连起来。
 */
@Configuration(proxyBeanMethods = false)
public class FeatureTreeConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FeatureTreeConfiguration.class);

    @Bean
    public FeatureTreeStore featureTreeStore(FeatureTreeProperties properties) {
        FeatureTreeJson json = new FeatureTreeJson();
        if (properties.getStore() == FeatureTreeProperties.StoreType.FILE) {
            Path dir = Path.of(properties.getStorageDir());
            log.info("使用 JSON 文件存储特征树：{}", dir.toAbsolutePath().normalize());
            return new JsonFileFeatureTreeStore(dir, json);
        }
        log.info("使用内存存储特征树（进程退出后丢失）");
        return new InMemoryFeatureTreeStore(json);
    }

    @Bean
    public DependencyResolver dependencyResolver() {
        return new DependencyResolver();
    }

    @Bean
    public CadQueryCodeGenerator cadQueryCodeGenerator(DependencyResolver resolver, FeatureTreeProperties properties) {
        return new CadQueryCodeGenerator(resolver, properties.getResultVariable());
    }

    @Bean
    public FeatureTreeService featureTreeService(FeatureTreeStore store, DependencyResolver resolver,
                                                 CadQueryCodeGenerator generator, FeatureTreeProperties properties) {
        return new FeatureTreeService(store, new FeatureTreeParser(), new FeatureTreeValidator(), resolver, generator,
                new ParameterExtractor(), new ParameterPatcher(), new ParameterChangeValidator(), properties);
    }
}
