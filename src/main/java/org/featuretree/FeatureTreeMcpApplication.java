package org.featuretree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FeatureTreeMcpApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(FeatureTreeMcpApplication.class, args);
    }

    /**
     * 提前创建日志目录，RollingFileAppender 在目录不存在时会初始化失败。
     * <p>
     * 规则与 logback-spring.xml 一致：优先系统属性/环境变量 LOG_PATH，默认 ./logs。
     * stdout 是 MCP 的通信通道，失败信息只能写到 stderr。
     */
    private static void ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (IOException e) {
            System.err.println("无法创建日志目录 " + logPath + "：" + e.getMessage());
        }
    }
}
