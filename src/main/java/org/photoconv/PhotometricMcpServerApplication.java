package org.photoconv;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PhotometricMcpServerApplication {

    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(PhotometricMcpServerApplication.class, args);
    }

    /**
     * 提前创建日志目录，RollingFileAppender 在目录不存在时会初始化失败。
     * <p>
     * 与 logback-spring.xml 一致：优先系统属性/环境变量 LOG_PATH，默认 ./logs。
     * stdout 被 stdio 传输占用，失败时只能写 stderr。
     */
    static Path ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        Path dir = Path.of(logPath);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            System.err.println("创建日志目录失败：" + dir.toAbsolutePath() + "（" + e.getMessage() + "）");
        }
        return dir;
    }
}
