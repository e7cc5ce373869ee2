package org.sandboxfs.filesystem;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 沙箱文件系统的 Bean 装配。
 * <p>
 * 每个服务进程对应一个沙箱会话：这里按 {@link SandboxProperties#getRoot()} 创建唯一的 {@link SandboxedFileSystem}，
 * 当前目录随进程重启回到根目录。
 */
@Configuration(proxyBeanMethods = false)
public class SandboxConfiguration {

    @Bean
    public SandboxedFileSystem sandboxedFileSystem(SandboxProperties properties) {
        Path root = Path.of(properties.getRoot()).toAbsolutePath().normalize();
        if (properties.isCreateRoot() && !Files.exists(root)) {
            try {
                Files.createDirectories(root);
            } catch (IOException e) {
                throw new IllegalStateException("创建沙箱根目录失败：" + root, e);
            }
        }
        return new SandboxedFileSystem(root, properties);
    }
}
