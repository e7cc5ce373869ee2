package org.sandboxfs.filesystem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SandboxConfigurationTest {

    @TempDir
    Path tempDir;

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfiguration.class, SandboxConfiguration.class);

    @Test
    void createsMissingRootAndBindsProperties() {
        Path root = tempDir.resolve("box");

        contextRunner
                .withPropertyValues(
                        "app.sandbox.root=" + root,
                        "app.sandbox.tree-max-depth=3",
                        "app.sandbox.allow-write=false"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(SandboxedFileSystem.class);
                    assertThat(Files.isDirectory(root)).isTrue();

                    SandboxProperties properties = context.getBean(SandboxProperties.class);
                    assertThat(properties.getTreeMaxDepth()).isEqualTo(3);
                    assertThat(properties.isAllowWrite()).isFalse();

                    SandboxedFileSystem fs = context.getBean(SandboxedFileSystem.class);
                    assertThat(fs.root()).isEqualTo(root.toRealPath());
                    assertThat(fs.currentDirectory()).isEqualTo("/");
                });
    }

    @Test
    void failsWhenRootIsMissingAndCreationIsDisabled() {
        contextRunner
                .withPropertyValues(
                        "app.sandbox.root=" + tempDir.resolve("absent"),
                        "app.sandbox.create-root=false"
                )
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsMalformedDirectoryPermissions() {
        contextRunner
                .withPropertyValues(
                        "app.sandbox.root=" + tempDir,
                        "app.sandbox.directory-permissions=0700"
                )
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(SandboxProperties.class)
    static class PropertiesConfiguration {
    }
}
