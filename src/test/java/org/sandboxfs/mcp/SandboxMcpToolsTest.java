package org.sandboxfs.mcp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sandboxfs.filesystem.SandboxProperties;
import org.sandboxfs.filesystem.SandboxedFileSystem;
import org.sandboxfs.filesystem.dto.SandboxStatus;
import org.springframework.ai.tool.ToolCallback;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class SandboxMcpToolsTest {

    @TempDir
    Path tempDir;

    private Path root;
    private SandboxProperties properties;
    private SandboxMcpTools tools;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createDirectories(tempDir.toRealPath().resolve("sandbox"));
        properties = new SandboxProperties();
        tools = new SandboxMcpTools(properties, new SandboxedFileSystem(root, properties));
    }

    @Test
    void registersOneToolPerSandboxOperation() {
        List<ToolCallback> callbacks = new McpToolConfiguration().sandboxToolCallbacks(tools);

        assertThat(callbacks)
                .extracting(callback -> callback.getToolDefinition().name())
                .containsExactlyInAnyOrder(
                        "sandbox_exists",
                        "sandbox_current_directory",
                        "sandbox_change_directory",
                        "sandbox_list_contents",
                        "sandbox_make_directory",
                        "sandbox_write_file",
                        "sandbox_read_file",
                        "sandbox_directory_tree"
                );
    }

    @Test
    void toolCallsReturnJsonResults() {
        Map<String, ToolCallback> byName = new McpToolConfiguration().sandboxToolCallbacks(tools).stream()
                .collect(Collectors.toMap(callback -> callback.getToolDefinition().name(), Function.identity()));

        String made = byName.get("sandbox_make_directory").call("{\"path\":\"made/here\"}");
        String written = byName.get("sandbox_write_file").call("{\"path\":\"made/here/a.txt\",\"content\":\"hi\"}");
        String denied = byName.get("sandbox_read_file").call("{\"path\":\"../../x\"}");

        assertThat(Files.isDirectory(root.resolve("made/here"))).isTrue();
        assertThat(made).contains("\"status\":\"OK\"").contains("/made/here");
        assertThat(written).contains("\"bytesWritten\":2");
        assertThat(denied).contains("\"status\":\"DENIED\"").doesNotContain("\"value\"");
    }

    @Test
    void listContentsToolIncludesOneLinePerEntry() {
        tools.makeDirectory("docs");
        tools.writeFile("a.txt", "a");
        ToolCallback list = new McpToolConfiguration().sandboxToolCallbacks(tools).stream()
                .filter(callback -> callback.getToolDefinition().name().equals("sandbox_list_contents"))
                .findFirst()
                .orElseThrow();

        String json = list.call("{}");

        assertThat(json).contains("\"count\":2").contains("\"files\":");
        assertThat(tools.listContents().value().formatted()).isEqualTo("\"a.txt\" (文件)\n\"docs\" (目录)");
    }

    @Test
    void readOnlySandboxRefusesWrites() {
        properties.setAllowWrite(false);

        assertThat(tools.makeDirectory("blocked").status()).isEqualTo(SandboxStatus.DENIED);
        assertThat(tools.writeFile("blocked.txt", "x").status()).isEqualTo(SandboxStatus.DENIED);
        assertThat(Files.exists(root.resolve("blocked"))).isFalse();
        assertThat(Files.exists(root.resolve("blocked.txt"))).isFalse();

        assertThat(tools.exists("blocked.txt").value()).isFalse();
        assertThat(tools.listContents().value().count()).isZero();
    }

    @Test
    void navigationToolsShareOneCursor() {
        tools.makeDirectory("docs/api");
        tools.writeFile("docs/api/index.md", "# API");

        assertThat(tools.currentDirectory().value()).isEqualTo("/");
        assertThat(tools.changeDirectory("docs").value()).isEqualTo("/docs");
        assertThat(tools.readFile("api/index.md").value().content()).isEqualTo("# API");
        assertThat(tools.directoryTree(null).value().directories()).containsOnlyKeys("/docs", "/docs/api");
        assertThat(tools.currentDirectory().value()).isEqualTo("/docs");
    }

    @Test
    void writeWithoutContentIsReportedNotThrown() {
        assertThat(tools.writeFile("f.txt", null).status()).isEqualTo(SandboxStatus.INVALID_ARGUMENT);
        assertThat(Files.exists(root.resolve("f.txt"))).isFalse();
    }
}
