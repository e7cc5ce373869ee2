package org.sandboxfs.mcp;

import org.sandboxfs.filesystem.SandboxProperties;
import org.sandboxfs.filesystem.SandboxedFileSystem;
import org.sandboxfs.filesystem.dto.DirectoryListing;
import org.sandboxfs.filesystem.dto.DirectoryTree;
import org.sandboxfs.filesystem.dto.FileContent;
import org.sandboxfs.filesystem.dto.SandboxResult;
import org.sandboxfs.filesystem.dto.SandboxStatus;
import org.sandboxfs.filesystem.dto.WriteReceipt;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * 沙箱文件系统 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>查看/切换当前目录（{@code sandbox_current_directory}、{@code sandbox_change_directory}）。</li>
 *   <li>列目录（{@code sandbox_list_contents}）与递归目录树（{@code sandbox_directory_tree}）。</li>
 *   <li>判断存在（{@code sandbox_exists}）、读文件（{@code sandbox_read_file}）。</li>
 *   <li>创建目录（{@code sandbox_make_directory}）、写文件（{@code sandbox_write_file}，整体覆盖）。</li>
 * </ul>
 * <p>
 * 安全策略：
 * <ul>
 *   <li>所有路径都限制在 {@code app.sandbox.root} 之内；绝对路径按“沙箱内绝对路径”解释。</li>
 *   <li>返回的路径都是沙箱路径（{@code /a/b}），不暴露服务端真实目录结构。</li>
 *   <li>{@code app.sandbox.allow-write=false} 时拒绝所有写操作。</li>
 * </ul>
 */
@Component
public class SandboxMcpTools {

    private final SandboxProperties properties;
    private final SandboxedFileSystem fileSystem;

    public SandboxMcpTools(SandboxProperties properties, SandboxedFileSystem fileSystem) {
        this.properties = properties;
        this.fileSystem = fileSystem;
    }

    @Tool(
            name = "sandbox_exists",
            description = "检查沙箱内的文件或目录是否存在（相对路径基于当前目录，/ 开头表示沙箱根目录）。"
    )
    public SandboxResult<Boolean> exists(
            @ToolParam(description = "文件或目录路径") String path
    ) {
        return fileSystem.exists(path);
    }

    @Tool(
            name = "sandbox_current_directory",
            description = "返回当前目录（相对沙箱根目录，根目录为 /）。"
    )
    public SandboxResult<String> currentDirectory() {
        String current = fileSystem.currentDirectory();
        return SandboxResult.ok(current, current);
    }

    @Tool(
            name = "sandbox_change_directory",
            description = "切换当前目录；目标不存在或不是目录时保持原目录不变。"
    )
    public SandboxResult<String> changeDirectory(
            @ToolParam(description = "目标目录路径（支持 .. 与 / 开头的沙箱绝对路径）") String path
    ) {
        return fileSystem.changeDirectory(path);
    }

    @Tool(
            name = "sandbox_list_contents",
            description = "列出当前目录下的文件和子目录（非递归，按名称排序，带类型与数量）。"
    )
    public SandboxResult<DirectoryListing> listContents() {
        return fileSystem.listContents();
    }

    @Tool(
            name = "sandbox_make_directory",
            description = "创建目录（自动创建缺失的父目录；目录已存在时直接成功）。"
    )
    public SandboxResult<String> makeDirectory(
            @ToolParam(description = "要创建的目录路径") String path
    ) {
        if (!properties.isAllowWrite()) {
            return readOnly(path);
        }
        return fileSystem.makeDirectory(path);
    }

    @Tool(
            name = "sandbox_write_file",
            description = "写入 UTF-8 文本文件：会整体覆盖已有内容（不是追加），请提供完整内容；父目录不存在时自动创建。"
    )
    /**
     * 写文件。
     * <p>
     * 注意：这里没有“部分更新”，模型只拿到截断后的内容时不要直接写回，否则会把文件写坏。
     */
    public SandboxResult<WriteReceipt> writeFile(
            @ToolParam(description = "目标文件路径") String path,
            @ToolParam(description = "完整的文件内容") String content
    ) {
        if (!properties.isAllowWrite()) {
            return readOnly(path);
        }
        if (content == null) {
            return SandboxResult.failure(SandboxStatus.INVALID_ARGUMENT, path, "参数错误：content 不能为空");
        }
        return fileSystem.writeFile(path, content);
    }

    @Tool(
            name = "sandbox_read_file",
            description = "读取 UTF-8 文本文件的完整内容，并回显文件的沙箱路径。"
    )
    public SandboxResult<FileContent> readFile(
            @ToolParam(description = "文件路径") String path
    ) {
        return fileSystem.readFile(path);
    }

    @Tool(
            name = "sandbox_directory_tree",
            description = "递归列出目录树：返回“目录路径 -> 该目录下的文件与子目录（子目录带 (目录) 标记）”的映射。"
    )
    /**
     * 递归目录树。深度与目录数受 {@code app.sandbox.tree-max-depth} / {@code app.sandbox.tree-max-directories} 限制。
     */
    public SandboxResult<DirectoryTree> directoryTree(
            @ToolParam(required = false, description = "起始目录（为空则为当前目录）") String path
    ) {
        return fileSystem.getDirectoryTree(path);
    }

    private static <T> SandboxResult<T> readOnly(String path) {
        return SandboxResult.failure(SandboxStatus.DENIED, path, "已禁止写入：配置 app.sandbox.allow-write=false");
    }
}
