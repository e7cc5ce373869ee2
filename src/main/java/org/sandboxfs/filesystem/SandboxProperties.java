package org.sandboxfs.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 沙箱文件系统的业务配置（{@code app.sandbox.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #root} 指定沙箱根目录，所有读写都被限制在该目录之内。</li>
 *   <li>通过 {@link #treeMaxDepth} / {@link #treeMaxDirectories} 限制目录树遍历规模，防止深层目录或链接环导致遍历失控。</li>
 *   <li>通过 {@link #allowWrite} 可以把沙箱切换为只读。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.sandbox")
public class SandboxProperties {

    /**
     * 沙箱根目录（相对路径按进程工作目录解析）。
     */
    @NotBlank
    private String root = "./sandbox";

    /**
     * 根目录不存在时是否自动创建（默认 true）。
     */
    private boolean createRoot = true;

    /**
     * 新建目录使用的 POSIX 权限（仅在支持 POSIX 属性的文件系统上生效）。
     */
    @NotBlank
    @Pattern(regexp = "[r-][w-][x-][r-][w-][x-][r-][w-][x-]")
    private String directoryPermissions = "rwx------";

    /**
     * 是否允许写入（创建目录 / 写文件）。
     */
    private boolean allowWrite = true;

    /**
     * 目录树遍历的最大深度（0 表示只列出起始目录本身）。
     */
    @Min(0)
    @Max(10_000)
    private int treeMaxDepth = 64;

    /**
     * 目录树单次遍历最多访问的目录数（上限保护）。
     */
    @Min(1)
    @Max(1_000_000)
    private int treeMaxDirectories = 10_000;

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public boolean isCreateRoot() {
        return createRoot;
    }

    public void setCreateRoot(boolean createRoot) {
        this.createRoot = createRoot;
    }

    public String getDirectoryPermissions() {
        return directoryPermissions;
    }

    public void setDirectoryPermissions(String directoryPermissions) {
        this.directoryPermissions = directoryPermissions;
    }

    public boolean isAllowWrite() {
        return allowWrite;
    }

    public void setAllowWrite(boolean allowWrite) {
        this.allowWrite = allowWrite;
    }

    public int getTreeMaxDepth() {
        return treeMaxDepth;
    }

    public void setTreeMaxDepth(int treeMaxDepth) {
        this.treeMaxDepth = treeMaxDepth;
    }

    public int getTreeMaxDirectories() {
        return treeMaxDirectories;
    }

    public void setTreeMaxDirectories(int treeMaxDirectories) {
        this.treeMaxDirectories = treeMaxDirectories;
    }
}
