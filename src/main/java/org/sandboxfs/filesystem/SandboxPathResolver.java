package org.sandboxfs.filesystem;

import java.io.IOException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * 沙箱路径解析器：把调用方传入的路径解析成“规范化的绝对路径”，并确保它不会逃逸出沙箱根目录。
 * <p>
 * 解析规则：
 * <ul>
 *   <li>绝对路径（如 {@code /a/b}）视为“沙箱内的绝对路径”：去掉根部分后重新挂到 root 下，而不是真实文件系统的绝对路径。</li>
 *   <li>相对路径挂到调用方给出的基准目录（当前目录）下。</li>
 *   <li>逐级展开 {@code .}、{@code ..} 与符号链接后，再检查结果是否仍在 root 内。</li>
 * </ul>
 * <p>
 * 注意：
 * <ul>
 *   <li>越界检查发生在符号链接展开<b>之后</b>：字面上在 root 内、但链接指向 root 外的路径同样会被拒绝。</li>
 *   <li>悬空链接（目标不存在）也会按其目标路径展开，避免写入时“穿过”悬空链接落到 root 外。</li>
 *   <li>解析结果只取决于 (root, 基准目录, 输入)，不做任何缓存。</li>
 * </ul>
 */
public class SandboxPathResolver {

    /**
     * 单次解析允许展开的符号链接次数上限（与常见 POSIX 实现的 MAXSYMLINKS 一致）。
     */
    static final int MAX_LINK_HOPS = 40;

    private final Path root;

    public SandboxPathResolver(Path root) {
        Objects.requireNonNull(root, "root");
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("沙箱根目录必须是绝对路径：" + root);
        }
        this.root = root;
    }

    public Path root() {
        return root;
    }

    /**
     * 解析调用方路径。
     *
     * @param input 调用方原始输入（null 或空白视为 {@code .}）
     * @param base  相对路径的基准目录（必须已经是 root 内的规范路径）
     */
    public PathResolution resolve(String input, Path base) {
        Path rawPath;
        try {
            rawPath = (input == null || input.isBlank()) ? Path.of(".") : Path.of(input);
        } catch (InvalidPathException e) {
            return PathResolution.ioFailure(input, "路径格式无效：" + e.getReason());
        }

        Path anchored;
        if (rawPath.isAbsolute()) {
            Path rootComponent = rawPath.getRoot();
            anchored = root.resolve(rootComponent.relativize(rawPath));
        } else {
            anchored = base.resolve(rawPath);
        }

        Path canonical;
        try {
            canonical = canonicalize(anchored);
        } catch (FileSystemLoopException e) {
            return PathResolution.ioFailure(input, "符号链接层级过多：" + input);
        } catch (IOException e) {
            return PathResolution.ioFailure(input, "路径无法解析：" + input + "（" + e.getClass().getSimpleName() + "）");
        }

        if (!isWithinRoot(canonical)) {
            return PathResolution.denied(input);
        }
        return PathResolution.resolved(input, canonical, toSandboxPath(canonical));
    }

    /**
     * 判断一个已规范化的绝对路径是否位于 root 之内（等于 root 或以 root 为祖先）。
     * <p>
     * {@link Path#startsWith(Path)} 按路径分段比较，因此 {@code /sandbox2} 不会被误判为 {@code /sandbox} 的子路径。
     */
    public boolean isWithinRoot(Path canonical) {
        return canonical.equals(root) || canonical.startsWith(root);
    }

    /**
     * 把 root 内的绝对路径转换为沙箱路径（{@code /} 表示根目录，统一使用 {@code /} 分隔）。
     */
    public String toSandboxPath(Path absolute) {
        Path relative = root.relativize(absolute);
        StringJoiner joiner = new StringJoiner("/", "/", "");
        for (Path segment : relative) {
            String name = segment.toString();
            if (!name.isEmpty()) {
                joiner.add(name);
            }
        }
        return joiner.toString();
    }

    /**
     * 从文件系统根开始逐段展开路径。
     * <p>
     * 已处理的前缀始终是“真实路径”（不含符号链接），因此 {@code ..} 直接回退一级即可得到物理意义上的父目录；
     * 遇到符号链接时把链接目标的各段压回待处理队列继续展开。
     */
    static Path canonicalize(Path anchored) throws IOException {
        Path current = anchored.getRoot();
        Deque<String> pending = new ArrayDeque<>();
        for (Path segment : anchored) {
            pending.addLast(segment.toString());
        }

        int hops = 0;
        while (!pending.isEmpty()) {
            String segment = pending.pollFirst();
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                Path parent = current.getParent();
                if (parent != null) {
                    current = parent;
                }
                continue;
            }

            Path next = current.resolve(segment);
            if (Files.isSymbolicLink(next)) {
                if (++hops > MAX_LINK_HOPS) {
                    throw new FileSystemLoopException(next.toString());
                }
                Path target = Files.readSymbolicLink(next);
                if (target.isAbsolute()) {
                    current = target.getRoot();
                }
                Deque<String> targetSegments = new ArrayDeque<>();
                for (Path part : target) {
                    targetSegments.addLast(part.toString());
                }
                while (!targetSegments.isEmpty()) {
                    pending.addFirst(targetSegments.pollLast());
                }
                continue;
            }

            // 不存在的段按字面追加；其下不可能再有真实的链接，后续的 .. 会把它原样弹出
            current = next;
        }
        return current;
    }

    /**
     * 路径解析结果。
     *
     * @param outcome      解析结果分类
     * @param input        调用方原始输入
     * @param absolutePath 规范化后的绝对路径（仅 RESOLVED 时非 null，且一定位于 root 内）
     * @param sandboxPath  沙箱路径（仅 RESOLVED 时非 null）
     * @param reason       失败原因（RESOLVED 时为 null）
     */
    public record PathResolution(
            Outcome outcome,
            String input,
            Path absolutePath,
            String sandboxPath,
            String reason
    ) {

        static PathResolution resolved(String input, Path absolutePath, String sandboxPath) {
            return new PathResolution(Outcome.RESOLVED, input, absolutePath, sandboxPath, null);
        }

        static PathResolution denied(String input) {
            return new PathResolution(Outcome.DENIED, input, null, null, "访问被拒绝：路径超出沙箱根目录范围");
        }

        static PathResolution ioFailure(String input, String reason) {
            return new PathResolution(Outcome.IO_FAILURE, input, null, null, reason);
        }

        public boolean isResolved() {
            return outcome == Outcome.RESOLVED;
        }
    }

    public enum Outcome {
        RESOLVED,
        DENIED,
        IO_FAILURE
    }
}
