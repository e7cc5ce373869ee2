package org.sandboxfs.filesystem;

import org.sandboxfs.filesystem.SandboxPathResolver.PathResolution;
import org.sandboxfs.filesystem.dto.DirectoryEntry;
import org.sandboxfs.filesystem.dto.DirectoryListing;
import org.sandboxfs.filesystem.dto.DirectoryTree;
import org.sandboxfs.filesystem.dto.EntryType;
import org.sandboxfs.filesystem.dto.FileContent;
import org.sandboxfs.filesystem.dto.SandboxResult;
import org.sandboxfs.filesystem.dto.SandboxStatus;
import org.sandboxfs.filesystem.dto.WriteReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 沙箱文件系统：在真实文件系统之上提供“根目录 + 虚拟当前目录”的受限文件操作。
 * <p>
 * 约定：
 * <ul>
 *   <li>所有调用方路径先经过 {@link SandboxPathResolver} 解析，越界的请求在任何修改发生之前就被拒绝。</li>
 *   <li>对外只暴露沙箱路径（{@code /}、{@code /a/b}），不暴露真实的绝对路径。</li>
 *   <li>“拒绝 / 不存在 / 类型不符 / I/O 失败”都以 {@link SandboxResult} 返回，不抛异常。</li>
 * </ul>
 * <p>
 * 并发：当前目录是唯一的可变状态，所有读取与修改都在 {@code cursorLock} 上串行；
 * 其余操作在解析完成后只处理绝对路径，不再加锁。
 */
public class SandboxedFileSystem {

    private static final Logger log = LoggerFactory.getLogger(SandboxedFileSystem.class);

    /**
     * 原子写入使用的临时文件前缀；列目录时会过滤掉这类文件。
     */
    static final String TEMP_FILE_PREFIX = ".sandbox-write-";

    private final Path root;
    private final SandboxPathResolver resolver;
    private final FileAttribute<?>[] directoryAttributes;
    private final int treeMaxDepth;
    private final int treeMaxDirectories;

    private final Object cursorLock = new Object();
    private Path currentDirectory;

    public SandboxedFileSystem(Path root) {
        this(root, new SandboxProperties());
    }

    public SandboxedFileSystem(Path root, SandboxProperties properties) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(properties, "properties");
        try {
            this.root = root.toAbsolutePath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("沙箱根目录不存在或无法解析：" + root, e);
        }
        if (!Files.isDirectory(this.root)) {
            throw new IllegalStateException("沙箱根目录不是目录：" + root);
        }
        this.resolver = new SandboxPathResolver(this.root);
        this.directoryAttributes = directoryAttributes(this.root, properties.getDirectoryPermissions());
        this.treeMaxDepth = properties.getTreeMaxDepth();
        this.treeMaxDirectories = properties.getTreeMaxDirectories();
        this.currentDirectory = this.root;
        log.info("沙箱已就绪：root={}", this.root);
    }

    /**
     * 沙箱根目录的真实路径（仅供进程内协作组件使用，不应返回给不受信任的调用方）。
     */
    public Path root() {
        return root;
    }

    /**
     * 按当前目录解析路径，供需要“先校验保存位置再写入”的协作组件使用。
     */
    public PathResolution resolve(String path) {
        return resolver.resolve(path, snapshotCursor());
    }

    public SandboxResult<Boolean> exists(String path) {
        PathResolution resolved = resolve(path);
        if (!resolved.isResolved()) {
            return rejected(resolved);
        }
        return SandboxResult.ok(resolved.sandboxPath(), Files.exists(resolved.absolutePath()));
    }

    /**
     * 当前目录的沙箱路径（根目录为 {@code /}）。
     */
    public String currentDirectory() {
        return resolver.toSandboxPath(snapshotCursor());
    }

    public SandboxResult<String> changeDirectory(String path) {
        synchronized (cursorLock) {
            PathResolution resolved = resolver.resolve(path, currentDirectory);
            if (!resolved.isResolved()) {
                return rejected(resolved);
            }
            Path target = resolved.absolutePath();
            if (!Files.exists(target)) {
                return SandboxResult.failure(SandboxStatus.NOT_FOUND, resolved.sandboxPath(),
                        "切换失败：目录不存在 - " + resolved.sandboxPath());
            }
            if (!Files.isDirectory(target)) {
                return SandboxResult.failure(SandboxStatus.WRONG_TYPE, resolved.sandboxPath(),
                        "切换失败：" + resolved.sandboxPath() + " 不是一个目录");
            }
            currentDirectory = target;
            log.debug("当前目录切换为 {}", resolved.sandboxPath());
            return SandboxResult.ok(resolved.sandboxPath(), resolved.sandboxPath());
        }
    }

    public SandboxResult<DirectoryListing> listContents() {
        // 重新解析当前目录：它可能已被外部删除，或被替换成指向根目录外的链接
        PathResolution resolved = resolve(".");
        if (!resolved.isResolved()) {
            return rejected(resolved);
        }
        Path dir = resolved.absolutePath();
        if (!Files.exists(dir)) {
            return SandboxResult.failure(SandboxStatus.NOT_FOUND, resolved.sandboxPath(), "当前目录不存在");
        }
        if (!Files.isDirectory(dir)) {
            return SandboxResult.failure(SandboxStatus.WRONG_TYPE, resolved.sandboxPath(), "当前路径不是一个目录");
        }

        List<DirectoryEntry> entries;
        try {
            entries = listChildren(dir);
        } catch (NoSuchFileException | NotDirectoryException e) {
            return SandboxResult.failure(SandboxStatus.NOT_FOUND, resolved.sandboxPath(), "当前目录不存在");
        } catch (IOException e) {
            return ioFailure(resolved.sandboxPath(), "列出目录失败", e);
        }
        return SandboxResult.ok(resolved.sandboxPath(), new DirectoryListing(resolved.sandboxPath(), entries, entries.size()));
    }

    public SandboxResult<String> makeDirectory(String path) {
        PathResolution resolved = resolve(path);
        if (!resolved.isResolved()) {
            return rejected(resolved);
        }
        Path target = resolved.absolutePath();
        if (Files.exists(target) && !Files.isDirectory(target)) {
            return SandboxResult.failure(SandboxStatus.WRONG_TYPE, resolved.sandboxPath(),
                    "创建目录失败：" + resolved.sandboxPath() + " 已存在且不是目录");
        }
        try {
            Files.createDirectories(target, directoryAttributes);
        } catch (FileAlreadyExistsException e) {
            return SandboxResult.failure(SandboxStatus.WRONG_TYPE, resolved.sandboxPath(),
                    "创建目录失败：路径中存在同名文件 - " + sanitize(e));
        } catch (IOException e) {
            return ioFailure(resolved.sandboxPath(), "创建目录失败", e);
        }
        log.debug("已创建目录 {}", resolved.sandboxPath());
        return SandboxResult.ok(resolved.sandboxPath(), resolved.sandboxPath());
    }

    /**
     * 写入文件：内容按 UTF-8 编码后<b>整体覆盖</b>目标文件（不追加、不合并），调用方必须提供完整内容。
     */
    public SandboxResult<WriteReceipt> writeFile(String path, String content) {
        Objects.requireNonNull(content, "content");
        PathResolution resolved = resolve(path);
        if (!resolved.isResolved()) {
            return rejected(resolved);
        }
        Path target = resolved.absolutePath();
        if (Files.isDirectory(target)) {
            return SandboxResult.failure(SandboxStatus.WRONG_TYPE, resolved.sandboxPath(),
                    "写入文件失败：目标路径是目录");
        }

        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        try {
            Path parent = target.getParent();
            if (!Files.isDirectory(parent)) {
                Files.createDirectories(parent, directoryAttributes);
            }
            writeAtomically(target, bytes);
        } catch (FileAlreadyExistsException e) {
            return SandboxResult.failure(SandboxStatus.WRONG_TYPE, resolved.sandboxPath(),
                    "写入文件失败：父路径中存在同名文件 - " + sanitize(e));
        } catch (IOException e) {
            return ioFailure(resolved.sandboxPath(), "写入文件失败", e);
        }
        log.debug("已写入文件 {}（{} 字节）", resolved.sandboxPath(), bytes.length);
        return SandboxResult.ok(resolved.sandboxPath(),
                new WriteReceipt(resolved.sandboxPath(), bytes.length, HashingUtils.sha256Hex(bytes)));
    }

    public SandboxResult<FileContent> readFile(String path) {
        PathResolution resolved = resolve(path);
        if (!resolved.isResolved()) {
            return rejected(resolved);
        }
        Path file = resolved.absolutePath();
        if (Files.isDirectory(file)) {
            return SandboxResult.failure(SandboxStatus.WRONG_TYPE, resolved.sandboxPath(), "无法读取目录内容");
        }
        if (!Files.exists(file)) {
            return SandboxResult.failure(SandboxStatus.NOT_FOUND, resolved.sandboxPath(), "文件不存在");
        }
        // 命名管道、设备文件等读取可能永久阻塞
        if (!Files.isRegularFile(file)) {
            return SandboxResult.failure(SandboxStatus.WRONG_TYPE, resolved.sandboxPath(), "无法读取：不是普通文件");
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return SandboxResult.failure(SandboxStatus.NOT_FOUND, resolved.sandboxPath(), "文件不存在");
        } catch (IOException e) {
            return ioFailure(resolved.sandboxPath(), "读取文件失败", e);
        }

        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return SandboxResult.ok(resolved.sandboxPath(), new FileContent(resolved.sandboxPath(), text));
        } catch (CharacterCodingException e) {
            return SandboxResult.failure(SandboxStatus.DECODE_FAILURE, resolved.sandboxPath(),
                    "读取文件失败：内容不是合法的 UTF-8 文本");
        }
    }

    /**
     * 递归列出目录树。
     * <p>
     * 会跟随符号链接目录，但每个被访问的目录都要重新做一次根目录范围校验；
     * 链接目录的目标若已展开过则不再重复展开（真实目录本身总会出现在结果中），
     * 祖先循环由 {@code walkFileTree} 检测，并受最大深度/最大目录数限制。
     */
    public SandboxResult<DirectoryTree> getDirectoryTree(String path) {
        PathResolution resolved = resolve(path);
        if (!resolved.isResolved()) {
            return rejected(resolved);
        }
        Path start = resolved.absolutePath();
        if (!Files.exists(start)) {
            return SandboxResult.failure(SandboxStatus.NOT_FOUND, resolved.sandboxPath(), "目录不存在：" + resolved.sandboxPath());
        }
        if (!Files.isDirectory(start)) {
            return SandboxResult.failure(SandboxStatus.WRONG_TYPE, resolved.sandboxPath(), resolved.sandboxPath() + " 不是一个目录");
        }

        Map<String, String> directories = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        Set<Path> visitedRealDirs = new HashSet<>();
        boolean[] truncated = new boolean[]{false};

        try {
            // maxDepth + 1：最后一层目录只出现在父目录的列表里，不再展开
            Files.walkFileTree(start, EnumSet.of(FileVisitOption.FOLLOW_LINKS), treeMaxDepth + 1, new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    String key = resolver.toSandboxPath(dir);
                    Path real;
                    try {
                        real = dir.toRealPath();
                    } catch (IOException e) {
                        warnings.add("目录无法解析，已跳过：" + key);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (!resolver.isWithinRoot(real)) {
                        warnings.add("已跳过指向根目录范围外的链接目录：" + key);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    // 真实目录总是记录；只有链接目录在目标已展开过时才跳过
                    if (!visitedRealDirs.add(real) && Files.isSymbolicLink(dir)) {
                        warnings.add("链接目录指向已列出的目录，未重复展开：" + key);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (directories.size() >= treeMaxDirectories) {
                        truncated[0] = true;
                        return FileVisitResult.TERMINATE;
                    }

                    try {
                        directories.put(key, formatTreeListing(listChildren(dir)));
                    } catch (IOException e) {
                        warnings.add("目录无法读取，已跳过：" + key + "（" + sanitize(e) + "）");
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isDirectory()) {
                        truncated[0] = true;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    String key = resolver.toSandboxPath(file);
                    if (exc instanceof FileSystemLoopException) {
                        warnings.add("疑似存在循环引用，已跳过目录：" + key);
                    } else {
                        warnings.add("无法访问，已跳过：" + key + "（" + sanitize(exc) + "）");
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            return ioFailure(resolved.sandboxPath(), "遍历目录失败", e);
        }

        if (truncated[0]) {
            warnings.add("目录树已截断（最大深度 " + treeMaxDepth + "，最大目录数 " + treeMaxDirectories + "）");
        }
        return SandboxResult.ok(resolved.sandboxPath(),
                new DirectoryTree(resolved.sandboxPath(), directories, truncated[0], warnings));
    }

    private Path snapshotCursor() {
        synchronized (cursorLock) {
            return currentDirectory;
        }
    }

    private static List<DirectoryEntry> listChildren(Path dir) throws IOException {
        List<DirectoryEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                if (child.getFileName().toString().startsWith(TEMP_FILE_PREFIX)) {
                    continue;
                }
                EntryType type = Files.isDirectory(child) ? EntryType.DIRECTORY : EntryType.FILE;
                entries.add(new DirectoryEntry(child.getFileName().toString(), type));
            }
        }
        entries.sort(Comparator.comparing(DirectoryEntry::name));
        return entries;
    }

    /**
     * 目录树中单个目录的文本：先列文件，再列带类型标记的子目录，每行一个。
     */
    private static String formatTreeListing(List<DirectoryEntry> children) {
        List<String> lines = new ArrayList<>(children.size());
        for (DirectoryEntry child : children) {
            if (child.type() == EntryType.FILE) {
                lines.add(child.name());
            }
        }
        for (DirectoryEntry child : children) {
            if (child.type() == EntryType.DIRECTORY) {
                lines.add(child.name() + " (" + EntryType.DIRECTORY.label() + ")");
            }
        }
        return String.join("\n", lines);
    }

    private static void writeAtomically(Path target, byte[] bytes) throws IOException {
        // 先写同目录临时文件，再 move 替换目标；ATOMIC_MOVE 不支持时降级为普通替换
        Path tmp = Files.createTempFile(target.getParent(), TEMP_FILE_PREFIX, ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("清理临时文件失败：{}", tmp, e);
            }
        }
    }

    private static FileAttribute<?>[] directoryAttributes(Path root, String permissions) {
        if (!root.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            return new FileAttribute<?>[0];
        }
        return new FileAttribute<?>[]{PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString(permissions))};
    }

    private <T> SandboxResult<T> rejected(PathResolution resolved) {
        if (resolved.outcome() == SandboxPathResolver.Outcome.DENIED) {
            log.info("已拒绝越界路径：{}", resolved.input());
            return SandboxResult.denied(resolved.input());
        }
        log.warn("路径解析失败：{}（{}）", resolved.input(), resolved.reason());
        return SandboxResult.failure(SandboxStatus.IO_FAILURE, resolved.input(), resolved.reason());
    }

    private <T> SandboxResult<T> ioFailure(String sandboxPath, String action, IOException e) {
        String message = sanitize(e);
        log.warn("{}：{}（{}）", action, sandboxPath, message);
        return SandboxResult.failure(SandboxStatus.IO_FAILURE, sandboxPath, action + "：" + sandboxPath + "，错误：" + message);
    }

    /**
     * 把系统错误信息中的真实根目录替换为沙箱路径，避免向调用方泄露真实的目录布局。
     */
    private String sanitize(IOException e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        String rootText = root.toString();
        String replaced = message.replace(rootText + root.getFileSystem().getSeparator(), "/").replace(rootText, "/");
        return e.getClass().getSimpleName() + ": " + replaced;
    }
}
