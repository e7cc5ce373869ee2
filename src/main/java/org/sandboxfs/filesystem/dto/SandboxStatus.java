package org.sandboxfs.filesystem.dto;

/**
 * 沙箱操作的结果分类。
 * <p>
 * 除 {@link #OK} 外都是“调用方可处理”的失败，不会以异常形式抛出。
 */
public enum SandboxStatus {

    /**
     * 成功。
     */
    OK,

    /**
     * 解析后的路径会逃逸出沙箱根目录（包括通过符号链接逃逸），已拒绝。
     */
    DENIED,

    /**
     * 目标路径不存在。
     */
    NOT_FOUND,

    /**
     * 类型不符：期望文件却是目录，或期望目录却是文件。
     */
    WRONG_TYPE,

    /**
     * 底层文件系统错误（权限、磁盘、链接层级过深等），reason 中保留系统错误信息。
     */
    IO_FAILURE,

    /**
     * 调用参数缺失或不合法（调用方错误，未触及文件系统）。
     */
    INVALID_ARGUMENT,

    /**
     * 文件内容不是合法的 UTF-8（属于 I/O 失败的一种，单独列出便于调用方区分）。
     */
    DECODE_FAILURE
}
