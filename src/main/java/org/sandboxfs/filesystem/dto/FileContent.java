package org.sandboxfs.filesystem.dto;

/**
 * {@code readFile} 的返回值。
 *
 * @param path    文件的沙箱路径
 * @param content 完整的 UTF-8 文本内容
 */
public record FileContent(String path, String content) {
}
