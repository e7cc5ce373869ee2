package org.sandboxfs.filesystem.dto;

/**
 * {@code writeFile} 的返回值。
 *
 * @param path         写入文件的沙箱路径
 * @param bytesWritten 写入的字节数（内容按 UTF-8 编码后的长度）
 * @param sha256       写入内容的 sha256（十六进制）
 */
public record WriteReceipt(String path, long bytesWritten, String sha256) {
}
