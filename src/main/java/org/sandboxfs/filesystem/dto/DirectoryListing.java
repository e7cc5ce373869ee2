package org.sandboxfs.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code listContents} 的返回值。
 *
 * @param path    当前目录的沙箱路径
 * @param entries 直接子项，按名称排序
 * @param count   子项数量
 */
public record DirectoryListing(
        String path,
        List<DirectoryEntry> entries,
        int count
) {

    public DirectoryListing {
        entries = List.copyOf(entries);
    }

    /**
     * 每行一个条目的文本形式，序列化为 {@code files} 字段。
     */
    @JsonProperty("files")
    public String formatted() {
        return entries.stream().map(DirectoryEntry::display).collect(Collectors.joining("\n"));
    }
}
