package org.sandboxfs.filesystem.dto;

/**
 * 目录列表项（非递归）。
 *
 * @param name 名称（文件名/目录名）
 * @param type 类型（符号链接按其指向的类型计算）
 */
public record DirectoryEntry(String name, EntryType type) {

    /**
     * 单行展示格式，例如 {@code "notes.txt" (文件)}。
     */
    public String display() {
        return "\"" + name + "\" (" + type.label() + ")";
    }
}
