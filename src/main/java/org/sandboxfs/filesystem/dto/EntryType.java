package org.sandboxfs.filesystem.dto;

/**
 * 目录条目类型。
 */
public enum EntryType {
    FILE("文件"),
    DIRECTORY("目录");

    private final String label;

    EntryType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
