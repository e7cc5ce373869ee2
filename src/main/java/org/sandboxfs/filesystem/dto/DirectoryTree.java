package org.sandboxfs.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code getDirectoryTree} 的返回值。
 *
 * @param path        起始目录的沙箱路径
 * @param directories 沙箱目录路径 -> 该目录直接子项的换行拼接文本（先文件，后带 “(目录)” 标记的子目录），按遍历顺序
 * @param truncated   是否因深度/目录数上限而提前停止
 * @param warnings    非致命告警（跳过了越界链接、循环引用、无法访问的目录等）
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record DirectoryTree(
        String path,
        Map<String, String> directories,
        boolean truncated,
        List<String> warnings
) {

    public DirectoryTree {
        directories = Collections.unmodifiableMap(new LinkedHashMap<>(directories));
        warnings = List.copyOf(warnings);
    }
}
