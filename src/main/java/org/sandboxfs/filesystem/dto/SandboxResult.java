package org.sandboxfs.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * 沙箱操作的统一返回结构。
 *
 * @param status 结果分类
 * @param path   回显的路径：解析成功时为沙箱路径（如 {@code /a/b}），被拒绝时为调用方原始输入
 * @param value  成功时的返回值（失败时为 null）
 * @param reason 失败原因（成功时为 null）
 * @param <T>    返回值类型
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SandboxResult<T>(
        SandboxStatus status,
        String path,
        T value,
        String reason
) {

    public SandboxResult {
        Objects.requireNonNull(status, "status");
    }

    public static <T> SandboxResult<T> ok(String path, T value) {
        return new SandboxResult<>(SandboxStatus.OK, path, value, null);
    }

    public static <T> SandboxResult<T> failure(SandboxStatus status, String path, String reason) {
        if (status == SandboxStatus.OK) {
            throw new IllegalArgumentException("失败结果不能使用 OK 状态");
        }
        return new SandboxResult<>(status, path, null, reason);
    }

    public static <T> SandboxResult<T> denied(String path) {
        return failure(SandboxStatus.DENIED, path, "访问被拒绝：路径超出沙箱根目录范围");
    }

    @JsonIgnore
    public boolean isOk() {
        return status == SandboxStatus.OK;
    }
}
