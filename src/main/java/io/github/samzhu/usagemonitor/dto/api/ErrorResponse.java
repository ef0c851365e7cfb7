package io.github.samzhu.usagemonitor.dto.api;

/**
 * API 錯誤回應。
 *
 * @param error 錯誤代碼
 * @param message 錯誤說明
 */
public record ErrorResponse(
    String error,
    String message
) {}
