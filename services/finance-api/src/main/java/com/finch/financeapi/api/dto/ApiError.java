package com.finch.financeapi.api.dto;

/**
 * Error body shared by every failing response:
 *
 * <pre>
 * {"error": {"code": 401, "message": "Invalid or expired authorization token"}}
 * </pre>
 */
public record ApiError(Detail error) {

    public record Detail(int code, String message) {}

    public static ApiError of(int code, String message) {
        return new ApiError(new Detail(code, message));
    }
}
