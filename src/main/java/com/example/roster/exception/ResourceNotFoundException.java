package com.example.roster.exception;

/**
 * 指定IDのリソースが存在しない場合の例外。APIでは404になる。
 */
public class ResourceNotFoundException extends BusinessException {

    public static final String NOT_FOUND = "NOT_FOUND";

    public ResourceNotFoundException(String message, Object... parameters) {
        super(NOT_FOUND, message, parameters);
    }
}
