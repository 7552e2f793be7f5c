package com.work.exchange.core.exception;

/**
 * app / account 注册表相关的失败（重复注册、记录不存在、签名不匹配等）。
 */
public class RegistryException extends ExchangeException {

    public static final String APP_ALREADY_EXISTS = "app already exists";
    public static final String APP_NOT_FOUND = "app does not exist";
    public static final String ACCOUNT_ALREADY_EXISTS = "account already exists";
    public static final String ACCOUNT_NOT_FOUND = "account does not exist";
    public static final String NOT_TEMPORARY = "not a temporary account";
    public static final String IDENTITY_MISMATCH = "identity mismatch";
    public static final String INVALID_SIGNATURE = "invalid signature";

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
