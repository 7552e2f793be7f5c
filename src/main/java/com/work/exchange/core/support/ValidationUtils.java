package com.work.exchange.core.support;

import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验与十六进制标识的规范化逻辑，减少代码重复
 */
public final class ValidationUtils {

    /**
     * app 名称合法字符集与长度限制：
     * 仅允许大小写字母、数字以及少量分隔符，长度 1~64。
     */
    private static final Pattern APP_NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]{1,64}$");

    private static final Pattern HEX_PATTERN = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    /**
     * 校验long值必须大于0
     */
    public static long requirePositive(long value, String paramName) {
        if (value <= 0) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return value;
    }

    /**
     * 校验long值必须非负
     */
    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    /**
     * 校验 app 名称的格式与长度。
     * <p>约束：长度 1~64，仅允许 [a-zA-Z0-9._-]。</p>
     */
    public static String requireValidAppName(String name) {
        requireNonEmpty(name, "appName");
        if (!APP_NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("appName 非法，只允许 1~64 位的字母、数字、'.'、'_'、'-'");
        }
        return name;
    }

    /**
     * 判断是否为 20 字节地址（0x 前缀 + 40 位十六进制）。
     */
    public static boolean isAddress(String value) {
        return value != null && value.startsWith("0x") && WalletUtils.isValidAddress(value);
    }

    /**
     * 地址统一转为小写，作为身份比较的唯一形式。
     */
    public static String normalizeAddress(String value, String paramName) {
        requireNonEmpty(value, paramName);
        if (!isAddress(value)) {
            throw new IllegalArgumentException(paramName + " 不是合法地址: " + value);
        }
        return value.toLowerCase(Locale.ROOT);
    }

    /**
     * 判断是否为恰好 byteLength 字节的 0x 十六进制串。
     */
    public static boolean isHexOfLength(String value, int byteLength) {
        return value != null
                && HEX_PATTERN.matcher(value).matches()
                && Numeric.cleanHexPrefix(value).length() == byteLength * 2;
    }

    /**
     * 任意字节长度（含空串 "0x"）的十六进制串。
     */
    public static boolean isHex(String value) {
        return value != null && HEX_PATTERN.matcher(value).matches();
    }
}
