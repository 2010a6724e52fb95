package com.coordkit.utils;

import cn.hutool.core.util.StrUtil;

public final class KeyUtils {

    private KeyUtils() {}

    /**
     * 拼接前缀和key，前缀为空时原样返回key
     */
    public static String buildKey(String prefix, String key) {
        if (StrUtil.isEmpty(prefix)) {
            return key;
        }
        return prefix + key;
    }

    public static String[] buildKeys(String prefix, String... keys) {
        String[] result = new String[keys.length];
        for (int i = 0; i < keys.length; i++) {
            result[i] = buildKey(prefix, keys[i]);
        }
        return result;
    }

    public static String requireKey(String key) {
        if (StrUtil.isBlank(key)) {
            throw new IllegalArgumentException("key不能为空");
        }
        return key;
    }
}
