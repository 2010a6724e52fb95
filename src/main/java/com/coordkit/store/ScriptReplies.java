package com.coordkit.store;

import com.coordkit.exception.StoreProtocolException;

import java.util.List;

/**
 * Lua脚本应答解析（Lettuce返回Long，部分客户端/代理会返回字符串）
 */
final class ScriptReplies {

    private ScriptReplies() {}

    static Long tryToLong(Object value) {
        if (value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof Integer) {
            return ((Integer) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static long toLong(Object value, String script, String field) {
        Long parsed = tryToLong(value);
        if (parsed == null) {
            throw new StoreProtocolException(script + " 脚本返回的 " + field + " 无效: " + value);
        }
        return parsed;
    }

    static List<?> requireList(Object reply, int size, String script) {
        if (!(reply instanceof List)) {
            throw new StoreProtocolException(script + " 脚本返回结构异常: " + reply);
        }
        List<?> values = (List<?>) reply;
        if (values.size() != size) {
            throw new StoreProtocolException(script + " 脚本返回元素个数异常，期望" + size + "个，实际" + values.size() + "个");
        }
        return values;
    }
}
