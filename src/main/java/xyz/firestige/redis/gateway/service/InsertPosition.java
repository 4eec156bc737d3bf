package xyz.firestige.redis.gateway.service;

import java.util.Locale;

/**
 * LINSERT 插入位置
 */
public enum InsertPosition {
    BEFORE,
    AFTER;

    /**
     * 大小写不敏感解析，非法值返回 null
     */
    public static InsertPosition parse(String value) {
        if (value == null) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
