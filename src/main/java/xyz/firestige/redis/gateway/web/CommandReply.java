package xyz.firestige.redis.gateway.web;

import java.util.LinkedHashMap;

/**
 * 命令响应体
 * 按插入顺序序列化，允许 null 值（缺失的 Key / 字段序列化为 null）
 */
public class CommandReply extends LinkedHashMap<String, Object> {

    public static CommandReply of(String name, Object value) {
        return new CommandReply().with(name, value);
    }

    public CommandReply with(String name, Object value) {
        put(name, value);
        return this;
    }
}
