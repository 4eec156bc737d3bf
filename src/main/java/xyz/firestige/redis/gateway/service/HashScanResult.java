package xyz.firestige.redis.gateway.service;

import java.util.Map;

/**
 * 单步 HSCAN 结果
 *
 * @param cursor  下一次调用使用的游标，"0" 表示遍历结束
 * @param entries 本批次返回的字段（可能与之前批次重复）
 */
public record HashScanResult(String cursor, Map<String, Object> entries) {

    public boolean isComplete() {
        return "0".equals(cursor);
    }
}
