package xyz.firestige.redis.gateway.service;

import java.util.Map;

/**
 * 批量 SET 结果
 *
 * @param success 所有 Key 均写入成功
 * @param results 每个 Key 是否写入（保持请求顺序）
 * @param atomic  是否由单条原子命令（MSET / MSETNX）完成
 */
public record BatchSetResult(boolean success, Map<String, Boolean> results, boolean atomic) {
}
