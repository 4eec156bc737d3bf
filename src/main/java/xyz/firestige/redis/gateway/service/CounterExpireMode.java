package xyz.firestige.redis.gateway.service;

import org.springframework.data.redis.core.script.RedisScript;

/**
 * INCR/DECR 系列命令携带 expire 时的过期时间策略
 */
public enum CounterExpireMode {

    /**
     * 仅在本次自增创建了 Key 时设置过期时间（与 Redis 原生语义一致）
     */
    ON_CREATE,

    /**
     * 每次调用都刷新过期时间
     */
    ALWAYS;

    /**
     * 本策略对应的计数脚本，ARGV = INCRBY|DECRBY, amount, ttlSeconds
     */
    RedisScript<Long> script() {
        return this == ALWAYS ? GatewayScripts.COUNTER_EXPIRE_ALWAYS : GatewayScripts.COUNTER_EXPIRE_ON_CREATE;
    }
}
