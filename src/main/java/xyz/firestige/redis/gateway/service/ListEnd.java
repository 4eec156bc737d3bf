package xyz.firestige.redis.gateway.service;

/**
 * 列表端：头部（L*）或尾部（R*）
 */
public enum ListEnd {
    LEFT("L"),
    RIGHT("R");

    private final String prefix;

    ListEnd(String prefix) {
        this.prefix = prefix;
    }

    /**
     * 拼接命令名，例如 LEFT.command("PUSH") = "LPUSH"
     */
    public String command(String suffix) {
        return prefix + suffix;
    }
}
