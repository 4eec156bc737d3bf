package xyz.firestige.redis.gateway.exception;

/**
 * 命令参数校验异常
 * 在命令发送到 Redis 之前发现参数非法时抛出，指明出错的字段
 */
public class CommandValidationException extends GatewayException {

    private final String field;

    public CommandValidationException(String field, String message) {
        super("INVALID_ARGUMENT", message, ErrorType.VALIDATION_ERROR);
        this.field = field;
        addContext("field", field);
    }

    public String getField() {
        return field;
    }
}
