package xyz.firestige.redis.gateway.web;

import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import xyz.firestige.redis.gateway.exception.CommandValidationException;
import xyz.firestige.redis.gateway.service.HashCommandService;
import xyz.firestige.redis.gateway.service.HashScanResult;
import xyz.firestige.redis.gateway.web.dto.HashFieldValueRequest;
import xyz.firestige.redis.gateway.web.dto.HashFieldsRequest;
import xyz.firestige.redis.gateway.web.dto.HashIncrementRequest;
import xyz.firestige.redis.gateway.web.dto.HashSetRequest;

import static xyz.firestige.redis.gateway.web.Arguments.requireText;

/**
 * Hash 命令
 * <p>
 * curl -X POST localhost:8080/redis/hash/hset -H 'Content-Type: application/json' \
 * -d '{"name":"user:1","mapping":{"age":18,"tags":["a","b"]}}'
 */
@RestController
@RequestMapping("/redis/hash")
public class HashController {

    private final HashCommandService hashCommandService;

    public HashController(HashCommandService hashCommandService) {
        this.hashCommandService = hashCommandService;
    }

    @PostMapping("/hset")
    public CommandReply hset(@Valid @RequestBody HashSetRequest request) {
        long added = hashCommandService.hset(request.name(), request.key(), request.value(), request.mapping());
        return CommandReply.of("hash", request.name()).with("added", added);
    }

    @PostMapping("/hsetnx")
    public CommandReply hsetnx(@Valid @RequestBody HashFieldValueRequest request) {
        boolean written = hashCommandService.hsetnx(request.name(), request.key(), request.value());
        return CommandReply.of("hash", request.name()).with("key", request.key()).with("written", written);
    }

    /**
     * curl 'localhost:8080/redis/hash/hscan?name=user:1&cursor=0&match=a*&count=100'
     */
    @GetMapping("/hscan")
    public CommandReply hscan(@RequestParam String name,
                              @RequestParam(defaultValue = "0") String cursor,
                              @RequestParam(required = false) String match,
                              @RequestParam(required = false) Integer count) {
        requireText(name, "name");
        requireText(cursor, "cursor");
        if (count != null && count <= 0) {
            throw new CommandValidationException("count", "count 必须为正数");
        }
        HashScanResult result = hashCommandService.hscan(name, cursor, match, count);
        return CommandReply.of("hash", name)
                .with("cursor", result.cursor())
                .with("entries", result.entries())
                .with("complete", result.isComplete());
    }

    @GetMapping("/hget")
    public CommandReply hget(@RequestParam String name, @RequestParam String key) {
        Object value = hashCommandService.hget(requireText(name, "name"), requireText(key, "key"));
        return CommandReply.of("hash", name).with("key", key).with("value", value);
    }

    @PostMapping("/hmget")
    public CommandReply hmget(@Valid @RequestBody HashFieldsRequest request) {
        return CommandReply.of("hash", request.name())
                .with("values", hashCommandService.hmget(request.name(), request.keys()));
    }

    @GetMapping("/hgetall")
    public CommandReply hgetall(@RequestParam String name) {
        return CommandReply.of("hash", name).with("entries", hashCommandService.hgetall(requireText(name, "name")));
    }

    @DeleteMapping("/hdel")
    public CommandReply hdel(@Valid @RequestBody HashFieldsRequest request) {
        return CommandReply.of("hash", request.name())
                .with("removed", hashCommandService.hdel(request.name(), request.keys()));
    }

    @GetMapping("/hexists")
    public CommandReply hexists(@RequestParam String name, @RequestParam String key) {
        boolean exists = hashCommandService.hexists(requireText(name, "name"), requireText(key, "key"));
        return CommandReply.of("hash", name).with("key", key).with("exists", exists);
    }

    @GetMapping("/hlen")
    public CommandReply hlen(@RequestParam String name) {
        return CommandReply.of("hash", name).with("length", hashCommandService.hlen(requireText(name, "name")));
    }

    @GetMapping("/hkeys")
    public CommandReply hkeys(@RequestParam String name) {
        return CommandReply.of("hash", name).with("keys", hashCommandService.hkeys(requireText(name, "name")));
    }

    @GetMapping("/hvals")
    public CommandReply hvals(@RequestParam String name) {
        return CommandReply.of("hash", name).with("values", hashCommandService.hvals(requireText(name, "name")));
    }

    @PostMapping("/hincrby")
    public CommandReply hincrby(@Valid @RequestBody HashIncrementRequest request) {
        long value = hashCommandService.hincrby(request.name(), request.key(), request.increment());
        return CommandReply.of("hash", request.name()).with("key", request.key()).with("value", value);
    }
}
