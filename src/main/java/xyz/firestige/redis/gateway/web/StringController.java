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
import xyz.firestige.redis.gateway.service.BatchSetResult;
import xyz.firestige.redis.gateway.service.StringCommandService;
import xyz.firestige.redis.gateway.web.dto.CounterByRequest;
import xyz.firestige.redis.gateway.web.dto.CounterRequest;
import xyz.firestige.redis.gateway.web.dto.ExpireRequest;
import xyz.firestige.redis.gateway.web.dto.KeysRequest;
import xyz.firestige.redis.gateway.web.dto.SetRangeRequest;
import xyz.firestige.redis.gateway.web.dto.StringSetMultipleRequest;
import xyz.firestige.redis.gateway.web.dto.StringSetRequest;

import java.util.List;

import static xyz.firestige.redis.gateway.web.Arguments.requireText;

/**
 * String 命令
 * <p>
 * curl -X POST localhost:8080/redis/string/set -H 'Content-Type: application/json' \
 * -d '{"key":"token","value":"abc","expire":60,"nx":true}'
 * <p>
 * curl 'localhost:8080/redis/string/get-multiple?keys=a,b,c'
 */
@RestController
@RequestMapping("/redis/string")
public class StringController {

    private final StringCommandService stringCommandService;

    public StringController(StringCommandService stringCommandService) {
        this.stringCommandService = stringCommandService;
    }

    @PostMapping("/set")
    public CommandReply set(@Valid @RequestBody StringSetRequest request) {
        boolean applied = stringCommandService.set(request.key(), request.value(), request.expire(),
                request.onlyIfAbsent(), request.onlyIfPresent(), request.keepExistingTtl());
        return CommandReply.of("key", request.key()).with("success", applied);
    }

    @PostMapping("/set-multiple")
    public CommandReply setMultiple(@Valid @RequestBody StringSetMultipleRequest request) {
        BatchSetResult result = stringCommandService.setMultiple(request.mapping(), request.expire(),
                request.onlyIfAbsent());
        return CommandReply.of("success", result.success())
                .with("atomic", result.atomic())
                .with("results", result.results());
    }

    @GetMapping("/get")
    public CommandReply get(@RequestParam String key) {
        return CommandReply.of("key", key).with("value", stringCommandService.get(requireText(key, "key")));
    }

    @GetMapping("/get-multiple")
    public CommandReply getMultiple(@RequestParam List<String> keys) {
        requireKeys(keys);
        return CommandReply.of("keys", keys).with("values", stringCommandService.getMultiple(keys));
    }

    @GetMapping("/exists")
    public CommandReply exists(@RequestParam String key) {
        return CommandReply.of("key", key).with("exists", stringCommandService.exists(requireText(key, "key")));
    }

    @GetMapping("/exists-multiple")
    public CommandReply existsMultiple(@RequestParam List<String> keys) {
        requireKeys(keys);
        return CommandReply.of("keys", keys).with("count", stringCommandService.existsMultiple(keys));
    }

    @DeleteMapping("/delete")
    public CommandReply delete(@Valid @RequestBody KeysRequest request) {
        return CommandReply.of("keys", request.keys()).with("deleted", stringCommandService.delete(request.keys()));
    }

    @PostMapping("/incr")
    public CommandReply incr(@Valid @RequestBody CounterRequest request) {
        return counterReply(request.key(), stringCommandService.incrBy(request.key(), 1L, request.expire()));
    }

    @PostMapping("/decr")
    public CommandReply decr(@Valid @RequestBody CounterRequest request) {
        return counterReply(request.key(), stringCommandService.decrBy(request.key(), 1L, request.expire()));
    }

    @PostMapping("/incrby")
    public CommandReply incrby(@Valid @RequestBody CounterByRequest request) {
        return counterReply(request.key(),
                stringCommandService.incrBy(request.key(), request.amount(), request.expire()));
    }

    @PostMapping("/decrby")
    public CommandReply decrby(@Valid @RequestBody CounterByRequest request) {
        return counterReply(request.key(),
                stringCommandService.decrBy(request.key(), request.amount(), request.expire()));
    }

    @GetMapping("/strlen")
    public CommandReply strlen(@RequestParam String key) {
        return CommandReply.of("key", key).with("length", stringCommandService.strlen(requireText(key, "key")));
    }

    /**
     * 负数偏移从尾部计算，返回原始子串
     */
    @GetMapping("/getrange")
    public CommandReply getrange(@RequestParam String key, @RequestParam long start, @RequestParam long end) {
        return CommandReply.of("key", key)
                .with("start", start)
                .with("end", end)
                .with("value", stringCommandService.getrange(requireText(key, "key"), start, end));
    }

    @PostMapping("/setrange")
    public CommandReply setrange(@Valid @RequestBody SetRangeRequest request) {
        long length = stringCommandService.setrange(request.key(), request.offset(), request.value());
        return CommandReply.of("key", request.key()).with("length", length);
    }

    @PostMapping("/expire")
    public CommandReply expire(@Valid @RequestBody ExpireRequest request) {
        return CommandReply.of("key", request.key())
                .with("success", stringCommandService.expire(request.key(), request.seconds()));
    }

    @GetMapping("/ttl")
    public CommandReply ttl(@RequestParam String key) {
        return CommandReply.of("key", key).with("ttl", stringCommandService.ttl(requireText(key, "key")));
    }

    private static CommandReply counterReply(String key, long value) {
        return CommandReply.of("key", key).with("value", value);
    }

    private static void requireKeys(List<String> keys) {
        if (keys.isEmpty() || keys.stream().anyMatch(k -> k == null || k.isBlank())) {
            throw new CommandValidationException("keys", "keys 不能为空");
        }
    }
}
