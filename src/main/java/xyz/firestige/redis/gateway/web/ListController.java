package xyz.firestige.redis.gateway.web;

import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;
import xyz.firestige.redis.gateway.service.BlockingPopResult;
import xyz.firestige.redis.gateway.service.InsertPosition;
import xyz.firestige.redis.gateway.service.ListCommandService;
import xyz.firestige.redis.gateway.service.ListEnd;
import xyz.firestige.redis.gateway.web.dto.BlockingMoveRequest;
import xyz.firestige.redis.gateway.web.dto.BlockingPopRequest;
import xyz.firestige.redis.gateway.web.dto.ListInsertRequest;
import xyz.firestige.redis.gateway.web.dto.ListPopRequest;
import xyz.firestige.redis.gateway.web.dto.ListPushRequest;
import xyz.firestige.redis.gateway.web.dto.ListRemoveRequest;
import xyz.firestige.redis.gateway.web.dto.ListSetRequest;
import xyz.firestige.redis.gateway.web.dto.ListTrimRequest;

import static xyz.firestige.redis.gateway.web.Arguments.requireText;

/**
 * List 命令
 * <p>
 * BLPOP / BRPOP / BRPOPLPUSH 通过 {@link BlockingCommandDispatcher} 异步执行，
 * 超时无数据时返回 200 且 timeout = true。
 * <p>
 * curl -X POST localhost:8080/redis/list/blpop -H 'Content-Type: application/json' \
 * -d '{"keys":["jobs:high","jobs:low"],"timeout":5}'
 */
@RestController
@RequestMapping("/redis/list")
public class ListController {

    private final ListCommandService listCommandService;
    private final BlockingCommandDispatcher dispatcher;

    public ListController(ListCommandService listCommandService, BlockingCommandDispatcher dispatcher) {
        this.listCommandService = listCommandService;
        this.dispatcher = dispatcher;
    }

    @PostMapping("/lpush")
    public CommandReply lpush(@Valid @RequestBody ListPushRequest request) {
        return pushReply(request.name(), listCommandService.push(ListEnd.LEFT, request.name(), request.values()));
    }

    @PostMapping("/rpush")
    public CommandReply rpush(@Valid @RequestBody ListPushRequest request) {
        return pushReply(request.name(), listCommandService.push(ListEnd.RIGHT, request.name(), request.values()));
    }

    @PostMapping("/lpushx")
    public CommandReply lpushx(@Valid @RequestBody ListPushRequest request) {
        return pushReply(request.name(),
                listCommandService.pushIfExists(ListEnd.LEFT, request.name(), request.values()));
    }

    @PostMapping("/rpushx")
    public CommandReply rpushx(@Valid @RequestBody ListPushRequest request) {
        return pushReply(request.name(),
                listCommandService.pushIfExists(ListEnd.RIGHT, request.name(), request.values()));
    }

    @GetMapping("/llen")
    public CommandReply llen(@RequestParam String name) {
        return CommandReply.of("list", name).with("length", listCommandService.llen(requireText(name, "name")));
    }

    @GetMapping("/lindex")
    public CommandReply lindex(@RequestParam String name, @RequestParam long index) {
        Object value = listCommandService.lindex(requireText(name, "name"), index);
        return CommandReply.of("list", name).with("index", index).with("value", value);
    }

    @PostMapping("/lset")
    public CommandReply lset(@Valid @RequestBody ListSetRequest request) {
        listCommandService.lset(request.name(), request.index(), request.value());
        return CommandReply.of("list", request.name()).with("index", request.index()).with("success", true);
    }

    @GetMapping("/lrange")
    public CommandReply lrange(@RequestParam String name,
                               @RequestParam(defaultValue = "0") long start,
                               @RequestParam(defaultValue = "-1") long end) {
        return CommandReply.of("list", name)
                .with("start", start)
                .with("end", end)
                .with("values", listCommandService.lrange(requireText(name, "name"), start, end));
    }

    @PostMapping("/ltrim")
    public CommandReply ltrim(@Valid @RequestBody ListTrimRequest request) {
        listCommandService.ltrim(request.name(), request.start(), request.end());
        return CommandReply.of("list", request.name())
                .with("start", request.start())
                .with("end", request.end())
                .with("success", true);
    }

    @PostMapping("/linsert")
    public CommandReply linsert(@Valid @RequestBody ListInsertRequest request) {
        long length = listCommandService.linsert(request.name(), InsertPosition.parse(request.position()),
                request.pivot(), request.value());
        return CommandReply.of("list", request.name()).with("length", length);
    }

    @PostMapping("/lpop")
    public CommandReply lpop(@Valid @RequestBody ListPopRequest request) {
        return pop(ListEnd.LEFT, request);
    }

    @PostMapping("/rpop")
    public CommandReply rpop(@Valid @RequestBody ListPopRequest request) {
        return pop(ListEnd.RIGHT, request);
    }

    @PostMapping("/blpop")
    public DeferredResult<CommandReply> blpop(@Valid @RequestBody BlockingPopRequest request) {
        return blockingPop(ListEnd.LEFT, request);
    }

    @PostMapping("/brpop")
    public DeferredResult<CommandReply> brpop(@Valid @RequestBody BlockingPopRequest request) {
        return blockingPop(ListEnd.RIGHT, request);
    }

    @PostMapping("/brpoplpush")
    public DeferredResult<CommandReply> brpoplpush(@Valid @RequestBody BlockingMoveRequest request) {
        long timeout = request.timeoutOrDefault();
        return dispatcher.dispatch("BRPOPLPUSH", timeout, () -> {
            BlockingPopResult result = listCommandService.brpoplpush(request.source(), request.destination(), timeout);
            return CommandReply.of("source", request.source())
                    .with("destination", request.destination())
                    .with("value", result.value())
                    .with("timeout", result.timeout());
        });
    }

    @PostMapping("/lrem")
    public CommandReply lrem(@Valid @RequestBody ListRemoveRequest request) {
        long removed = listCommandService.lrem(request.name(), request.countOrDefault(), request.value());
        return CommandReply.of("list", request.name()).with("removed", removed);
    }

    private CommandReply pop(ListEnd end, ListPopRequest request) {
        if (request.count() == null) {
            return CommandReply.of("list", request.name()).with("value", listCommandService.pop(end, request.name()));
        }
        return CommandReply.of("list", request.name())
                .with("values", listCommandService.pop(end, request.name(), request.count()));
    }

    private DeferredResult<CommandReply> blockingPop(ListEnd end, BlockingPopRequest request) {
        long timeout = request.timeoutOrDefault();
        return dispatcher.dispatch("B" + end.command("POP"), timeout, () -> {
            BlockingPopResult result = listCommandService.blockingPop(end, request.keys(), timeout);
            return CommandReply.of("list", result.list())
                    .with("value", result.value())
                    .with("timeout", result.timeout());
        });
    }

    private static CommandReply pushReply(String name, long length) {
        return CommandReply.of("list", name).with("length", length);
    }
}
