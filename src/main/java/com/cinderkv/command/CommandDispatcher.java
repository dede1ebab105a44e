package com.cinderkv.command;

import com.cinderkv.CinderKVServer;
import com.cinderkv.core.GetSetResult;
import com.cinderkv.core.KVStore;
import com.cinderkv.core.NumericValueException;
import com.cinderkv.network.protocol.Response;
import com.cinderkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes parsed commands against a {@link KVStore} and shapes the reply.
 *
 * Stateless apart from its collaborators, so one instance is shared by every
 * connection.
 */
public class CommandDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    static final String NO_SUCH_KEY = "no such key";
    static final String INTERNAL_ERROR = "internal error";

    private final KVStore store;
    private final MetricsCollector metrics;

    public CommandDispatcher(KVStore store, MetricsCollector metrics) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Execute a command.
     *
     * @param command the command to execute
     * @return the reply; execution failures are returned as error replies
     */
    public Response dispatch(Command command) {
        long startTime = System.nanoTime();
        Response response;
        try {
            response = execute(command);
        } catch (NumericValueException e) {
            metrics.recordError(MetricsCollector.KIND_EXECUTION);
            response = Response.error(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error executing {}", command, e);
            metrics.recordError(MetricsCollector.KIND_INTERNAL);
            response = Response.error(INTERNAL_ERROR);
        }
        metrics.recordCommand(command.getType().displayName(), System.nanoTime() - startTime);
        return response;
    }

    private Response execute(Command command) {
        switch (command.getType()) {
            case SET:
                return handleSet((Command.Set) command);
            case GET:
                return handleGet((Command.Get) command);
            case DEL:
                return handleDel((Command.Del) command);
            case EXISTS:
                return handleExists((Command.Exists) command);
            case APPEND: {
                Command.Append append = (Command.Append) command;
                return Response.integer(store.append(append.getKeyUnsafe(), append.getValueUnsafe()));
            }
            case STRLEN:
                return Response.integer(store.strlen(((Command.Strlen) command).getKeyUnsafe()));
            case GETRANGE: {
                Command.GetRange range = (Command.GetRange) command;
                return Response.bulk(store.getRange(range.getKeyUnsafe(), range.getStart(), range.getEnd()));
            }
            case SETRANGE: {
                Command.SetRange range = (Command.SetRange) command;
                return Response.integer(store.setRange(range.getKeyUnsafe(), range.getOffset(), range.getValueUnsafe()));
            }
            case INCR:
            case INCRBY:
            case DECR:
            case DECRBY:
                return handleCounter((Command.Counter) command);
            case MGET:
                return Response.array(store.multiGet(((Command.MGet) command).getKeys()));
            case MSET:
                store.multiSet(((Command.MSet) command).getPairs());
                return Response.ok();
            case GETSET:
                return handleGetSet((Command.GetSet) command);
            case KEYS:
                return Response.array(store.keys(((Command.Keys) command).getPatternUnsafe()));
            case FLUSHALL:
                store.flushAll();
                return Response.ok();
            case HELLO:
                return handleHello();
            case CLIENT:
                return Response.ok();
            case PING: {
                Command.Connection ping = (Command.Connection) command;
                return ping.hasArgument() ? Response.bulk(ping.getArgumentUnsafe()) : Response.pong();
            }
            default:
                throw new IllegalStateException("Unhandled command type: " + command.getType());
        }
    }

    private Response handleSet(Command.Set set) {
        if (set.hasTtl()) {
            store.setWithTtl(set.getKeyUnsafe(), set.getValueUnsafe(), set.getTtlMillis());
        } else {
            store.set(set.getKeyUnsafe(), set.getValueUnsafe());
        }
        return Response.ok();
    }

    private Response handleGet(Command.Get get) {
        Optional<byte[]> value = store.get(get.getKeyUnsafe());
        metrics.recordKeyspace(value.isPresent());
        return value.map(Response::bulk).orElseGet(Response::nullBulk);
    }

    private Response handleDel(Command.Del del) {
        long deleted = 0;
        for (byte[] key : del.getKeys()) {
            if (store.delete(key)) {
                deleted++;
            }
        }
        return Response.integer(deleted);
    }

    private Response handleExists(Command.Exists exists) {
        // repeated keys are counted each time
        long count = 0;
        for (byte[] key : exists.getKeys()) {
            if (store.exists(key)) {
                count++;
            }
        }
        return Response.integer(count);
    }

    private Response handleCounter(Command.Counter counter) {
        byte[] key = counter.getKeyUnsafe();
        long result;
        switch (counter.getType()) {
            case INCR:
                result = store.increment(key);
                break;
            case DECR:
                result = store.decrement(key);
                break;
            case INCRBY:
                result = store.incrementBy(key, counter.getAmount());
                break;
            case DECRBY:
                result = store.decrementBy(key, counter.getAmount());
                break;
            default:
                throw new IllegalStateException("Not a counter command: " + counter.getType());
        }
        return Response.integer(result);
    }

    private Response handleGetSet(Command.GetSet getSet) {
        GetSetResult result = store.getAndSet(getSet.getKeyUnsafe(), getSet.getValueUnsafe());
        if (!result.existed()) {
            // the new value is stored even though the reply is an error
            return Response.error(NO_SUCH_KEY);
        }
        return Response.bulk(result.getPrevious());
    }

    private Response handleHello() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("server", "cinderkv");
        fields.put("version", CinderKVServer.VERSION);
        fields.put("proto", "3");
        fields.put("mode", "standalone");
        return Response.map(fields);
    }

    /**
     * Parse and execute a request in one step, turning parse failures into
     * error replies.
     *
     * @param tokens the request tokens, command name first
     * @return the reply
     */
    public Response handle(List<byte[]> tokens) {
        Command command;
        try {
            command = RequestParser.parse(tokens);
        } catch (CommandParseException e) {
            metrics.recordError(MetricsCollector.KIND_PARSE);
            return Response.error(e.getMessage());
        }
        return dispatch(command);
    }
}
