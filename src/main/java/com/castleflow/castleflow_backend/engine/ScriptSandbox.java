package com.castleflow.castleflow_backend.engine;

import com.castleflow.castleflow_backend.api.ChatOptions;
import com.castleflow.castleflow_backend.api.SpeechOptions;
import com.castleflow.castleflow_backend.api.SystemApi;
import com.castleflow.castleflow_backend.config.AutomateProperties;
import com.castleflow.castleflow_backend.model.execution.LogLevel;
import com.castleflow.castleflow_backend.model.execution.NotificationSeverity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.io.IOAccess;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.graalvm.polyglot.proxy.ProxyObject;
import org.springframework.stereotype.Component;

import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs user scripts on GraalJS.
 * <p>
 * A script is the body of an async function that sees exactly three bindings:
 * {@code api} (the system facade), {@code input} (alias {@code inp}) and
 * {@code variables} (alias {@code vars}). The context gets no host class lookup,
 * no reflection on host objects, no IO, no environment and no threads. Every call
 * runs in a fresh context on the caller's thread; parsed code is cached by the shared engine.
 */
@Slf4j
@Component
public class ScriptSandbox {

    private static final String LANGUAGE = "js";

    private final Engine engine;
    private final ObjectMapper objectMapper;
    private final long timeoutMs;
    private final ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "script-watchdog");
        thread.setDaemon(true);
        return thread;
    });

    public ScriptSandbox(Engine engine, ObjectMapper objectMapper, AutomateProperties properties) {
        this.engine = engine;
        this.objectMapper = objectMapper;
        this.timeoutMs = properties.getSandbox().getTimeoutMs();
    }

    @PreDestroy
    public void shutdown() {
        watchdog.shutdownNow();
    }

    /**
     * Runs {@code script} and returns its (awaited) return value converted to plain Java data.
     * Changes the script makes to {@code variables} are visible to the caller afterwards.
     */
    public Object execute(String script, SystemApi api, Map<String, Object> input, Map<String, Object> variables) {
        Context context = Context.newBuilder(LANGUAGE)
                .engine(engine)
                .allowHostAccess(HostAccess.NONE)
                .allowHostClassLookup(className -> false)
                .allowCreateThread(false)
                .allowCreateProcess(false)
                .allowNativeAccess(false)
                .allowIO(IOAccess.NONE)
                .allowEnvironmentAccess(EnvironmentAccess.NONE)
                .allowExperimentalOptions(true)
                .option("js.console", "false")
                .option("js.print", "false")
                .out(OutputStream.nullOutputStream())
                .err(OutputStream.nullOutputStream())
                .build();

        AtomicBoolean timedOut = new AtomicBoolean(false);
        ScheduledFuture<?> deadline = timeoutMs > 0
                ? watchdog.schedule(() -> {
                    timedOut.set(true);
                    context.close(true);
                }, timeoutMs, TimeUnit.MILLISECONDS)
                : null;
        try {
            Value function = context.eval(Source.newBuilder(LANGUAGE, wrap(script), "flow-script.js")
                    .cached(true)
                    .buildLiteral());
            Value returned = function.execute(
                    apiObject(api, variables),
                    GuestValues.toGuest(input != null ? input : new LinkedHashMap<>()),
                    GuestValues.toGuest(variables));
            return settle(returned);
        } catch (PolyglotException ex) {
            throw translate(ex, timedOut.get());
        } finally {
            if (deadline != null) {
                deadline.cancel(false);
            }
            if (timedOut.get()) {
                // The cancellation may leave the interrupt flag behind on this thread
                Thread.interrupted();
            } else {
                closeQuietly(context);
            }
        }
    }

    public Object evaluate(String expression, SystemApi api, Map<String, Object> input, Map<String, Object> variables) {
        return execute("return (" + expression + ");", api, input, variables);
    }

    public boolean test(String condition, SystemApi api, Map<String, Object> input, Map<String, Object> variables) {
        return Boolean.TRUE.equals(execute("return !!(" + condition + ");", api, input, variables));
    }

    // ── Script plumbing ─────────────────────────────────────────────────────────

    private static String wrap(String script) {
        return "(async function (api, input, variables) {\n"
                + "\"use strict\";\n"
                + "const inp = input;\n"
                + "const vars = variables;\n"
                + script
                + "\n})";
    }

    // Microtasks have drained by the time the call returns
    private Object settle(Value returned) {
        if (returned == null || !returned.canInvokeMember("then")) {
            return GuestValues.toHost(returned);
        }
        CompletableFuture<Object> outcome = new CompletableFuture<>();
        ProxyExecutable resolve = args -> {
            outcome.complete(args.length > 0 ? GuestValues.toHost(args[0]) : null);
            return null;
        };
        ProxyExecutable reject = args -> {
            outcome.completeExceptionally(rejection(args.length > 0 ? args[0] : null));
            return null;
        };
        returned.invokeMember("then", resolve, reject);

        if (!outcome.isDone()) {
            throw new ScriptExecutionException("Script returned a promise that never settled");
        }
        try {
            return outcome.get();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            throw cause instanceof RuntimeException runtime ? runtime : new ScriptExecutionException(cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ScriptExecutionException("Script interrupted", ex);
        }
    }

    private static RuntimeException rejection(Value reason) {
        if (reason == null || reason.isNull()) {
            return new ScriptExecutionException("Script failed");
        }
        if (reason.isHostObject() && reason.asHostObject() instanceof Throwable host) {
            return hostFailure(host);
        }
        if (reason.hasMember("message")) {
            return new ScriptExecutionException(text(reason.getMember("message")));
        }
        if (reason.isException()) {
            try {
                reason.throwException();
            } catch (PolyglotException ex) {
                return ex.isHostException() ? hostFailure(ex.asHostException()) : new ScriptExecutionException(ex.getMessage(), ex);
            }
        }
        return new ScriptExecutionException(text(reason));
    }

    // Value.toString() on a guest string can render the engine's internal string type
    private static String text(Value value) {
        if (value == null || value.isNull()) {
            return "Script failed";
        }
        if (value.isString()) {
            return value.asString();
        }
        Object host = GuestValues.toHost(value);
        return host instanceof String string ? string : String.valueOf(host);
    }

    private RuntimeException translate(PolyglotException ex, boolean timedOut) {
        if (timedOut || ex.isCancelled()) {
            return new ScriptExecutionException("Script execution timeout (" + timeoutMs + "ms)", ex);
        }
        if (ex.isHostException()) {
            return hostFailure(ex.asHostException());
        }
        return new ScriptExecutionException(ex.getMessage(), ex);
    }

    private static RuntimeException hostFailure(Throwable host) {
        if (host instanceof RuntimeException runtime) {
            return runtime;
        }
        String message = host.getMessage() != null ? host.getMessage() : host.getClass().getSimpleName();
        return new ScriptExecutionException(message, host);
    }

    private static void closeQuietly(Context context) {
        try {
            context.close();
        } catch (PolyglotException | IllegalStateException ex) {
            log.debug("Script context did not close cleanly: {}", ex.getMessage());
        }
    }

    // ── api binding ─────────────────────────────────────────────────────────────

    private ProxyObject apiObject(SystemApi api, Map<String, Object> variables) {
        Map<String, Object> logApi = new LinkedHashMap<>();
        for (LogLevel level : LogLevel.values()) {
            logApi.put(level.getKey(), (ProxyExecutable) args -> {
                api.log().write(level, render(args));
                return null;
            });
        }

        Map<String, Object> aiApi = new LinkedHashMap<>();
        aiApi.put("chat", (ProxyExecutable) args ->
                api.ai().chat(stringArg(args, 0), ChatOptions.from(mapArg(args, 1))));
        aiApi.put("chatVision", (ProxyExecutable) args ->
                api.ai().chatVision(stringArg(args, 0), stringArg(args, 1), ChatOptions.from(mapArg(args, 2))));
        aiApi.put("chatMessages", (ProxyExecutable) args ->
                GuestValues.toGuest(api.ai().chatMessages(messagesArg(args, 0), ChatOptions.from(mapArg(args, 1)))));
        aiApi.put("isConfigured", (ProxyExecutable) args -> api.ai().isConfigured());

        Map<String, Object> speechApi = new LinkedHashMap<>();
        speechApi.put("say", (ProxyExecutable) args -> {
            api.speech().say(stringArg(args, 0), SpeechOptions.from(mapArg(args, 1)));
            return null;
        });
        speechApi.put("stop", (ProxyExecutable) args -> {
            api.speech().stop();
            return null;
        });
        speechApi.put("isTtsConfigured", (ProxyExecutable) args -> api.speech().isTtsConfigured());
        speechApi.put("isSttConfigured", (ProxyExecutable) args -> api.speech().isSttConfigured());

        Map<String, Object> variablesApi = new LinkedHashMap<>();
        variablesApi.put("get", (ProxyExecutable) args -> GuestValues.toGuest(variables.get(stringArg(args, 0))));
        variablesApi.put("set", (ProxyExecutable) args -> {
            variables.put(stringArg(args, 0), args.length > 1 ? GuestValues.toHost(args[1]) : null);
            return null;
        });
        variablesApi.put("getAll", (ProxyExecutable) args -> GuestValues.toGuest(new LinkedHashMap<>(variables)));

        Map<String, Object> utilsApi = new LinkedHashMap<>();
        utilsApi.put("uuid", (ProxyExecutable) args -> UUID.randomUUID().toString());
        utilsApi.put("sleep", (ProxyExecutable) args -> {
            sleep(args.length > 0 && args[0].isNumber() ? args[0].asLong() : 0);
            return null;
        });

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("log", ProxyObject.fromMap(logApi));
        root.put("notify", (ProxyExecutable) args -> {
            api.notify(stringArg(args, 0), NotificationSeverity.fromKey(stringArg(args, 1)));
            return null;
        });
        root.put("ai", ProxyObject.fromMap(aiApi));
        root.put("speech", ProxyObject.fromMap(speechApi));
        root.put("variables", ProxyObject.fromMap(variablesApi));
        root.put("utils", ProxyObject.fromMap(utilsApi));
        return ProxyObject.fromMap(root);
    }

    private String render(Value[] args) {
        List<String> parts = new ArrayList<>(args.length);
        for (Value arg : args) {
            Object value = GuestValues.toHost(arg);
            if (value instanceof Map<?, ?> || value instanceof List<?>) {
                try {
                    parts.add(objectMapper.writeValueAsString(value));
                } catch (JsonProcessingException ex) {
                    parts.add(String.valueOf(value));
                }
            } else {
                parts.add(String.valueOf(value));
            }
        }
        return String.join(" ", parts);
    }

    private static String stringArg(Value[] args, int index) {
        if (args.length <= index || args[index].isNull()) {
            return null;
        }
        return args[index].isString() ? args[index].asString() : args[index].toString();
    }

    private static Map<String, Object> mapArg(Value[] args, int index) {
        if (args.length <= index) {
            return null;
        }
        return GuestValues.toHost(args[index]) instanceof Map<?, ?> map ? stringKeyed(map) : null;
    }

    private static List<Map<String, Object>> messagesArg(Value[] args, int index) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (args.length > index && GuestValues.toHost(args[index]) instanceof List<?> list) {
            for (Object element : list) {
                if (element instanceof Map<?, ?> message) {
                    messages.add(stringKeyed(message));
                }
            }
        }
        return messages;
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }

    private static void sleep(long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ScriptExecutionException("Sleep interrupted", ex);
        }
    }
}
