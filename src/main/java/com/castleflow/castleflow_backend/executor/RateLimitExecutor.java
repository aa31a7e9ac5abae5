package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.engine.NodeExecutionException;
import com.castleflow.castleflow_backend.engine.RateLimiter;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Config shape:
 * {
 *   "mode":    "delay",   // delay | throttle | debounce
 *   "delayMs": 1000
 * }
 * <p>
 * {@code throttle} lets one pass per interval through, keyed by node id across all runs,
 * and sends the rest to {@code skipped}. {@code debounce} only waits; a later arrival does
 * not cancel an earlier one.
 */
@Component
@RequiredArgsConstructor
public class RateLimitExecutor implements NodeExecutor {

    private static final String SKIPPED_PORT = "skipped";

    private final RateLimiter rateLimiter;

    @Override
    public NodeType supportedType() {
        return NodeType.RATE_LIMIT;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        NodeConfig config = NodeConfig.of(node);
        String mode = config.text("mode", "delay");
        int delayMs = Math.max(0, config.integer("delayMs", 1000));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("mode", mode);
        result.put("delayMs", delayMs);

        switch (mode) {
            case "delay" -> {
                pause(delayMs);
                ctx.getApi().log().info("Delayed " + delayMs + "ms");
                return NodeOutcome.next(result);
            }
            case "throttle" -> {
                if (rateLimiter.tryAcquire(node.getId(), delayMs)) {
                    ctx.getApi().log().info("Throttle passed (" + delayMs + "ms interval)");
                    result.put("passed", true);
                    return NodeOutcome.next(result);
                }
                long remaining = rateLimiter.remainingMillis(node.getId(), delayMs);
                ctx.getApi().log().info("Throttled - " + remaining + "ms remaining");
                result.put("passed", false);
                return NodeOutcome.next(result, SKIPPED_PORT);
            }
            case "debounce" -> {
                pause(delayMs);
                ctx.getApi().log().info("Debounced (waited " + delayMs + "ms)");
                return NodeOutcome.next(result);
            }
            default -> throw new NodeExecutionException("Rate limit: unknown mode: " + mode);
        }
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new NodeExecutionException("Rate limit: interrupted while waiting", ex);
        }
    }
}
