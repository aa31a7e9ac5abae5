package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.engine.ScriptSandbox;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Matches the string form of {@code config.expression} against {@code config.cases}
 * and continues on {@code case_<index>} of the first match, or on {@code default}.
 */
@Component
@RequiredArgsConstructor
public class SwitchExecutor implements NodeExecutor {

    private final ScriptSandbox sandbox;

    @Override
    public NodeType supportedType() {
        return NodeType.SWITCH;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        NodeConfig config = NodeConfig.of(node);
        String expression = config.text("expression");

        Object value = null;
        String text = "undefined";
        if (expression != null) {
            // String() is taken inside the script so numbers and null stringify the JavaScript way
            Object evaluated = sandbox.execute(
                    "const __value = (" + expression + ");\nreturn [__value, String(__value)];",
                    ctx.getApi(), input, ctx.getVariables());
            if (evaluated instanceof List<?> pair && pair.size() == 2) {
                value = pair.get(0);
                text = String.valueOf(pair.get(1));
            }
        }

        List<?> cases = config.list("cases");
        for (int i = 0; i < cases.size(); i++) {
            if (text.equals(String.valueOf(cases.get(i)))) {
                return NodeOutcome.next(value, "case_" + i);
            }
        }
        return NodeOutcome.next(value, "default");
    }
}
