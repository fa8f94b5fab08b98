package io.github.drompincen.opsledger.runtime.support;

import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.runtime.executor.action.ActionContext;
import io.github.drompincen.opsledger.runtime.executor.action.ActionHandler;
import io.github.drompincen.opsledger.runtime.executor.action.ActionResult;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/** Handles every action kind with whatever the test scripts. */
public class ScriptedActionHandler implements ActionHandler {

    @FunctionalInterface
    public interface Script {
        ActionResult run(ActionContext context) throws Exception;
    }

    private volatile Script script = ctx -> ActionResult.withoutModel("done", Map.of());
    private final AtomicInteger calls = new AtomicInteger();

    public void script(Script script) {
        this.script = script;
    }

    /** Succeeds with a model call worth exactly {@code usd}, priced at the default $1 per million input tokens. */
    public void costing(String usd) {
        long tokens = new BigDecimal(usd).multiply(BigDecimal.valueOf(1_000_000)).longValueExact();
        script(ctx -> new ActionResult("spent $" + usd, Map.of("ok", true), "test-provider", "test-model", tokens, 0));
    }

    public void failing(String message) {
        script(ctx -> {
            throw new IllegalStateException(message);
        });
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public Set<ActionKind> kinds() {
        return EnumSet.allOf(ActionKind.class);
    }

    @Override
    public ActionResult execute(ActionContext context) throws Exception {
        calls.incrementAndGet();
        return script.run(context);
    }
}
