package io.github.drompincen.opsledger.runtime.executor.action;

import io.github.drompincen.opsledger.protocol.api.ActionKind;

import java.util.Set;

public interface ActionHandler {

    /** Kinds this handler runs. Each kind must be claimed by exactly one handler. */
    Set<ActionKind> kinds();

    /**
     * Runs the action on an executor thread. May block on I/O; must give up promptly when
     * interrupted. Any exception fails the job.
     */
    ActionResult execute(ActionContext context) throws Exception;
}
