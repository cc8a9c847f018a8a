package org.neuralchilli.irflow.core.passes;

import org.neuralchilli.irflow.monitoring.IrEventType;

import java.util.Map;

/**
 * A named graph rewrite run by the optimization pipeline.
 */
public interface IrPass {

    /**
     * Name used in the program's pass schedule.
     */
    String name();

    /**
     * Minimum optimization level at which the pass runs.
     */
    int level();

    /**
     * Event published with the pass's impact after a successful run.
     */
    IrEventType eventType();

    /**
     * Rewrite the draft in place.
     *
     * @param parameters the parameters scheduled with the pass
     * @return the number of nodes affected
     */
    int apply(ProgramDraft draft, Map<String, Object> parameters);
}
