package org.neuralchilli.irflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlException;
import org.apache.commons.jexl3.introspection.JexlPermissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that edge guard conditions are well-formed JEXL expressions.
 * Guards are only parsed here; evaluating them is up to the generated workflow.
 */
@ApplicationScoped
public class GuardExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(GuardExpressionParser.class);

    private final JexlEngine jexl;

    public GuardExpressionParser() {
        this.jexl = new JexlBuilder()
                .cache(256)
                .strict(true)
                .silent(false)
                .permissions(JexlPermissions.RESTRICTED)
                .create();
    }

    /**
     * Parse a guard expression.
     *
     * @return the guard as declared, or null for a null/blank guard
     * @throws CompilationException if the expression does not parse
     */
    public String parse(String guard) {
        if (guard == null || guard.isBlank()) {
            return null;
        }
        try {
            jexl.createExpression(guard);
            return guard;
        } catch (JexlException e) {
            String msg = String.format("Malformed guard expression: %s - %s", guard, e.getMessage());
            log.debug(msg);
            throw new CompilationException(msg, e);
        }
    }
}
