package com.deskmate.directives;

import com.deskmate.models.Directive;

/**
 * Receives every dispatched directive. Handlers ignore kinds they do not understand.
 */
@FunctionalInterface
public interface DirectiveHandler {

    void handle(Directive directive) throws Exception;
}
