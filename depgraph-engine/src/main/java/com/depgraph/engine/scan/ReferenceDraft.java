package com.depgraph.engine.scan;

import com.depgraph.engine.graph.ReferenceForm;
import com.depgraph.engine.graph.RelationKind;

/**
 * A reference seen inside a declaration's body. The caller is identified by name and arity within
 * the scanned file; the target is whatever name the source used ({@code targetArity} is -1 when the
 * reference passes a function without calling it).
 */
public record ReferenceDraft(
        String callerName,
        int callerArity,
        String targetName,
        int targetArity,
        RelationKind kind,
        ReferenceForm form,
        int line
) {
}
