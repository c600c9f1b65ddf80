package io.planwright.core.exception;

import java.io.Serial;

/// Thrown when a workflow definition cannot be compiled into an execution plan.
///
/// Raised for structural problems (missing or empty node map, missing edge list,
/// missing or unknown entry point) and for exceeded structural limits (loop nesting
/// depth, parallel branch count). Non-fatal problems are reported as build warnings
/// instead.
///
/// @see io.planwright.core.builder.WorkflowBuilder#build
public class WorkflowValidationException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4127390826453319104L;

    private final String nodeId;

    /// Creates exception with message.
    ///
    /// @param message description of the structural problem
    public WorkflowValidationException(String message) {
        this(message, null);
    }

    /// Creates exception with message and the offending node.
    ///
    /// @param message description of the structural problem
    /// @param nodeId id of the node the problem was found at, may be null
    public WorkflowValidationException(String message, String nodeId) {
        super(message);
        this.nodeId = nodeId;
    }

    /// Returns the node the problem was found at.
    ///
    /// @return node id, or null for definition-wide problems
    public String getNodeId() {
        return nodeId;
    }
}
