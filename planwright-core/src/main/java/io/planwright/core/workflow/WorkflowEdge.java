package io.planwright.core.workflow;

/// Raw directed edge between two nodes.
///
/// The `sourceHandle` names the port the edge leaves from (`true`, `error`, `route-a`,
/// `loop-body`, ...) and is what the edge constructor classifies into a handle type.
///
/// @param id edge id, expected unique within the definition
/// @param source source node id
/// @param target target node id
/// @param sourceHandle port on the source node, may be null
/// @param targetHandle port on the target node, may be null
public record WorkflowEdge(
        String id, String source, String target, String sourceHandle, String targetHandle) {

    public WorkflowEdge(String id, String source, String target) {
        this(id, source, target, null, null);
    }

    public WorkflowEdge(String id, String source, String target, String sourceHandle) {
        this(id, source, target, sourceHandle, null);
    }
}
