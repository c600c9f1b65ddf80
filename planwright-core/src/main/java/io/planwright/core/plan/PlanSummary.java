package io.planwright.core.plan;

import java.util.List;

/// Aggregate statistics over an {@link ExecutionPlan}, for diagnostics and UIs.
///
/// @param nodeCount number of executable nodes, sentinels included
/// @param edgeCount number of edges
/// @param levelCount number of execution levels
/// @param loopCount number of loop boundaries
/// @param parallelCount number of parallel boundaries
/// @param warningCount number of build warnings
/// @param maxLevelWidth size of the widest execution level
/// @param maxConcurrentNodes concurrency cap declared by the workflow settings
/// @param entryPoint entry node id
/// @param terminalNodeIds nodes without dependents, in plan order
/// @param outputNodeIds nodes the runtime reads the final output from
public record PlanSummary(
        int nodeCount,
        int edgeCount,
        int levelCount,
        int loopCount,
        int parallelCount,
        int warningCount,
        int maxLevelWidth,
        int maxConcurrentNodes,
        String entryPoint,
        List<String> terminalNodeIds,
        List<String> outputNodeIds) {

    public PlanSummary {
        terminalNodeIds = List.copyOf(terminalNodeIds);
        outputNodeIds = List.copyOf(outputNodeIds);
    }
}
