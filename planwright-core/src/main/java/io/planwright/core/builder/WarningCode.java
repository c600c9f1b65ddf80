package io.planwright.core.builder;

/// Machine-readable category of a {@link BuildWarning}.
public enum WarningCode {
    UNREACHABLE_NODE,
    UNCONNECTED_NODE,
    DANGLING_EDGE,
    LOOP_WITHOUT_BODY,
    LOOP_BODY_OVERLAP,
    PARALLEL_NO_BRANCHES,
    PARALLEL_FEW_BRANCHES,
    PARALLEL_INVALID_BRANCH_CONFIG,
    PARALLEL_INVALID_AGGREGATION,
    DUPLICATE_EDGE_ID,
    ILLEGAL_SELF_LOOP,
    CONDITIONAL_MISSING_BRANCH,
    ROUTER_WITHOUT_ROUTES,
    CYCLE_DETECTED,
    INVALID_NODE_CONFIG
}
