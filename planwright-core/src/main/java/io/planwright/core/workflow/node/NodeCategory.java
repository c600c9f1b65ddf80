package io.planwright.core.workflow.node;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/// Coarse grouping of node type strings that plan construction cares about.
///
/// The editor knows many node types; the builder only needs to know whether a type
/// can fail with an error port, branches (logic), iterates (loop), fans out (parallel),
/// or is a synthetic loop sentinel. Everything else is {@link #STANDARD}.
///
/// Type lookup is case-insensitive.
public enum NodeCategory {
    LLM(true),
    HTTP(true),
    INTEGRATION(true),
    AGENT(true),
    LOGIC(false),
    LOOP(false),
    PARALLEL(false),
    SENTINEL(false),
    STANDARD(false);

    /// Type string of synthetic loop START/END nodes.
    public static final String LOOP_SENTINEL_TYPE = "loop-sentinel";

    private static final Map<String, NodeCategory> BY_TYPE = new HashMap<>();

    static {
        register(LLM, "llm", "vision", "audio", "embeddings", "imageGeneration", "videoGeneration");
        register(HTTP, "http", "fetch", "webhook");
        register(INTEGRATION, "integration", "action", "database", "email", "code");
        register(AGENT, "agent", "agentCall");
        register(LOGIC, "conditional", "condition", "if", "switch", "router");
        register(LOOP, "loop", "for", "forEach", "while", "doWhile");
        register(PARALLEL, "parallel");
        register(SENTINEL, LOOP_SENTINEL_TYPE);
    }

    private final boolean errorPort;

    NodeCategory(boolean errorPort) {
        this.errorPort = errorPort;
    }

    private static void register(NodeCategory category, String... types) {
        for (String type : types) {
            BY_TYPE.put(type.toLowerCase(Locale.ROOT), category);
        }
    }

    /// Returns whether nodes of this category always expose an error port.
    ///
    /// @return true for llm, http, integration and agent nodes
    public boolean hasErrorPort() {
        return errorPort;
    }

    /// Resolves the category of a node type string.
    ///
    /// @param type node type, may be null
    /// @return matching category, {@link #STANDARD} for unknown or null types
    public static NodeCategory of(String type) {
        if (type == null) {
            return STANDARD;
        }
        return BY_TYPE.getOrDefault(type.toLowerCase(Locale.ROOT), STANDARD);
    }

    /// Returns whether the type is a two-way conditional (`conditional`, `condition`, `if`).
    ///
    /// @param type node type, may be null
    /// @return true for conditional node types
    public static boolean isConditional(String type) {
        return "conditional".equalsIgnoreCase(type)
                || "condition".equalsIgnoreCase(type)
                || "if".equalsIgnoreCase(type);
    }

    /// Returns whether the type is a multi-way router.
    ///
    /// @param type node type, may be null
    /// @return true for `router`
    public static boolean isRouter(String type) {
        return "router".equalsIgnoreCase(type);
    }
}
