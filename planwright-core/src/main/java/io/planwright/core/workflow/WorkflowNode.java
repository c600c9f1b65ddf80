package io.planwright.core.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Raw node as authored in the workflow editor.
///
/// `config` is free-form and keyed by node type, e.g. `{count}` for a `for` loop,
/// `{sourceArray}` for `forEach`, `{branches, aggregation}` for `parallel`, or
/// `{errorPort}` for any node that wants an explicit failure route.
///
/// @param type node type string such as `llm`, `conditional`, `loop`, not null
/// @param name display name, may be null
/// @param config type-specific settings, null treated as empty; values may be null
/// @param position canvas position, null treated as the origin
/// @param onError failure-handling directive, may be null
public record WorkflowNode(
        String type,
        String name,
        Map<String, Object> config,
        NodePosition position,
        ErrorHandling onError) {

    public WorkflowNode {
        config =
                config == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        if (position == null) {
            position = NodePosition.ORIGIN;
        }
    }

    /// Creates a node without config, position or error handling.
    ///
    /// @param type node type, not null
    /// @param name display name, may be null
    public WorkflowNode(String type, String name) {
        this(type, name, Map.of(), NodePosition.ORIGIN, null);
    }

    /// Creates a node with config only.
    ///
    /// @param type node type, not null
    /// @param name display name, may be null
    /// @param config type-specific settings, may be null
    public WorkflowNode(String type, String name, Map<String, Object> config) {
        this(type, name, config, NodePosition.ORIGIN, null);
    }
}
