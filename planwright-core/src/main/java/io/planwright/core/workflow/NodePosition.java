package io.planwright.core.workflow;

/// Canvas coordinates of a node. Carried through to the plan untouched.
public record NodePosition(double x, double y) {

    public static final NodePosition ORIGIN = new NodePosition(0, 0);
}
