package org.dxworks.plcframe.cfg;

import java.util.Objects;

/**
 * Directed edge between two blocks of one routine. {@code value} carries the arm label
 * of a case-value edge ({@code "default"} or {@code "fallthrough"} for the default edge).
 * Back-edges are structural markers only.
 */
public final class CfgEdge {
    public static final String DEFAULT_ARM = "default";
    public static final String FALLTHROUGH_ARM = "fallthrough";

    private final int source;
    private final int target;
    private final FlowType flowType;
    private final String value;
    private final boolean backEdge;

    public CfgEdge(int source, int target, FlowType flowType, String value, boolean backEdge) {
        this.source = source;
        this.target = target;
        this.flowType = Objects.requireNonNull(flowType, "flow type");
        this.value = value;
        this.backEdge = backEdge;
    }

    public int getSource() {
        return source;
    }

    public int getTarget() {
        return target;
    }

    public FlowType getFlowType() {
        return flowType;
    }

    public String getValue() {
        return value;
    }

    public boolean isBackEdge() {
        return backEdge;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CfgEdge edge)) return false;
        return source == edge.source && target == edge.target && backEdge == edge.backEdge
                && flowType == edge.flowType && Objects.equals(value, edge.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, flowType, value, backEdge);
    }

    @Override
    public String toString() {
        return source + " -" + flowType.getName() + (value != null ? "[" + value + "]" : "") + "-> " + target;
    }
}
