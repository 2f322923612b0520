package tableau;

public enum NodeStatus {
    OPEN,
    /** Terminal: the node holds a formula and its negation. */
    CLOSED,
    /** Terminal for this node's own expansion; does not close the branch. */
    SATURATED
}
