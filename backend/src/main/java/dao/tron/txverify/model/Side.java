package dao.tron.txverify.model;

/**
 * Position of a proof sibling relative to the running hash.
 */
public enum Side {
    LEFT,
    RIGHT
}
