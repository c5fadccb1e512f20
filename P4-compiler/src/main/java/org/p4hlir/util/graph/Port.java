package org.p4hlir.util.graph;

/** The destination of an edge; {@code port} distinguishes multiple edges leaving the same node. */
public record Port<Node>(Node node, int port) {
    @Override
    public String toString() {
        return this.node + ":" + this.port;
    }
}
