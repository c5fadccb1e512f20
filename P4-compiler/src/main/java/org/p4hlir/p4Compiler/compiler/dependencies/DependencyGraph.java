package org.p4hlir.p4Compiler.compiler.dependencies;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.p4hlir.p4Compiler.compiler.errors.CycleError;
import org.p4hlir.p4Compiler.ir.FieldRef;
import org.p4hlir.p4Compiler.ir.IControlNode;
import org.p4hlir.util.IIndentStream;
import org.p4hlir.util.Linq;
import org.p4hlir.util.ToIndentableString;
import org.p4hlir.util.Utilities;
import org.p4hlir.util.graph.DiGraph;
import org.p4hlir.util.graph.Port;
import org.p4hlir.util.graph.TopologicalOrder;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * A directed graph of events and the dependencies between them.
 * There is at most one edge between an ordered pair of events:
 * adding a second edge merges it into the first.
 */
public final class DependencyGraph implements DiGraph<Event>, ToIndentableString {
    /** Name of the pipeline the graph was built for. */
    public final String name;
    /** True if tables are split into a match and an action event. */
    public final boolean split;
    final List<Event> events;
    final Map<Long, DependencyEdge> edges;
    final List<List<Event>> successors;
    final List<List<Event>> predecessors;

    public DependencyGraph(String name, boolean split) {
        this.name = name;
        this.split = split;
        this.events = new ArrayList<>();
        this.edges = new LinkedHashMap<>();
        this.successors = new ArrayList<>();
        this.predecessors = new ArrayList<>();
    }

    /** A graph with the same events as this one and no edges. */
    public DependencyGraph withoutEdges() {
        DependencyGraph result = new DependencyGraph(this.name, this.split);
        for (Event event: this.events)
            result.addEvent(event.node, event.role);
        return result;
    }

    public Event addEvent(IControlNode node, EventRole role) {
        Event event = new Event(this.events.size(), node, role);
        this.events.add(event);
        this.successors.add(new ArrayList<>());
        this.predecessors.add(new ArrayList<>());
        return event;
    }

    static long key(Event source, Event target) {
        return ((long) source.index << 32) | target.index;
    }

    void checkOwned(Event event) {
        Utilities.enforce(event.index < this.events.size() && this.events.get(event.index) == event,
                () -> "Event " + event + " does not belong to graph " + this.name);
    }

    /** Add an edge, merging it with an existing edge between the same events. */
    public DependencyEdge addEdge(Event source, Event target, DependencyKind kind, SortedSet<FieldRef> fields) {
        return this.addEdge(new DependencyEdge(source, target, kind, fields));
    }

    public DependencyEdge addEdge(DependencyEdge edge) {
        this.checkOwned(edge.source);
        this.checkOwned(edge.target);
        Utilities.enforce(edge.source != edge.target, () -> "Self-dependency on " + edge.source);
        Utilities.enforce(edge.kind == DependencyKind.FIELD || edge.fields.isEmpty(),
                () -> "Control-flow edge with fields " + edge);
        long key = key(edge.source, edge.target);
        DependencyEdge previous = this.edges.get(key);
        if (previous != null) {
            DependencyEdge merged = previous.merge(edge);
            this.edges.put(key, merged);
            return merged;
        }
        this.edges.put(key, edge);
        this.successors.get(edge.source.index).add(edge.target);
        this.predecessors.get(edge.target.index).add(edge.source);
        return edge;
    }

    public List<Event> getEvents() {
        return Collections.unmodifiableList(this.events);
    }

    public Event getEvent(int index) {
        return this.events.get(index);
    }

    /** The event with the specified name, or null. */
    @Nullable
    public Event getEvent(String name) {
        for (Event event: this.events)
            if (event.getName().equals(name))
                return event;
        return null;
    }

    public int getEventCount() {
        return this.events.size();
    }

    /** Edges in insertion order. */
    public Collection<DependencyEdge> getEdges() {
        return Collections.unmodifiableCollection(this.edges.values());
    }

    public int getEdgeCount() {
        return this.edges.size();
    }

    @Nullable
    public DependencyEdge getEdge(Event source, Event target) {
        return this.edges.get(key(source, target));
    }

    public boolean hasEdge(String source, String target) {
        Event s = this.getEvent(source);
        Event t = this.getEvent(target);
        return s != null && t != null && this.getEdge(s, t) != null;
    }

    public List<DependencyEdge> getOutgoing(Event event) {
        return Linq.map(this.successors.get(event.index), t -> Utilities.getExists(this.edges, key(event, t)));
    }

    public List<Event> getPredecessors(Event event) {
        return Collections.unmodifiableList(this.predecessors.get(event.index));
    }

    @Override
    public Iterable<Event> getNodes() {
        return this.getEvents();
    }

    @Override
    public List<Port<Event>> getSuccessors(Event event) {
        List<Event> targets = this.successors.get(event.index);
        List<Port<Event>> result = new ArrayList<>(targets.size());
        for (int i = 0; i < targets.size(); i++)
            result.add(new Port<>(targets.get(i), i));
        return result;
    }

    /** Events in topological order; among ready events the lower index goes first.
     * @throws CycleError if the graph is not acyclic. */
    public List<Event> topologicalOrder() {
        TopologicalOrder<Event> order = new TopologicalOrder<>(this);
        if (!order.isComplete())
            throw new CycleError(Linq.map(order.getRemaining(), Event::getName));
        return order.getOrder();
    }

    /** Check the structural invariants of the graph.
     * @throws CycleError if the graph is not acyclic. */
    public void validate() {
        for (DependencyEdge edge: this.edges.values()) {
            Utilities.enforce(edge.source != edge.target);
            Utilities.enforce(this.successors.get(edge.source.index).contains(edge.target));
        }
        this.topologicalOrder();
    }

    public ObjectNode asJson(ObjectMapper mapper) {
        ObjectNode result = mapper.createObjectNode();
        result.put("name", this.name);
        result.put("split", this.split);
        ArrayNode events = result.putArray("events");
        for (Event event: this.events)
            events.add(event.getName());
        ArrayNode edges = result.putArray("edges");
        for (DependencyEdge edge: this.edges.values()) {
            ObjectNode e = edges.addObject();
            e.put("source", edge.source.getName());
            e.put("target", edge.target.getName());
            e.put("kind", edge.kind.label);
            ArrayNode fields = e.putArray("fields");
            for (FieldRef field: edge.fields)
                fields.add(field.toString());
        }
        return result;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("dependencies ")
                .append(this.name)
                .append(" {")
                .increase();
        for (DependencyEdge edge: this.edges.values())
            builder.append(edge.toString()).newline();
        return builder.decrease().append("}").newline();
    }

    @Override
    public String toString() {
        return "DependencyGraph(" + this.name + ", " + this.events.size() + " events, " +
                this.edges.size() + " edges)";
    }
}
