package com.risk.fta.engine;

import com.risk.fta.api.CycleDetectedException;
import com.risk.fta.api.DanglingGateException;
import com.risk.fta.api.DuplicateDefinitionException;
import com.risk.fta.api.Event;
import com.risk.fta.api.UndefinedNodeException;
import com.risk.fta.api.ValidationException;
import com.risk.fta.model.BasicEvent;
import com.risk.fta.model.EventRegistry;
import com.risk.fta.model.Gate;
import com.risk.fta.model.HouseEvent;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * One fault tree: a top gate and every gate and primary event reachable from
 * it.
 *
 * Lifecycle:
 * 1. Created empty with a name, on top of an {@link EventRegistry} holding the
 * declarations.
 * 2. Gates are added one at a time with {@link #addGate(Gate)}. The first
 * addition fixes the top event. Every later gate must have a parent that is
 * already part of this tree, so parents are declared before or alongside
 * their children.
 * 3. {@link #validate()} runs once after all additions. It checks the gate
 * graph for cycles, registers gates found only as children ("implicit"
 * gates), resolves every leaf to a declared primary event, and compiles the
 * {@link TreeTopology} used by the analysis. Gate arities are an input
 * concern, checked where declarations are compiled ({@link Gate#checkArity()}).
 * 4. The tree is read-only from then on.
 *
 * Validation failures are fatal for the tree; callers must not analyze a tree
 * whose validation threw.
 *
 * Thread Safety:
 * Not thread-safe while being built. A validated tree can be read
 * concurrently.
 */
@Log4j2
public final class FaultTree {
    private final String name;
    private final EventRegistry registry;

    private Gate top;
    // All non-top gates known to this tree, explicit and implicit.
    private final Map<String, Gate> interEvents = new LinkedHashMap<>();
    private final Map<String, Gate> implicitGates = new LinkedHashMap<>();

    private final Map<String, Event> primaryEvents = new LinkedHashMap<>();
    private final Map<String, BasicEvent> basicEvents = new LinkedHashMap<>();
    private final Map<String, HouseEvent> houseEvents = new LinkedHashMap<>();

    private TreeTopology topology;

    public FaultTree(String name, EventRegistry registry) {
        this.name = name;
        this.registry = registry;
    }

    public String name() {
        return name;
    }

    public EventRegistry registry() {
        return registry;
    }

    /**
     * Adds a gate to the tree.
     *
     * @param gate The gate. If the registry does not know its id yet, it is
     *             declared there.
     * @throws DuplicateDefinitionException if the id is already the top or a
     *                                      registered gate of this tree.
     * @throws DanglingGateException        if the gate has no parents, or none
     *                                      of them is part of this tree yet.
     */
    public void addGate(Gate gate) {
        Event declared = registry.get(gate.id());
        if (declared == null) {
            registry.add(gate);
        } else if (declared != gate) {
            throw new DuplicateDefinitionException(gate.id(),
                    "Gate '" + gate.name() + "' conflicts with another declaration of the same id");
        }
        topology = null;

        if (top == null) {
            top = gate;
            log.debug("Tree '{}': top event is '{}'", name, gate.name());
            return;
        }
        if (interEvents.containsKey(gate.id()) || gate.id().equals(top.id()))
            throw new DuplicateDefinitionException(gate.id(),
                    "Trying to doubly define a gate '" + gate.name() + "'");

        Set<String> parents = registry.parentsOf(gate.id());
        if (parents.isEmpty())
            throw new DanglingGateException(gate.id(),
                    "Gate '" + gate.name() + "' is a dangling gate in a malformed tree input structure."
                            + " It has no parents.");
        boolean parentFound = false;
        for (String parent : parents) {
            if (parent.equals(top.id()) || interEvents.containsKey(parent)) {
                parentFound = true;
                break;
            }
        }
        if (!parentFound)
            throw new DanglingGateException(gate.id(),
                    "Gate '" + gate.name() + "' has no pre-declared parent gate in '" + name
                            + "' fault tree. This gate is a dangling gate.");
        interEvents.put(gate.id(), gate);
    }

    /**
     * Validates the structure and (re)builds the primary event indices and the
     * topology.
     *
     * @throws ValidationException on any structural defect; the subclass
     *                             identifies the defect.
     */
    public void validate() {
        if (top == null)
            throw new ValidationException("Fault tree '" + name + "' has no top event");
        topology = null;

        checkCycles();
        gatherPrimaryEvents();
        topology = buildTopology();

        log.info("Validated fault tree '{}': {} gates ({} implicit), {} basic events, {} house events",
                name, interEvents.size() + 1, implicitGates.size(), basicEvents.size(), houseEvents.size());
    }

    /**
     * Iterative depth-first traversal from the top.
     *
     * The current path is kept both as an ordered list, for reporting, and as a
     * set, for O(1) membership checks. Gates whose subtrees were fully explored
     * are never entered again, which keeps shared sub-trees linear.
     */
    private void checkCycles() {
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        Set<String> done = new HashSet<>();
        Deque<int[]> cursors = new ArrayDeque<>();
        Deque<Gate> stack = new ArrayDeque<>();

        stack.push(top);
        cursors.push(new int[] { 0 });
        path.add(top.id());
        onPath.add(top.id());

        while (!stack.isEmpty()) {
            Gate gate = stack.peek();
            int[] cursor = cursors.peek();
            if (cursor[0] < gate.children().size()) {
                String childId = gate.children().get(cursor[0]++);
                Gate child = resolveGate(childId);
                if (child == null || done.contains(childId))
                    continue;
                if (onPath.contains(childId))
                    throw new CycleDetectedException(name, cyclePath(path, childId));
                stack.push(child);
                cursors.push(new int[] { 0 });
                path.add(childId);
                onPath.add(childId);
            } else {
                stack.pop();
                cursors.pop();
                path.remove(path.size() - 1);
                onPath.remove(gate.id());
                done.add(gate.id());
            }
        }
    }

    /**
     * Looks up a child gate. A gate that is declared but was never added to
     * this tree is registered as implicit.
     */
    private Gate resolveGate(String id) {
        if (id.equals(top.id()))
            return top;
        Gate gate = interEvents.get(id);
        if (gate != null)
            return gate;
        gate = registry.gate(id);
        if (gate != null) {
            log.debug("Tree '{}': registering implicit gate '{}'", name, gate.name());
            implicitGates.put(id, gate);
            interEvents.put(id, gate);
        }
        return gate;
    }

    private List<String> cyclePath(List<String> path, String repeated) {
        List<String> cycle = new ArrayList<>();
        for (String id : path.subList(path.indexOf(repeated), path.size()))
            cycle.add(gateName(id));
        cycle.add(gateName(repeated));
        return cycle;
    }

    private String gateName(String id) {
        return id.equals(top.id()) ? top.name() : interEvents.get(id).name();
    }

    private void gatherPrimaryEvents() {
        primaryEvents.clear();
        basicEvents.clear();
        houseEvents.clear();
        for (Gate gate : gates()) {
            for (String childId : gate.children()) {
                if (childId.equals(top.id()) || interEvents.containsKey(childId))
                    continue;
                Event event = registry.get(childId);
                if (event == null)
                    throw new UndefinedNodeException(childId,
                            "Node with id '" + childId + "' was not defined in '" + name + "' tree");
                switch (event.kind()) {
                    case BASIC -> basicEvents.put(childId, (BasicEvent) event);
                    case HOUSE -> houseEvents.put(childId, (HouseEvent) event);
                    case GATE -> throw new IllegalStateException(
                            "Gate '" + event.name() + "' escaped cycle checking");
                }
                primaryEvents.put(childId, event);
            }
        }
    }

    private TreeTopology buildTopology() {
        TreeTopology.Builder builder = TreeTopology.builder();
        for (Gate gate : gates())
            builder.addGate(gate);
        for (BasicEvent event : basicEvents.values())
            builder.addBasicEvent(event);
        for (HouseEvent event : houseEvents.values())
            builder.addHouseEvent(event);
        return builder.build();
    }

    /** The top gate followed by all intermediate gates. */
    private List<Gate> gates() {
        List<Gate> all = new ArrayList<>(interEvents.size() + 1);
        all.add(top);
        all.addAll(interEvents.values());
        return all;
    }

    public Gate top() {
        return top;
    }

    /** Returns true once {@link #validate()} has succeeded and no gate was added since. */
    public boolean isValidated() {
        return topology != null;
    }

    /**
     * @throws IllegalStateException if the tree has not been validated.
     */
    public TreeTopology topology() {
        if (topology == null)
            throw new IllegalStateException("Fault tree '" + name + "' has not been validated");
        return topology;
    }

    /** All gates except the top, including implicit ones. */
    public Map<String, Gate> interEvents() {
        return Collections.unmodifiableMap(interEvents);
    }

    public Map<String, Gate> implicitGates() {
        return Collections.unmodifiableMap(implicitGates);
    }

    public Map<String, Event> primaryEvents() {
        return Collections.unmodifiableMap(primaryEvents);
    }

    public Map<String, BasicEvent> basicEvents() {
        return Collections.unmodifiableMap(basicEvents);
    }

    public Map<String, HouseEvent> houseEvents() {
        return Collections.unmodifiableMap(houseEvents);
    }
}
