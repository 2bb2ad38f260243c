package com.risk.fta.engine;

import com.risk.fta.api.Event;
import com.risk.fta.api.EventKind;
import com.risk.fta.model.BasicEvent;
import com.risk.fta.model.Gate;
import com.risk.fta.model.HouseEvent;

import java.util.*;

/**
 * Topology -- CSR-encoded static view of a validated fault tree.
 *
 * This class represents the immutable structure of the tree after validation.
 * It is what the cut set generator walks, so gates, basic events and house
 * events are addressed by dense integer indices instead of string ids.
 *
 * Data layout:
 * - gates: Gate objects sorted topologically, top first. Iterating 0..N
 * visits every parent before its children.
 * - childrenList / childKinds: Flat arrays holding, for all gates, the index
 * and the kind of each child. A GATE child indexes {@code gates}, a BASIC child
 * indexes {@code basicEvents}, a HOUSE child indexes {@code houseEvents}.
 * - childrenOffset: childrenOffset[g] points to the start of gate g's children;
 * they run up to childrenOffset[g+1] exclusive.
 * - parentCount: number of gates listing gate g as a child, derived from the
 * child lists. Shared sub-trees have more than one parent.
 */
public final class TreeTopology {
    private final Gate[] gates;
    private final BasicEvent[] basicEvents;
    private final HouseEvent[] houseEvents;

    private final int[] childrenOffset;
    private final int[] childrenList;
    private final EventKind[] childKinds;
    private final int[] parentCount;

    private final Map<String, Integer> gateIndex;
    private final Map<String, Integer> basicIndex;

    private TreeTopology(Gate[] gates, BasicEvent[] basicEvents, HouseEvent[] houseEvents, int[] childrenOffset,
            int[] childrenList, EventKind[] childKinds, int[] parentCount, Map<String, Integer> gateIndex,
            Map<String, Integer> basicIndex) {
        this.gates = gates;
        this.basicEvents = basicEvents;
        this.houseEvents = houseEvents;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.childKinds = childKinds;
        this.parentCount = parentCount;
        this.gateIndex = gateIndex;
        this.basicIndex = basicIndex;
    }

    public int gateCount() {
        return gates.length;
    }

    public int basicEventCount() {
        return basicEvents.length;
    }

    public int houseEventCount() {
        return houseEvents.length;
    }

    /** The top gate is always at index 0. */
    public Gate top() {
        return gates[0];
    }

    public Gate gate(int gi) {
        return gates[gi];
    }

    public BasicEvent basicEvent(int bi) {
        return basicEvents[bi];
    }

    public HouseEvent houseEvent(int hi) {
        return houseEvents[hi];
    }

    /** Resolves a gate id to its topological index. */
    public int gateIndex(String id) {
        Integer idx = gateIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown gate: " + id);
        return idx;
    }

    /** Resolves a basic event id to its index. */
    public int basicEventIndex(String id) {
        Integer idx = basicIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown basic event: " + id);
        return idx;
    }

    public int childCount(int gi) {
        return childrenOffset[gi + 1] - childrenOffset[gi];
    }

    public int childrenStart(int gi) {
        return childrenOffset[gi];
    }

    public int childrenEnd(int gi) {
        return childrenOffset[gi + 1];
    }

    /** Index of the child at a flat position, interpreted according to {@link #childKindAt(int)}. */
    public int childAt(int flatIndex) {
        return childrenList[flatIndex];
    }

    public EventKind childKindAt(int flatIndex) {
        return childKinds[flatIndex];
    }

    public int parentCount(int gi) {
        return parentCount[gi];
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TreeTopology.
     * Handles child resolution and topological sorting of gates.
     */
    public static final class Builder {
        private final List<Gate> gates = new ArrayList<>();
        private final Map<String, Integer> gateIdx = new HashMap<>();
        private final List<BasicEvent> basics = new ArrayList<>();
        private final Map<String, Integer> basicIdx = new HashMap<>();
        private final List<HouseEvent> houses = new ArrayList<>();
        private final Map<String, Integer> houseIdx = new HashMap<>();

        /** The first gate added becomes the top. */
        public Builder addGate(Gate gate) {
            register(gate, gates, gateIdx);
            return this;
        }

        public Builder addBasicEvent(BasicEvent event) {
            register(event, basics, basicIdx);
            return this;
        }

        public Builder addHouseEvent(HouseEvent event) {
            register(event, houses, houseIdx);
            return this;
        }

        private static <E extends Event> void register(E event, List<E> list, Map<String, Integer> idx) {
            if (idx.containsKey(event.id()))
                throw new IllegalArgumentException("Duplicate event: " + event.name());
            idx.put(event.id(), list.size());
            list.add(event);
        }

        /**
         * Compiles the topology.
         * <p>
         * Performs Kahn's algorithm over gate-to-gate edges. The tree is expected
         * to be validated already; a cycle here is a programming error.
         *
         * @throws IllegalStateException if gates form a cycle or a child is unknown.
         */
        public TreeTopology build() {
            int n = gates.size();
            if (n == 0)
                throw new IllegalStateException("Topology requires at least the top gate");
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees over gate children
            for (Gate g : gates)
                for (String child : g.children()) {
                    Integer ci = gateIdx.get(child);
                    if (ci != null)
                        inDegree[ci]++;
                }

            // 2. Kahn's algorithm starting from the top
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;
            if (tail != 1 || queue[0] != 0)
                throw new IllegalStateException("The top gate must be the only gate without parents");

            int[] reverseMap = new int[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (String child : gates.get(curr).children()) {
                    Integer ci = gateIdx.get(child);
                    if (ci != null && --inDegree[ci] == 0)
                        queue[tail++] = ci;
                }
            }
            if (topoIdx != n)
                throw new IllegalStateException("Cycle detected! Processed " + topoIdx + " of " + n);

            // 3. Construct ordered gate array and lookup
            Gate[] ordered = new Gate[n];
            Map<String, Integer> orderedIndex = new HashMap<>(n * 2);
            int totalEdges = 0;
            for (int ti = 0; ti < n; ti++) {
                ordered[ti] = gates.get(reverseMap[ti]);
                orderedIndex.put(ordered[ti].id(), ti);
                totalEdges += ordered[ti].children().size();
            }

            // 4. Build CSR structure
            int[] offsets = new int[n + 1];
            int[] flatChildren = new int[totalEdges];
            EventKind[] kinds = new EventKind[totalEdges];
            int[] parents = new int[n];
            int pos = 0;
            for (int ti = 0; ti < n; ti++) {
                offsets[ti] = pos;
                for (String child : ordered[ti].children()) {
                    Integer ci = orderedIndex.get(child);
                    if (ci != null) {
                        flatChildren[pos] = ci;
                        kinds[pos] = EventKind.GATE;
                        parents[ci]++;
                    } else if (basicIdx.containsKey(child)) {
                        flatChildren[pos] = basicIdx.get(child);
                        kinds[pos] = EventKind.BASIC;
                    } else if (houseIdx.containsKey(child)) {
                        flatChildren[pos] = houseIdx.get(child);
                        kinds[pos] = EventKind.HOUSE;
                    } else {
                        throw new IllegalStateException(
                                "Unresolved child '" + child + "' of gate '" + ordered[ti].name() + "'");
                    }
                    pos++;
                }
            }
            offsets[n] = pos;

            return new TreeTopology(ordered, basics.toArray(new BasicEvent[0]), houses.toArray(new HouseEvent[0]),
                    offsets, flatChildren, kinds, parents, orderedIndex, new HashMap<>(basicIdx));
        }
    }
}
