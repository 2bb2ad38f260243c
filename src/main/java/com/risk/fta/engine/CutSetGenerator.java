package com.risk.fta.engine;

import com.risk.fta.api.EventKind;
import com.risk.fta.model.Gate;
import com.risk.fta.util.Combinations;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Expands the gate logic of a validated fault tree into minimal cut sets.
 *
 * Algorithm:
 * The expansion is depth-first from the top gate.
 * - OR: every child branch contributes its own supersets.
 * - AND / INHIBIT: the supersets built so far are cross-united with each
 * child's contribution.
 * - ATLEAST k/n: OR over the AND of every k-combination of children.
 * - NULL: the child's contribution, as a one-branch OR.
 * Basic events insert their index directly. House events are folded into the
 * logic instead of becoming set members: under AND a true house event is
 * neutral and a false one nulls the branch; under OR a true house event makes
 * the gate certain (unity set) and a false one is dropped.
 *
 * Each gate is expanded once per run and the minimized result is reused by
 * all its parents, so shared sub-trees cost nothing extra.
 *
 * Order limit:
 * Any superset whose order exceeds the limit is discarded as soon as it is
 * built. Since supersets only grow on the way up, a minimal cut set within
 * the limit is never lost; sets above the limit are. The result reports
 * whether anything was discarded.
 *
 * Minimization:
 * After each gate and at the top, sets that are strict supersets of another
 * set are removed and duplicates are merged.
 */
@Log4j2
public final class CutSetGenerator {
    private final int limitOrder;

    public CutSetGenerator(int limitOrder) {
        if (limitOrder < 1)
            throw new IllegalArgumentException("Limit order must be positive: " + limitOrder);
        this.limitOrder = limitOrder;
    }

    public int limitOrder() {
        return limitOrder;
    }

    /**
     * Generates the minimal cut sets of the tree.
     *
     * @throws IllegalStateException if the tree has not been validated.
     */
    public CutSetResult generate(FaultTree tree) {
        Run run = new Run(tree.topology());
        List<Superset> sets = run.expand(0);

        TreeTopology topology = run.topology;
        List<CutSet> cutSets = new ArrayList<>(sets.size());
        int maxOrder = 0;
        for (Superset set : sets) {
            int[] indices = set.toArray();
            List<String> ids = new ArrayList<>(indices.length);
            for (int bi : indices)
                ids.add(topology.basicEvent(bi).id());
            Collections.sort(ids);
            cutSets.add(new CutSet(ids, indices));
            maxOrder = Math.max(maxOrder, indices.length);
        }
        cutSets.sort(Comparator.comparingInt(CutSet::order)
                .thenComparing(cs -> String.join(",", cs.events())));

        if (run.truncated)
            log.warn("Cut sets of '{}' are limited to order {}; larger cut sets were discarded",
                    tree.name(), limitOrder);
        log.info("Generated {} minimal cut sets for '{}' (max order {})", cutSets.size(), tree.name(), maxOrder);
        return new CutSetResult(cutSets, limitOrder, maxOrder, run.truncated);
    }

    /**
     * Minimizes a collection of sets: drops nulled sets, duplicates, and any
     * set that contains another set of the collection.
     */
    public static List<Superset> minimize(List<Superset> sets) {
        List<Superset> sorted = new ArrayList<>(sets.size());
        for (Superset set : sets) {
            if (!set.isNull())
                sorted.add(set);
        }
        sorted.sort(Comparator.comparingInt(Superset::order));
        List<Superset> minimal = new ArrayList<>();
        for (Superset candidate : sorted) {
            boolean subsumed = false;
            for (Superset kept : minimal) {
                if (kept.isSubsetOf(candidate)) {
                    subsumed = true;
                    break;
                }
            }
            if (!subsumed)
                minimal.add(candidate);
        }
        return minimal;
    }

    /** State of one generation run. Memoized gate results are never mutated. */
    private final class Run {
        private final TreeTopology topology;
        private final List<List<Superset>> memo;
        private boolean truncated;

        Run(TreeTopology topology) {
            this.topology = topology;
            this.memo = new ArrayList<>(Collections.nCopies(topology.gateCount(), null));
        }

        List<Superset> expand(int gi) {
            List<Superset> cached = memo.get(gi);
            if (cached != null)
                return cached;
            List<Superset> out = new ArrayList<>();
            expandSets(gi, out);
            List<Superset> minimal = minimize(out);
            memo.set(gi, minimal);
            if (log.isDebugEnabled())
                log.debug("Gate '{}' expanded into {} sets", topology.gate(gi).name(), minimal.size());
            return minimal;
        }

        /** Appends the supersets of the gate to {@code out}. */
        void expandSets(int gi, List<Superset> out) {
            Gate gate = topology.gate(gi);
            int start = topology.childrenStart(gi);
            int end = topology.childrenEnd(gi);
            switch (gate.type()) {
                case OR, NULL -> {
                    for (int ci = start; ci < end; ci++)
                        expandBranch(ci, out);
                }
                case AND, INHIBIT -> {
                    int[] children = new int[end - start];
                    for (int i = 0; i < children.length; i++)
                        children[i] = start + i;
                    out.addAll(crossUnite(children));
                }
                case ATLEAST -> {
                    int k = gate.voteNumber();
                    if (k <= 0) {
                        out.add(new Superset());
                        break;
                    }
                    if (k > end - start)
                        break;
                    for (int[] combination : new Combinations(end - start, k)) {
                        for (int i = 0; i < combination.length; i++)
                            combination[i] += start;
                        out.addAll(crossUnite(combination));
                    }
                }
            }
        }

        /** One OR branch: the child's sets are added as they are. */
        private void expandBranch(int flatChild, List<Superset> out) {
            int child = topology.childAt(flatChild);
            switch (topology.childKindAt(flatChild)) {
                case BASIC -> out.add(Superset.of(child));
                case HOUSE -> {
                    if (topology.houseEvent(child).state())
                        out.add(new Superset());
                }
                case GATE -> out.addAll(expand(child));
            }
        }

        /** AND of the given children (flat child positions). */
        private List<Superset> crossUnite(int[] flatChildren) {
            List<Superset> acc = new ArrayList<>();
            acc.add(new Superset());
            for (int flatChild : flatChildren) {
                int child = topology.childAt(flatChild);
                EventKind kind = topology.childKindAt(flatChild);
                List<Superset> next = new ArrayList<>();
                if (kind == EventKind.HOUSE) {
                    boolean state = topology.houseEvent(child).state();
                    for (Superset set : acc) {
                        set.foldHouse(state);
                        if (!set.isNull())
                            next.add(set);
                    }
                } else if (kind == EventKind.BASIC) {
                    for (Superset set : acc) {
                        set.insert(child);
                        keep(set, next);
                    }
                } else {
                    List<Superset> childSets = expand(child);
                    for (Superset set : acc) {
                        for (Superset childSet : childSets) {
                            Superset united = set.copy();
                            united.unite(childSet);
                            keep(united, next);
                        }
                    }
                    next = minimize(next);
                }
                acc = next;
                if (acc.isEmpty())
                    break;
            }
            return acc;
        }

        private void keep(Superset set, List<Superset> next) {
            if (set.isNull())
                return;
            if (set.order() > limitOrder) {
                truncated = true;
                return;
            }
            next.add(set);
        }
    }
}
