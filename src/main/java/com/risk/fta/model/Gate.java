package com.risk.fta.model;

import com.risk.fta.api.EventKind;
import com.risk.fta.api.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A logical combinator over an ordered list of child events.
 *
 * Children are stored as ids only. The same child id may appear under many
 * gates, which makes the fault tree a DAG; gates never reference their
 * parents.
 */
public final class Gate extends AbstractEvent {
    private final GateType type;
    private final int voteNumber;
    private final List<String> children;

    public Gate(String name, GateType type, List<String> childNames) {
        this(name, type, 0, childNames);
    }

    /**
     * @param name       Declared gate name.
     * @param type       Logical operator.
     * @param voteNumber The k of a k-out-of-n {@link GateType#ATLEAST} gate; ignored otherwise.
     * @param childNames Declared names of the children in order.
     */
    public Gate(String name, GateType type, int voteNumber, List<String> childNames) {
        super(name);
        this.type = type;
        this.voteNumber = voteNumber;
        Set<String> ids = new LinkedHashSet<>();
        for (String child : childNames) {
            if (!ids.add(toId(child)))
                throw new ValidationException("Gate '" + name + "' has duplicate child '" + child + "'");
        }
        this.children = Collections.unmodifiableList(new ArrayList<>(ids));
    }

    @Override
    public EventKind kind() {
        return EventKind.GATE;
    }

    public GateType type() {
        return type;
    }

    public int voteNumber() {
        return voteNumber;
    }

    /** Child ids in declaration order. */
    public List<String> children() {
        return children;
    }

    /**
     * Verifies the number of children against the operator.
     *
     * @throws ValidationException if the gate is malformed.
     */
    public void checkArity() {
        int n = children.size();
        switch (type) {
            case AND, OR -> {
                if (n < 2)
                    throw arityError("at least 2 children");
            }
            case ATLEAST -> {
                if (voteNumber < 2 || voteNumber >= n)
                    throw arityError("a vote number k with 2 <= k < " + n + ", got " + voteNumber);
            }
            case INHIBIT -> {
                if (n != 2)
                    throw arityError("exactly 2 children");
            }
            case NULL -> {
                if (n != 1)
                    throw arityError("exactly 1 child");
            }
        }
    }

    private ValidationException arityError(String requirement) {
        return new ValidationException(type + " gate '" + name() + "' requires " + requirement
                + " (has " + children.size() + ")");
    }
}
