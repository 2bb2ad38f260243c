package com.risk.fta.io;

import com.risk.fta.api.UndefinedNodeException;
import com.risk.fta.api.ValidationException;
import com.risk.fta.engine.FaultTree;
import com.risk.fta.expression.ExponentialExpression;
import com.risk.fta.expression.Expression;
import com.risk.fta.expression.Expressions;
import com.risk.fta.expression.GlmExpression;
import com.risk.fta.expression.LogNormalDeviate;
import com.risk.fta.expression.NormalDeviate;
import com.risk.fta.expression.Parameter;
import com.risk.fta.expression.PeriodicTestExpression;
import com.risk.fta.expression.UniformDeviate;
import com.risk.fta.expression.WeibullExpression;
import com.risk.fta.model.AbstractEvent;
import com.risk.fta.model.BasicEvent;
import com.risk.fta.model.EventRegistry;
import com.risk.fta.model.Gate;
import com.risk.fta.model.GateType;
import com.risk.fta.model.HouseEvent;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles a {@link FaultTreeDefinition} into an event registry and an
 * unvalidated {@link FaultTree}.
 *
 * Compilation order:
 * 1. Parameters, in declaration order. A parameter may reference parameters
 * declared before it.
 * 2. Basic and house events.
 * 3. All gates are declared in the registry first, so parent links are known
 * for the whole model, then added to the tree in declaration order. The first
 * gate is the top event; every later gate must have a parent declared before
 * it. Gate types and arities are checked here, as each gate is declared.
 *
 * The caller validates the returned tree.
 */
public final class FaultTreeCompiler {
    private static final Logger log = LogManager.getLogger(FaultTreeCompiler.class);

    private final Map<String, Parameter> parameters = new HashMap<>();

    /**
     * Compiles the declarations.
     *
     * @param def The declarations.
     * @return The fault tree, backed by a fresh registry.
     * @throws ValidationException      on duplicate or malformed declarations.
     * @throws IllegalArgumentException on unknown gate or expression types.
     */
    public FaultTree compile(FaultTreeDefinition def) {
        if (def.getGates() == null || def.getGates().isEmpty())
            throw new ValidationException("Fault tree '" + def.getName() + "' declares no gates");

        parameters.clear();
        if (def.getParameters() != null) {
            for (FaultTreeDefinition.ParameterDef pd : def.getParameters()) {
                String id = AbstractEvent.toId(pd.getName());
                if (parameters.containsKey(id))
                    throw new ValidationException("Redefinition of parameter '" + pd.getName() + "'");
                parameters.put(id, new Parameter(pd.getName(), toExpression(pd.getExpression(), pd.getName())));
            }
        }

        EventRegistry registry = new EventRegistry();
        if (def.getEvents() != null) {
            for (FaultTreeDefinition.EventDef ed : def.getEvents())
                registry.add(toEvent(ed));
        }

        List<Gate> gates = new ArrayList<>(def.getGates().size());
        for (FaultTreeDefinition.GateDef gd : def.getGates()) {
            Gate gate = toGate(gd);
            registry.add(gate);
            gates.add(gate);
        }

        FaultTree tree = new FaultTree(def.getName(), registry);
        for (Gate gate : gates)
            tree.addGate(gate);

        log.info("Compiled fault tree '{}': {} gates, {} declarations, {} parameters", def.getName(), gates.size(),
                registry.size(), parameters.size());
        return tree;
    }

    private static Gate toGate(FaultTreeDefinition.GateDef gd) {
        if (gd.getType() == null || gd.getType().isBlank())
            throw new ValidationException("Gate '" + gd.getName() + "' is missing its type");
        GateType type = GateType.of(gd.getType());
        List<String> children = gd.getChildren() != null ? gd.getChildren() : List.of();
        Gate gate;
        if (type == GateType.ATLEAST) {
            if (gd.getVote() == null)
                throw new ValidationException("Gate '" + gd.getName() + "' is missing its vote number");
            gate = new Gate(gd.getName(), type, gd.getVote(), children);
        } else {
            gate = new Gate(gd.getName(), type, children);
        }
        gate.checkArity();
        return gate;
    }

    private AbstractEvent toEvent(FaultTreeDefinition.EventDef ed) {
        String kind = ed.getKind() == null ? "basic" : ed.getKind().trim().toLowerCase(Locale.ROOT);
        switch (kind) {
            case "basic":
                if (ed.getExpression() != null)
                    return new BasicEvent(ed.getName(), toExpression(ed.getExpression(), ed.getName()));
                if (ed.getProbability() != null)
                    return new BasicEvent(ed.getName(), Expressions.constant(ed.getProbability()));
                return new BasicEvent(ed.getName());
            case "house":
                return new HouseEvent(ed.getName(), ed.getState() != null && ed.getState());
            default:
                throw new IllegalArgumentException("Unknown event kind '" + ed.getKind() + "' for " + ed.getName());
        }
    }

    private Expression toExpression(FaultTreeDefinition.ExpressionDef xd, String owner) {
        if (xd == null)
            throw new ValidationException("Missing expression in '" + owner + "'");
        ExpressionType type = xd.getType() != null ? ExpressionType.fromString(xd.getType())
                : xd.getParameter() != null ? ExpressionType.PARAMETER : ExpressionType.CONSTANT;

        if (type == ExpressionType.CONSTANT) {
            if (xd.getValue() == null)
                throw new ValidationException("Constant without a value in '" + owner + "'");
            return Expressions.constant(xd.getValue());
        }
        if (type == ExpressionType.PARAMETER) {
            Parameter parameter = xd.getParameter() == null ? null
                    : parameters.get(AbstractEvent.toId(xd.getParameter()));
            if (parameter == null)
                throw new UndefinedNodeException(String.valueOf(xd.getParameter()),
                        "Undefined parameter '" + xd.getParameter() + "' in '" + owner + "'");
            return parameter;
        }

        List<FaultTreeDefinition.ExpressionDef> argDefs = xd.getArgs() != null ? xd.getArgs() : List.of();
        int maxArity = type == ExpressionType.PERIODIC_TEST ? 5 : type.arity();
        if (argDefs.size() < type.arity() || argDefs.size() > maxArity)
            throw new ValidationException("Expression '" + type + "' in '" + owner + "' expects " + type.arity()
                    + " arguments, got " + argDefs.size());
        Expression[] a = new Expression[argDefs.size()];
        for (int i = 0; i < a.length; i++)
            a[i] = toExpression(argDefs.get(i), owner);

        return switch (type) {
            case EXPONENTIAL -> new ExponentialExpression(a[0], a[1]);
            case GLM -> new GlmExpression(a[0], a[1], a[2], a[3]);
            case WEIBULL -> new WeibullExpression(a[0], a[1], a[2], a[3]);
            case PERIODIC_TEST -> a.length == 4 ? new PeriodicTestExpression(a[0], a[1], a[2], a[3])
                    : new PeriodicTestExpression(a[0], a[1], a[2], a[3], a[4]);
            case UNIFORM -> new UniformDeviate(a[0], a[1]);
            case NORMAL -> new NormalDeviate(a[0], a[1]);
            case LOGNORMAL -> new LogNormalDeviate(a[0], a[1]);
            case CONSTANT, PARAMETER -> throw new IllegalStateException("Unreachable: " + type);
        };
    }
}
