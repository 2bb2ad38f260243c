package com.risk.fta.io;

import com.risk.fta.api.DanglingGateException;
import com.risk.fta.api.DuplicateDefinitionException;
import com.risk.fta.api.UndefinedNodeException;
import com.risk.fta.api.ValidationException;
import com.risk.fta.engine.FaultTree;
import com.risk.fta.expression.Expression;
import com.risk.fta.expression.PeriodicTestExpression;
import com.risk.fta.model.BasicEvent;
import com.risk.fta.model.GateType;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class FaultTreeCompilerTest {

    private static FaultTreeDefinition.GateDef gate(String name, String type, String... children) {
        FaultTreeDefinition.GateDef g = new FaultTreeDefinition.GateDef();
        g.setName(name);
        g.setType(type);
        g.setChildren(List.of(children));
        return g;
    }

    private static FaultTreeDefinition.EventDef basic(String name, double probability) {
        FaultTreeDefinition.EventDef e = new FaultTreeDefinition.EventDef();
        e.setName(name);
        e.setKind("basic");
        e.setProbability(probability);
        return e;
    }

    private static FaultTreeDefinition.EventDef house(String name, boolean state) {
        FaultTreeDefinition.EventDef e = new FaultTreeDefinition.EventDef();
        e.setName(name);
        e.setKind("house");
        e.setState(state);
        return e;
    }

    private static FaultTreeDefinition.ExpressionDef constant(double value) {
        FaultTreeDefinition.ExpressionDef x = new FaultTreeDefinition.ExpressionDef();
        x.setValue(value);
        return x;
    }

    private static FaultTreeDefinition.ExpressionDef ref(String parameter) {
        FaultTreeDefinition.ExpressionDef x = new FaultTreeDefinition.ExpressionDef();
        x.setParameter(parameter);
        return x;
    }

    private static FaultTreeDefinition.ExpressionDef expr(String type, FaultTreeDefinition.ExpressionDef... args) {
        FaultTreeDefinition.ExpressionDef x = new FaultTreeDefinition.ExpressionDef();
        x.setType(type);
        x.setArgs(List.of(args));
        return x;
    }

    private static FaultTreeDefinition definition(List<FaultTreeDefinition.GateDef> gates,
            FaultTreeDefinition.EventDef... events) {
        FaultTreeDefinition def = new FaultTreeDefinition();
        def.setName("plant");
        def.setGates(gates);
        def.setEvents(new ArrayList<>(List.of(events)));
        return def;
    }

    @Test
    public void testCompilesGatesInDeclarationOrder() {
        FaultTreeDefinition def = definition(
                List.of(gate("Top", "or", "G1", "c"), gate("G1", "and", "a", "b")),
                basic("a", 0.1), basic("b", 0.2), basic("c", 0.3));

        FaultTree tree = new FaultTreeCompiler().compile(def);
        assertEquals("plant", tree.name());
        assertEquals("top", tree.top().id());
        assertEquals(GateType.OR, tree.top().type());
        assertTrue(tree.interEvents().containsKey("g1"));
        assertFalse(tree.isValidated());

        tree.validate();
        assertEquals(0.2, tree.basicEvents().get("b").probability(), 0);
    }

    @Test
    public void testVotingGate() {
        FaultTreeDefinition.GateDef vote = gate("Top", "atleast", "a", "b", "c");
        vote.setVote(2);
        FaultTree tree = new FaultTreeCompiler().compile(
                definition(List.of(vote), basic("a", 0.1), basic("b", 0.1), basic("c", 0.1)));
        assertEquals(GateType.ATLEAST, tree.top().type());
        assertEquals(2, tree.top().voteNumber());
    }

    @Test(expected = ValidationException.class)
    public void testVotingGateNeedsVoteNumber() {
        new FaultTreeCompiler().compile(definition(List.of(gate("Top", "vote", "a", "b", "c")),
                basic("a", 0.1), basic("b", 0.1), basic("c", 0.1)));
    }

    @Test
    public void testGateArityIsCheckedOnDeclaration() {
        try {
            new FaultTreeCompiler().compile(definition(List.of(gate("Top", "and", "a")), basic("a", 0.1)));
            fail("Expected ValidationException");
        } catch (ValidationException e) {
            assertTrue(e.getMessage().contains("Top"));
        }
    }

    @Test
    public void testGateWithoutType() {
        try {
            new FaultTreeCompiler().compile(definition(List.of(gate("Top", null, "a", "b")),
                    basic("a", 0.1), basic("b", 0.2)));
            fail("Expected ValidationException");
        } catch (ValidationException e) {
            assertTrue(e.getMessage().contains("Top"));
            assertTrue(e.getMessage().contains("type"));
        }
    }

    @Test
    public void testChildGateDeclaredBeforeParentIsDangling() {
        FaultTreeDefinition def = definition(
                List.of(gate("Top", "or", "G1", "c"), gate("G2", "and", "a", "b"), gate("G1", "or", "G2", "c")),
                basic("a", 0.1), basic("b", 0.2), basic("c", 0.3));
        try {
            new FaultTreeCompiler().compile(def);
            fail("Expected DanglingGateException");
        } catch (DanglingGateException e) {
            assertEquals("g2", e.gateId());
        }
    }

    @Test(expected = DuplicateDefinitionException.class)
    public void testDuplicateDeclaration() {
        new FaultTreeCompiler().compile(definition(List.of(gate("Top", "or", "a", "b")),
                basic("a", 0.1), basic("b", 0.2), house("A", true)));
    }

    @Test(expected = ValidationException.class)
    public void testNoGates() {
        new FaultTreeCompiler().compile(definition(List.of(), basic("a", 0.1)));
    }

    @Test
    public void testHouseAndUnquantifiedEvents() {
        FaultTreeDefinition.EventDef bare = new FaultTreeDefinition.EventDef();
        bare.setName("b");
        FaultTree tree = new FaultTreeCompiler().compile(
                definition(List.of(gate("Top", "and", "b", "h")), bare, house("h", false)));
        tree.validate();
        assertFalse(tree.basicEvents().get("b").hasExpression());
        assertFalse(tree.houseEvents().get("h").state());
    }

    @Test
    public void testExpressionsAndParameters() {
        FaultTreeDefinition.ParameterDef time = new FaultTreeDefinition.ParameterDef();
        time.setName("MissionTime");
        time.setExpression(constant(1000));

        FaultTreeDefinition.EventDef pump = basic("pump", 0.5);
        pump.setExpression(expr("exponential", constant(1e-4), ref("missiontime")));
        FaultTreeDefinition.EventDef valve = new FaultTreeDefinition.EventDef();
        valve.setName("valve");
        valve.setExpression(expr("periodic-test", constant(1e-3), constant(100), constant(50), ref("MissionTime")));

        FaultTreeDefinition def = definition(List.of(gate("Top", "or", "pump", "valve")), pump, valve);
        def.setParameters(List.of(time));
        FaultTree tree = new FaultTreeCompiler().compile(def);
        tree.validate();

        BasicEvent pumpEvent = tree.basicEvents().get("pump");
        assertEquals(1 - Math.exp(-0.1), pumpEvent.probability(), 1e-12);

        Expression valveExpression = tree.basicEvents().get("valve").expression();
        assertTrue(valveExpression instanceof PeriodicTestExpression);
        assertSame(pumpEvent.expression().args().get(1), valveExpression.args().get(3));
    }

    @Test
    public void testUndefinedParameter() {
        FaultTreeDefinition.EventDef pump = new FaultTreeDefinition.EventDef();
        pump.setName("pump");
        pump.setExpression(expr("exponential", constant(1e-4), ref("nowhere")));
        try {
            new FaultTreeCompiler().compile(definition(List.of(gate("Top", "or", "pump", "x")), pump,
                    basic("x", 0.1)));
            fail("Expected UndefinedNodeException");
        } catch (UndefinedNodeException e) {
            assertTrue(e.getMessage().contains("nowhere"));
        }
    }

    @Test
    public void testWrongArgumentCount() {
        FaultTreeDefinition.EventDef pump = new FaultTreeDefinition.EventDef();
        pump.setName("pump");
        pump.setExpression(expr("weibull", constant(1), constant(2)));
        try {
            new FaultTreeCompiler().compile(definition(List.of(gate("Top", "or", "pump", "x")), pump,
                    basic("x", 0.1)));
            fail("Expected ValidationException");
        } catch (ValidationException e) {
            assertTrue(e.getMessage().contains("WEIBULL"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownExpressionType() {
        FaultTreeDefinition.EventDef pump = new FaultTreeDefinition.EventDef();
        pump.setName("pump");
        pump.setExpression(expr("gamma-deviate", constant(1), constant(2)));
        new FaultTreeCompiler().compile(definition(List.of(gate("Top", "or", "pump", "x")), pump,
                basic("x", 0.1)));
    }

    @Test
    public void testExpressionTypeNames() {
        Map<String, ExpressionType> names = Map.of("periodic-test", ExpressionType.PERIODIC_TEST,
                "LogNormal", ExpressionType.LOGNORMAL, "glm", ExpressionType.GLM);
        names.forEach((text, type) -> assertEquals(type, ExpressionType.fromString(text)));
    }
}
