package com.risk.fta.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of already-parsed fault tree declarations.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FaultTreeDefinition {
    private String name;
    /** Gates in declaration order; the first one is the top event. */
    private List<GateDef> gates;
    private List<EventDef> events;
    /** Named expressions referenced from event expressions. */
    private List<ParameterDef> parameters;

    /** Declaration of a single gate. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GateDef {
        private String name, type;
        /** Vote number of an ATLEAST gate. */
        private Integer vote;
        private List<String> children;
    }

    /** Declaration of a basic or house event. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class EventDef {
        private String name;
        /** "basic" or "house". */
        private String kind;
        /** Literal probability of a basic event. */
        private Double probability;
        /** Probability model of a basic event; takes precedence over the literal. */
        private ExpressionDef expression;
        /** State of a house event. */
        private Boolean state;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ParameterDef {
        private String name;
        private ExpressionDef expression;
    }

    /**
     * Declaration of an expression node. Constants carry {@code value},
     * parameter references carry {@code parameter}, everything else carries
     * its arguments in {@code args}.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ExpressionDef {
        private String type;
        private Double value;
        private String parameter;
        private List<ExpressionDef> args;
    }
}
