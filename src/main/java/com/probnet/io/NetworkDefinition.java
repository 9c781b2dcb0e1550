package com.probnet.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a Bayesian network definition file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NetworkDefinition {
    private NetworkInfo network;

    /** Meta-information and variables of the network. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NetworkInfo {
        private String name, description;
        /** Evaluation budget per query; 0 or absent means unlimited. */
        private long maxEvaluations;
        private List<VariableDef> variables;
    }

    /** Definition of a single variable and its table. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class VariableDef {
        private String name, description;
        private Integer states;
        private List<String> parents;
        /** Optional; defaults to the parents' own state counts. */
        private List<Integer> parentStates;
        private double[][] table;
    }
}
