package com.probnet.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.probnet.engine.BayesianNetwork;
import com.probnet.engine.EnumerationEngine;
import com.probnet.node.Variable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a JSON {@link NetworkDefinition} into a {@link BayesianNetwork}.
 *
 * <p>
 * Edges are derived from each variable's {@code parents} list, so a loaded
 * network is consistent by construction. Variables may appear in any order
 * in the file.
 */
@Log4j2
public final class JsonNetworkLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    private JsonNetworkLoader() {
        // Utility class
    }

    /** Parses and compiles a network file. */
    public static LoadedNetwork load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public static LoadedNetwork load(InputStream in) throws IOException {
        NetworkDefinition def;
        try {
            def = MAPPER.readValue(in, NetworkDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed network definition: " + e.getOriginalMessage(), e);
        }
        return compile(def);
    }

    /** Parses and compiles a network definition held in a string. */
    public static LoadedNetwork parse(String json) {
        NetworkDefinition def;
        try {
            def = MAPPER.readValue(json, NetworkDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed network definition: " + e.getOriginalMessage(), e);
        }
        return compile(def);
    }

    /**
     * Loads a network bundled on the classpath, e.g.
     * {@code "/networks/problem3c.json"}.
     */
    public static LoadedNetwork fromClasspath(String resource) throws IOException {
        try (InputStream in = JsonNetworkLoader.class.getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Network resource not found: " + resource);
            return load(in);
        }
    }

    /**
     * Compiles an already parsed definition.
     *
     * @throws IllegalArgumentException if required fields are missing; table
     *                                  and structure errors surface as the
     *                                  typed exceptions of {@link Variable} and
     *                                  {@link BayesianNetwork}.
     */
    public static LoadedNetwork compile(NetworkDefinition def) {
        NetworkDefinition.NetworkInfo info = def == null ? null : def.getNetwork();
        if (info == null)
            throw new IllegalArgumentException("Missing 'network' key");
        if (info.getMaxEvaluations() < 0)
            throw new IllegalArgumentException("maxEvaluations must be >= 0");
        List<NetworkDefinition.VariableDef> defs = info.getVariables() != null ? info.getVariables()
                : Collections.emptyList();

        Map<String, NetworkDefinition.VariableDef> byName = new HashMap<>(defs.size() * 2);
        for (NetworkDefinition.VariableDef vd : defs) {
            if (vd.getName() == null)
                throw new IllegalArgumentException("Variable without 'name' in network " + info.getName());
            if (vd.getStates() == null)
                throw new IllegalArgumentException("Variable " + vd.getName() + " is missing 'states'");
            if (vd.getTable() == null)
                throw new IllegalArgumentException("Variable " + vd.getName() + " is missing 'table'");
            byName.putIfAbsent(vd.getName(), vd);
        }

        BayesianNetwork network = new BayesianNetwork();
        for (NetworkDefinition.VariableDef vd : defs) {
            List<String> parents = vd.getParents() != null ? vd.getParents() : Collections.emptyList();
            network.addVariable(new Variable(vd.getName(), vd.getStates(), vd.getTable(), parents,
                    parentStates(vd, parents, byName)));
        }
        for (NetworkDefinition.VariableDef vd : defs)
            if (vd.getParents() != null)
                for (String parent : vd.getParents())
                    network.addEdge(parent, vd.getName());

        log.debug("Compiled network '{}' with {} variables", info.getName(), network.size());
        return new LoadedNetwork(info.getName(), network, info.getMaxEvaluations());
    }

    private static int[] parentStates(NetworkDefinition.VariableDef vd, List<String> parents,
            Map<String, NetworkDefinition.VariableDef> byName) {
        if (vd.getParentStates() != null) {
            List<Integer> declared = vd.getParentStates();
            int[] out = new int[declared.size()];
            for (int i = 0; i < out.length; i++) {
                Integer states = declared.get(i);
                if (states == null)
                    throw new IllegalArgumentException("Variable " + vd.getName() + " has null parentStates entry");
                out[i] = states;
            }
            return out;
        }
        List<Integer> inferred = new ArrayList<>(parents.size());
        for (String parent : parents) {
            NetworkDefinition.VariableDef pd = byName.get(parent);
            if (pd == null)
                throw new IllegalArgumentException("Variable " + vd.getName() + " has undeclared parent " + parent
                        + " and no 'parentStates'");
            inferred.add(pd.getStates());
        }
        return inferred.stream().mapToInt(Integer::intValue).toArray();
    }

    /** The result of compilation: a named network and its engine options. */
    public record LoadedNetwork(String name, BayesianNetwork network, long maxEvaluations) {

        /** Builds an engine over the network with the file's evaluation budget. */
        public EnumerationEngine newEngine() {
            return new EnumerationEngine(network, maxEvaluations);
        }
    }
}
