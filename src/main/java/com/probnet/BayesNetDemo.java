package com.probnet;

import com.probnet.api.InferenceListener;
import com.probnet.disruptor.QueryPublisher;
import com.probnet.engine.EnumerationEngine;
import com.probnet.engine.Posterior;
import com.probnet.engine.TopologicalOrder;
import com.probnet.io.JsonNetworkLoader;
import com.probnet.node.Variable;
import com.probnet.util.CompositeInferenceListener;
import com.probnet.util.CptFormatter;
import com.probnet.util.LatencyTrackingListener;
import lombok.extern.log4j.Log4j2;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the bundled example networks: the four-variable chain, the Monty Hall
 * problem and the burglary alarm, the latter through the ring-buffer front
 * end.
 */
@Log4j2
public class BayesNetDemo {

    public static void main(String[] args) throws Exception {
        log.info("Starting Bayesian network demo...");
        problem3c();
        montyHall();
        burglary();
    }

    static void problem3c() throws Exception {
        var loaded = JsonNetworkLoader.fromClasspath("/networks/problem3c.json");
        for (Variable v : loaded.network().variables())
            log.info("Probability distribution of {} given {}\n{}", v.name(), v.parents(), CptFormatter.format(v));

        EnumerationEngine engine = loaded.newEngine();
        TopologicalOrder topology = engine.topology();
        log.info("Topological order: {}", topology);
        for (int ti = 0; ti < topology.nodeCount(); ti++)
            log.info("  {}: {} parents, {} children", topology.node(ti).name(), topology.parentCount(ti),
                    topology.childCount(ti));

        Posterior prior = engine.query("A");
        log.info("{}\n{}", prior, CptFormatter.format(prior));

        Posterior posterior = engine.query("A", Map.of("C", 1, "D", 1));
        log.info("{}\n{}", posterior, CptFormatter.format(posterior));
    }

    static void montyHall() throws Exception {
        EnumerationEngine engine = JsonNetworkLoader.fromClasspath("/networks/monty_hall.json").newEngine();
        log.info("Monty Hall host table\n{}", CptFormatter.format(engine.network().variable("OpenedByHost")));

        // Guest picked door 0, host opened door 2
        Posterior prize = engine.query("Prize", Map.of("ChosenByGuest", 0, "OpenedByHost", 2));
        log.info("{}\n{}", prize, CptFormatter.format(prize));
        log.info("Stay wins with p={}, switching to door 1 wins with p={}",
                String.format("%.4f", prize.probability(0)), String.format("%.4f", prize.probability(1)));
    }

    static void burglary() throws Exception {
        EnumerationEngine engine = JsonNetworkLoader.fromClasspath("/networks/burglary.json").newEngine();
        LatencyTrackingListener latency = new LatencyTrackingListener();
        engine.setListener(new CompositeInferenceListener()
                .add(latency)
                .add(new InferenceListener() {
                    @Override
                    public void onQueryStart(String queryVariable, Map<String, Integer> evidence) {
                        log.info("Query P({} | {})", queryVariable, evidence);
                    }

                    @Override
                    public void onQueryEnd(String queryVariable, long evaluations, long durationNanos) {
                        log.info("Answered {} after {} table lookups", queryVariable, evaluations);
                    }

                    @Override
                    public void onQueryError(String queryVariable, Throwable error) {
                        log.warn("Query for {} failed: {}", queryVariable, error.getMessage());
                    }
                }));

        try (QueryPublisher publisher = new QueryPublisher(engine)) {
            CompletableFuture<Posterior> both = publisher.submit("Burglary", Map.of("JohnCalls", 1, "MaryCalls", 1));
            CompletableFuture<Posterior> alarm = publisher.submit("Burglary", Map.of("Alarm", 1));
            CompletableFuture<Posterior> explained = publisher.submit("Burglary",
                    Map.of("Alarm", 1, "Earthquake", 1));
            log.info("{}", both.get());
            log.info("{}", alarm.get());
            log.info("{} (explained away)", explained.get());
        }
        log.info("Latency:\n{}", latency.dump());
    }
}
