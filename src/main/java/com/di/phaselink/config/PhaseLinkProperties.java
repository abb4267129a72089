package com.di.phaselink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Single binding for the engine's runtime settings. The pipeline topology itself (stages,
 * sources, dependency edges) lives in {@link #topologyFile}.
 *
 * <pre>
 * phaselink:
 *   persistence-enabled: false
 *   topology-file: classpath:pipeline_topology.yml
 *   bus:
 *     type: local            # local | pubsub
 *     topic-prefix: nba
 *     max-delivery-attempts: 5
 *     initial-backoff: 10s
 *     max-backoff: 10m
 *   fan-out:
 *     max-entities: 500
 *     max-hop-population-pct: 50
 *     max-hops: 2
 *   fallback:
 *     default-deadline: 4h
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "phaselink")
public class PhaseLinkProperties {

    /** When true, the JDBC stores are used; otherwise everything is kept in memory. */
    private boolean persistenceEnabled = false;

    private String topologyFile = "classpath:pipeline_topology.yml";

    private Bus bus = new Bus();
    private FanOut fanOut = new FanOut();
    private Fallback fallback = new Fallback();
    private Dedup dedup = new Dedup();
    private Execution execution = new Execution();

    @Data
    public static class Bus {
        /** {@code local} (in-process) or {@code pubsub}. */
        private String type = "local";
        private String topicPrefix = "nba";
        /** Pub/Sub's hard limit is 10 MB; keep a margin for attributes. */
        private int maxMessageBytes = 10_000_000;
        /** Deliveries before a message is dead-lettered (first delivery included). */
        private int maxDeliveryAttempts = 5;
        private Duration initialBackoff = Duration.ofSeconds(10);
        private Duration maxBackoff = Duration.ofMinutes(10);
        private double backoffMultiplier = 2.0;
        private int defaultParallelism = 4;
        private PubSub pubsub = new PubSub();
    }

    @Data
    public static class PubSub {
        private String projectId;
        private Duration publishTimeout = Duration.ofSeconds(30);
    }

    /**
     * Fan-out ceiling for entity-level change propagation. Defaults are a starting point; tune them
     * from the execution log's scope-ratio and duration figures.
     */
    @Data
    public static class FanOut {
        /** Closure larger than this falls back to full-scope processing. */
        private int maxEntities = 500;
        /** A single hop reaching more than this share of the active population falls back too. */
        private double maxHopPopulationPct = 50.0;
        /** Traversal depth; entities further away are not included. */
        private int maxHops = 2;
    }

    @Data
    public static class Fallback {
        private boolean enabled = true;
        private Duration defaultDeadline = Duration.ofHours(4);
        /** Cron for arming today's timers for every stage (lost-message recovery). */
        private String armCron = "0 0 6 * * *";
        private String zone = "America/New_York";
    }

    @Data
    public static class Dedup {
        private int maxSize = 10_000;
        private Duration expireAfterWrite = Duration.ofHours(24);
    }

    @Data
    public static class Execution {
        private Duration defaultDeadline = Duration.ofMinutes(30);
    }
}
