package com.di.phaselink.config;

import com.di.phaselink.bus.TopicNames;
import com.di.phaselink.detector.DependencyGraph;
import com.di.phaselink.detector.EntityKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, immutable view of the pipeline: stages by name, the entity dependency graph, the
 * configured roster, and every topic / subscription name derived from them.
 *
 * <p>A stage listens on the completion topic of its upstream stages, so all upstream stages of a
 * stage must publish to the same {@code (phase, content)} topic. Stages in one phase share the
 * phase's fallback topic; synthetic fallback events name the target stage.
 */
public final class PipelineTopology {

    public static final String FALLBACK_PRODUCER_PREFIX = "fallback:";

    private final Map<String, StageDescriptor> stages;
    private final DependencyGraph graph;
    private final List<EntityKey> roster;
    private final TopicNames topicNames;

    public PipelineTopology(Collection<StageDescriptor> stages, DependencyGraph graph,
                            List<EntityKey> roster, TopicNames topicNames) {
        Map<String, StageDescriptor> byName = new LinkedHashMap<>();
        for (StageDescriptor stage : stages) {
            if (byName.putIfAbsent(stage.getName(), stage) != null) {
                throw new IllegalStateException("Duplicate stage name: " + stage.getName());
            }
        }
        this.stages = Collections.unmodifiableMap(byName);
        this.graph = graph;
        this.roster = List.copyOf(roster);
        this.topicNames = topicNames;
        validate();
    }

    private void validate() {
        Map<String, String> subscriptionOwners = new HashMap<>();
        for (StageDescriptor stage : stages.values()) {
            if (stage.getName() == null || stage.getName().isBlank()) {
                throw new IllegalStateException("Stage without a name");
            }
            if (stage.getContent() == null || stage.getContent().isBlank()) {
                throw new IllegalStateException("Stage " + stage.getName() + " has no content label");
            }
            if (stage.isSourceStage()) {
                continue;
            }
            if (stage.getDestinationType() == null || stage.getDestinationType().isBlank()) {
                throw new IllegalStateException("Stage " + stage.getName() + " has upstream stages but no destinationType");
            }
            String sub = mainSubscription(stage);
            String owner = subscriptionOwners.putIfAbsent(sub, stage.getName());
            if (owner != null) {
                throw new IllegalStateException("Stages " + owner + " and " + stage.getName()
                        + " resolve to the same subscription " + sub);
            }
            Set<String> inputTopics = new LinkedHashSet<>();
            for (String upstreamName : stage.getUpstream()) {
                StageDescriptor upstream = stages.get(upstreamName);
                if (upstream == null) {
                    throw new IllegalStateException("Stage " + stage.getName() + " declares unknown upstream " + upstreamName);
                }
                if (upstream.getPhase() >= stage.getPhase()) {
                    throw new IllegalStateException("Upstream " + upstreamName + " (phase " + upstream.getPhase()
                            + ") must precede " + stage.getName() + " (phase " + stage.getPhase() + ")");
                }
                inputTopics.add(completionTopic(upstream));
            }
            if (inputTopics.size() > 1) {
                throw new IllegalStateException("Upstream stages of " + stage.getName()
                        + " publish to different completion topics " + inputTopics);
            }
        }
    }

    public Collection<StageDescriptor> getStages() {
        return stages.values();
    }

    public Optional<StageDescriptor> stage(String name) {
        return Optional.ofNullable(stages.get(name));
    }

    public StageDescriptor requireStage(String name) {
        StageDescriptor stage = stages.get(name);
        if (stage == null) {
            throw new IllegalArgumentException("Unknown stage: " + name);
        }
        return stage;
    }

    public List<StageDescriptor> downstreamOf(String stageName) {
        List<StageDescriptor> result = new ArrayList<>();
        for (StageDescriptor stage : stages.values()) {
            if (stage.getUpstream().contains(stageName)) {
                result.add(stage);
            }
        }
        return result;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public List<EntityKey> getRoster() {
        return roster;
    }

    public TopicNames getTopicNames() {
        return topicNames;
    }

    // ------------------------------------------------------------------------------------------
    // Names
    // ------------------------------------------------------------------------------------------

    public String completionTopic(StageDescriptor stage) {
        return topicNames.completionTopic(stage.getPhase(), stage.getContent());
    }

    public String deadLetterTopic(StageDescriptor stage) {
        return TopicNames.deadLetterTopic(completionTopic(stage));
    }

    /** Completion topic of the upstream stages; empty for a source stage. */
    public Optional<String> inputTopic(StageDescriptor stage) {
        if (stage.isSourceStage()) {
            return Optional.empty();
        }
        return Optional.of(completionTopic(requireStage(stage.getUpstream().get(0))));
    }

    public String mainSubscription(StageDescriptor stage) {
        return topicNames.mainSubscription(stage.getPhase(), stage.getDestinationType());
    }

    public String fallbackTopic(StageDescriptor stage) {
        return topicNames.fallbackTopic(stage.getPhase());
    }

    public String fallbackSubscription(StageDescriptor stage) {
        return topicNames.fallbackSubscription(stage.getPhase());
    }

    /** Every dead-letter topic the engine can route to: one per completion and fallback topic. */
    public Set<String> deadLetterTopics() {
        Set<String> topics = new LinkedHashSet<>();
        for (StageDescriptor stage : stages.values()) {
            topics.add(deadLetterTopic(stage));
            if (!stage.isSourceStage()) {
                topics.add(TopicNames.deadLetterTopic(fallbackTopic(stage)));
            }
        }
        return topics;
    }

    /** Target stage of a synthetic fallback event, or null when the producer is a real stage. */
    public static String fallbackTarget(String producingStage) {
        if (producingStage != null && producingStage.startsWith(FALLBACK_PRODUCER_PREFIX)) {
            return producingStage.substring(FALLBACK_PRODUCER_PREFIX.length());
        }
        return null;
    }
}
