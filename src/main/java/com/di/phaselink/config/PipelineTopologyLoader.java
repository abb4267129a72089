package com.di.phaselink.config;

import com.di.phaselink.bus.TopicNames;
import com.di.phaselink.detector.DependencyGraph;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Loads the pipeline topology (stages, sources, dependency edges, roster) from
 * {@code phaselink.topology-file} once at startup. An invalid topology fails the context.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class PipelineTopologyLoader {

    static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ResourceLoader resourceLoader;
    private final PhaseLinkProperties properties;

    @Bean
    public PipelineTopology pipelineTopology() {
        String location = properties.getTopologyFile();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Topology file not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            PipelineTopology topology = parse(in, properties.getBus().getTopicPrefix());
            log.info("[TOPOLOGY] Loaded {} stage(s), {} dependency edge(s), {} roster entries from {}",
                    topology.getStages().size(), topology.getGraph().size(), topology.getRoster().size(), location);
            return topology;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read topology file " + location, e);
        }
    }

    public static PipelineTopology parse(InputStream in, String topicPrefix) throws IOException {
        TopologyDocument doc = YAML_MAPPER.readValue(in, TopologyDocument.class);
        if (doc == null) {
            doc = new TopologyDocument();
        }
        return new PipelineTopology(
                doc.getStages() != null ? doc.getStages() : List.of(),
                new DependencyGraph(doc.getEdges() != null ? doc.getEdges() : List.of()),
                doc.getRoster() != null ? doc.getRoster() : List.of(),
                new TopicNames(topicPrefix));
    }
}
