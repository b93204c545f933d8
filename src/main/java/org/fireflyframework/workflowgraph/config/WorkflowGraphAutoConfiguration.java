/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.workflowgraph.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.workflowgraph.core.extraction.MetadataExtractor;
import org.fireflyframework.workflowgraph.core.extraction.WorkflowSourceParser;
import org.fireflyframework.workflowgraph.core.observability.CompositeGraphEvents;
import org.fireflyframework.workflowgraph.core.observability.GraphEvents;
import org.fireflyframework.workflowgraph.core.observability.GraphLoggerEvents;
import org.fireflyframework.workflowgraph.core.observability.GraphMetrics;
import org.fireflyframework.workflowgraph.core.options.GraphOptions;
import org.fireflyframework.workflowgraph.core.path.PathPermutationGenerator;
import org.fireflyframework.workflowgraph.core.render.DiagramRenderer;
import org.fireflyframework.workflowgraph.core.render.PathListFormatter;
import org.fireflyframework.workflowgraph.core.validation.GraphValidator;
import org.fireflyframework.workflowgraph.service.WorkflowGraphService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;

/**
 * Auto-configuration for workflow graph generation.
 *
 * <p>Activated when {@code firefly.workflow-graph.enabled=true} (default). Metrics are
 * recorded when a {@link MeterRegistry} bean exists and
 * {@code firefly.workflow-graph.metrics.enabled} is not {@code false}.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(WorkflowGraphProperties.class)
@ConditionalOnProperty(name = "firefly.workflow-graph.enabled", havingValue = "true", matchIfMissing = true)
public class WorkflowGraphAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public GraphOptions graphOptions(WorkflowGraphProperties properties) {
        GraphOptions options = properties.toOptions();
        log.info("[workflow-graph] Options initialized: outputMode={} explosionCeiling={} maxBranchPoints={}",
                options.outputMode(), options.explosionCeiling(), options.maxBranchPoints());
        return options;
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowSourceParser workflowSourceParser() {
        return new WorkflowSourceParser();
    }

    @Bean
    @ConditionalOnMissingBean
    public MetadataExtractor metadataExtractor() {
        return new MetadataExtractor();
    }

    @Bean
    @ConditionalOnMissingBean
    public PathPermutationGenerator pathPermutationGenerator() {
        return new PathPermutationGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public GraphValidator graphValidator() {
        return new GraphValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public DiagramRenderer diagramRenderer() {
        return new DiagramRenderer();
    }

    @Bean
    @ConditionalOnMissingBean
    public PathListFormatter pathListFormatter() {
        return new PathListFormatter();
    }

    @Bean
    @ConditionalOnMissingBean(GraphEvents.class)
    public GraphEvents graphEvents(ObjectProvider<MeterRegistry> meterRegistry,
                                   WorkflowGraphProperties properties) {
        // Logger events are not a bean of their own: they would satisfy the missing-bean check above.
        List<GraphEvents> delegates = new ArrayList<>();
        delegates.add(new GraphLoggerEvents());
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null && properties.getMetrics().isEnabled()) {
            log.info("[workflow-graph] Metrics enabled with {}", registry.getClass().getSimpleName());
            delegates.add(new GraphMetrics(registry));
        }
        if (delegates.size() == 1) {
            return delegates.get(0);
        }
        return new CompositeGraphEvents(delegates);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowGraphService workflowGraphService(WorkflowSourceParser parser,
                                                     MetadataExtractor extractor,
                                                     PathPermutationGenerator generator,
                                                     GraphValidator validator,
                                                     DiagramRenderer diagramRenderer,
                                                     PathListFormatter pathListFormatter,
                                                     GraphEvents events,
                                                     GraphOptions options) {
        log.info("[workflow-graph] Workflow graph service initialized");
        return new WorkflowGraphService(parser, extractor, generator, validator, diagramRenderer,
                pathListFormatter, events, options);
    }
}
