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

package org.fireflyframework.workflowgraph.service;

import com.github.javaparser.ast.CompilationUnit;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.workflowgraph.core.exception.PathExplosionException;
import org.fireflyframework.workflowgraph.core.extraction.MetadataExtractor;
import org.fireflyframework.workflowgraph.core.extraction.WorkflowSourceParser;
import org.fireflyframework.workflowgraph.core.model.WorkflowMetadata;
import org.fireflyframework.workflowgraph.core.observability.GraphEvents;
import org.fireflyframework.workflowgraph.core.options.GraphOptions;
import org.fireflyframework.workflowgraph.core.options.OutputMode;
import org.fireflyframework.workflowgraph.core.path.ExecutionPath;
import org.fireflyframework.workflowgraph.core.path.PathPermutationGenerator;
import org.fireflyframework.workflowgraph.core.render.DiagramRenderer;
import org.fireflyframework.workflowgraph.core.render.PathListFormatter;
import org.fireflyframework.workflowgraph.core.validation.GraphValidator;
import org.fireflyframework.workflowgraph.core.validation.ValidationIssue;
import org.fireflyframework.workflowgraph.core.validation.ValidationReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the library: extract, generate, validate and render in one call.
 *
 * <p>Holds no per-invocation state; a single instance serves concurrent callers.
 */
@Slf4j
public class WorkflowGraphService {

    static final String UNKNOWN_WORKFLOW = "<unknown>";

    private final WorkflowSourceParser parser;
    private final MetadataExtractor extractor;
    private final PathPermutationGenerator generator;
    private final GraphValidator validator;
    private final DiagramRenderer diagramRenderer;
    private final PathListFormatter pathListFormatter;
    private final GraphEvents events;
    private final GraphOptions defaultOptions;

    public WorkflowGraphService(WorkflowSourceParser parser,
                                MetadataExtractor extractor,
                                PathPermutationGenerator generator,
                                GraphValidator validator,
                                DiagramRenderer diagramRenderer,
                                PathListFormatter pathListFormatter,
                                GraphEvents events,
                                GraphOptions defaultOptions) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.diagramRenderer = Objects.requireNonNull(diagramRenderer, "diagramRenderer");
        this.pathListFormatter = Objects.requireNonNull(pathListFormatter, "pathListFormatter");
        this.events = events != null ? events : new GraphEvents() {};
        this.defaultOptions = defaultOptions != null ? defaultOptions : GraphOptions.defaults();
    }

    /** Service with default collaborators, no events and default options. */
    public WorkflowGraphService() {
        this(new WorkflowSourceParser(), new MetadataExtractor(), new PathPermutationGenerator(),
                new GraphValidator(), new DiagramRenderer(), new PathListFormatter(), null, null);
    }

    public GraphOptions defaultOptions() {
        return defaultOptions;
    }

    public WorkflowGraphResult analyze(String source) {
        return analyze(source, defaultOptions);
    }

    public WorkflowGraphResult analyze(String source, GraphOptions options) {
        long start = System.nanoTime();
        CompilationUnit unit;
        try {
            unit = parser.parse(source);
        } catch (RuntimeException e) {
            events.onFailed(UNKNOWN_WORKFLOW, e, elapsedMs(start));
            throw e;
        }
        return run(unit, options, start);
    }

    public WorkflowGraphResult analyze(CompilationUnit unit) {
        return analyze(unit, defaultOptions);
    }

    public WorkflowGraphResult analyze(CompilationUnit unit, GraphOptions options) {
        return run(unit, options, System.nanoTime());
    }

    /**
     * Composes the output text: the diagram if the mode includes it, the path list if the
     * mode includes it and it is enabled, the validation report if it has issues and is
     * enabled. Sections are separated by one blank line.
     */
    public String render(List<ExecutionPath> paths, ValidationReport report, GraphOptions options) {
        List<String> sections = new ArrayList<>(3);
        OutputMode mode = options.outputMode();
        if (mode.includesDiagram()) {
            sections.add(diagramRenderer.render(paths, options));
        }
        if (mode.includesPathList() && options.includePathList()) {
            sections.add(pathListFormatter.format(paths, options));
        }
        if (options.includeValidationReport() && report.hasIssues()) {
            sections.add(report.format());
        }
        return String.join("\n\n", sections);
    }

    private WorkflowGraphResult run(CompilationUnit unit, GraphOptions options, long start) {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(options, "options");
        String workflow = UNKNOWN_WORKFLOW;
        try {
            WorkflowMetadata metadata = extractor.extract(unit, options);
            workflow = metadata.entryTypeName();
            events.onExtracted(workflow, metadata.activities().size(), metadata.branchCount(),
                    metadata.diagnostics().size());

            List<ExecutionPath> paths = generatePaths(metadata, options);
            events.onPathsGenerated(workflow, metadata.branchCount(), paths.size());

            ValidationReport report = validator.validate(metadata, paths, options);
            if (!options.suppressValidation()) {
                events.onValidated(workflow, report.issuesOf(ValidationIssue.Severity.WARNING).size(),
                        report.issuesOf(ValidationIssue.Severity.INFO).size());
            }

            String output = render(paths, report, options);
            events.onCompleted(workflow, options.outputMode(), elapsedMs(start));
            return new WorkflowGraphResult(metadata, paths, report, output);
        } catch (RuntimeException e) {
            events.onFailed(workflow, e, elapsedMs(start));
            throw e;
        }
    }

    private List<ExecutionPath> generatePaths(WorkflowMetadata metadata, GraphOptions options) {
        try {
            return generator.generate(metadata, options);
        } catch (PathExplosionException e) {
            events.onPathExplosion(metadata.entryTypeName(), e.getBranchCount(), e.getTotalPaths(), e.getCeiling());
            throw e;
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
