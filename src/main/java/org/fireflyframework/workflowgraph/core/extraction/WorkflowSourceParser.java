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

package org.fireflyframework.workflowgraph.core.extraction;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import org.fireflyframework.workflowgraph.core.exception.StructuralException;

/**
 * Parses workflow source text into a {@link CompilationUnit}. Syntax errors surface as
 * {@link StructuralException} at the line the parser reports.
 */
public class WorkflowSourceParser {

    private final ParserConfiguration configuration;

    public WorkflowSourceParser() {
        this(new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public WorkflowSourceParser(ParserConfiguration configuration) {
        this.configuration = configuration;
    }

    public CompilationUnit parse(String source) {
        if (source == null || source.isBlank()) {
            throw new StructuralException("workflow source is empty", 1,
                    "pass the source of a class annotated with @Workflow");
        }
        // JavaParser instances are not thread-safe; one per call.
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        Problem problem = result.getProblems().isEmpty() ? null : result.getProblems().get(0);
        int line = problem == null ? 1 : problem.getLocation()
                .flatMap(tokens -> tokens.toRange())
                .map(range -> range.begin.line)
                .orElse(1);
        String message = problem == null ? "unparseable source" : problem.getMessage();
        Throwable cause = problem == null ? null : problem.getCause().orElse(null);
        throw new StructuralException("workflow source does not parse: " + firstLine(message), line,
                "fix the syntax error before rendering the workflow", cause);
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline).trim() : message;
    }
}
