/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.woozie.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;

import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the workflow compiler.
 *
 * Provides 5 compiler metrics:
 * - woozie.compile.total (counter) - Compilations started
 * - woozie.compile.failed (counter) - Compilations aborted, by error kind
 * - woozie.compile.duration.seconds (histogram) - Compilation duration
 * - woozie.compile.actions (histogram) - Ordinary actions per workflow
 * - woozie.compile.forkjoin.pairs (histogram) - Fork/join pairs synthesized per workflow
 *
 * Without an installed OpenTelemetry SDK the global meter is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0 (OpenTelemetry)
 */
public class CompilationMetrics {

    private static final Logger logger = Logger.getLogger(CompilationMetrics.class.getName());
    private static final String METER_NAME = "woozie-compiler";

    private static CompilationMetrics instance;

    private final LongCounter compilationsTotal;
    private final LongCounter compilationsFailed;
    private final DoubleHistogram compilationDuration;
    private final LongHistogram actionsPerWorkflow;
    private final LongHistogram forkJoinPairsPerWorkflow;

    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> ERROR_KIND_KEY = AttributeKey.stringKey("error.kind");

    private CompilationMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        compilationsTotal = meter.counterBuilder("woozie.compile.total")
                .setDescription("Total number of workflow compilations started")
                .setUnit("1")
                .build();

        compilationsFailed = meter.counterBuilder("woozie.compile.failed")
                .setDescription("Number of workflow compilations that failed")
                .setUnit("1")
                .build();

        compilationDuration = meter.histogramBuilder("woozie.compile.duration.seconds")
                .setDescription("Workflow compilation duration in seconds")
                .setUnit("s")
                .build();

        actionsPerWorkflow = meter.histogramBuilder("woozie.compile.actions")
                .setDescription("Number of ordinary actions per compiled workflow")
                .setUnit("1")
                .ofLongs()
                .build();

        forkJoinPairsPerWorkflow = meter.histogramBuilder("woozie.compile.forkjoin.pairs")
                .setDescription("Number of fork/join pairs synthesized per compiled workflow")
                .setUnit("1")
                .ofLongs()
                .build();

        logger.fine("CompilationMetrics initialized");
    }

    public static synchronized CompilationMetrics getInstance() {
        if (instance == null) {
            instance = new CompilationMetrics();
        }
        return instance;
    }

    public void recordCompilationStarted(String workflowName) {
        compilationsTotal.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
    }

    public void recordCompilationCompleted(String workflowName, double durationSeconds,
                                           int actionCount, int forkJoinPairs) {
        Attributes attrs = Attributes.of(WORKFLOW_NAME_KEY, workflowName);
        compilationDuration.record(durationSeconds, attrs);
        actionsPerWorkflow.record(actionCount, attrs);
        forkJoinPairsPerWorkflow.record(forkJoinPairs, attrs);
    }

    public void recordCompilationFailed(String workflowName, String errorKind) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(ERROR_KIND_KEY, errorKind != null ? errorKind : "unknown")
                .build();
        compilationsFailed.add(1, attrs);
    }
}
