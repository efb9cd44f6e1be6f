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

package dev.mars.woozie.compiler;

import dev.mars.woozie.core.exceptions.GraphErrorKind;
import dev.mars.woozie.core.exceptions.WorkflowGraphException;

import java.util.Objects;
import java.util.Optional;

/**
 * Tagged outcome of a compilation: either the compiled workflow or the
 * structural failure that aborted it, never both.
 */
public final class CompilationResult {

    private final CompiledWorkflow compiled;
    private final WorkflowGraphException failure;

    private CompilationResult(CompiledWorkflow compiled, WorkflowGraphException failure) {
        this.compiled = compiled;
        this.failure = failure;
    }

    public static CompilationResult success(CompiledWorkflow compiled) {
        return new CompilationResult(Objects.requireNonNull(compiled, "Compiled workflow cannot be null"), null);
    }

    public static CompilationResult failure(WorkflowGraphException failure) {
        return new CompilationResult(null, Objects.requireNonNull(failure, "Failure cannot be null"));
    }

    public boolean isSuccess() {
        return compiled != null;
    }

    public Optional<CompiledWorkflow> getCompiled() {
        return Optional.ofNullable(compiled);
    }

    public Optional<WorkflowGraphException> getFailure() {
        return Optional.ofNullable(failure);
    }

    public Optional<GraphErrorKind> getErrorKind() {
        return getFailure().map(WorkflowGraphException::getKind);
    }

    /**
     * Returns the compiled workflow or rethrows the failure.
     */
    public CompiledWorkflow orElseThrow() throws WorkflowGraphException {
        if (failure != null) {
            throw failure;
        }
        return compiled;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "CompilationResult{success, " + compiled + "}"
                : "CompilationResult{failure, " + failure.getMessage() + "}";
    }
}
