package org.neuralchilli.irflow.service;

import java.util.Optional;

/**
 * Result of loading a workflow file.
 */
public sealed interface LoadResult {

    boolean isSuccess();

    /**
     * Workflow name, or the file name when the file could not be parsed
     */
    String name();

    /**
     * Id of the compiled program if load was successful
     */
    Optional<String> programId();

    Optional<String> error();

    record Success(String name, String compiledProgramId) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> programId() {
            return Optional.of(compiledProgramId);
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    record Failure(String name, String errorMessage) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<String> programId() {
            return Optional.empty();
        }

        @Override
        public Optional<String> error() {
            return Optional.of(errorMessage);
        }
    }

    static LoadResult success(String name, String programId) {
        return new Success(name, programId);
    }

    static LoadResult failure(String name, Exception e) {
        return new Failure(name, e.getMessage());
    }
}
