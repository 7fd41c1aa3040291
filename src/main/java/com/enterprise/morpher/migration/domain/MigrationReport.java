package com.enterprise.morpher.migration.domain;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Results of one run, in the order the migrations were attempted. Migrations not
 * attempted (after a connection failure or cancellation) are absent.
 */
public record MigrationReport(List<MigrationResult> results) {

    public MigrationReport {
        results = List.copyOf(results);
    }

    public MigrationResult result(String name) {
        return results.stream()
                .filter(r -> r.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("No result for migration: " + name));
    }

    public long totalRowsWritten() {
        return results.stream().mapToLong(MigrationResult::rowsWritten).sum();
    }

    public boolean hasErrors() {
        return results.stream().anyMatch(r -> !r.errors().isEmpty()
                || r.status() == MigrationStatus.FAILED);
    }

    public boolean isCancelled() {
        return results.stream().anyMatch(r -> r.status() == MigrationStatus.CANCELLED);
    }

    public String summary() {
        return results.stream().map(MigrationResult::summary).collect(Collectors.joining("\n"));
    }
}
