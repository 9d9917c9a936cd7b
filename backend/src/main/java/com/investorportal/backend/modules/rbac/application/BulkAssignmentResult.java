package com.investorportal.backend.modules.rbac.application;

import java.util.List;
import java.util.UUID;

public record BulkAssignmentResult(int successCount, List<Failure> failures) {

    public BulkAssignmentResult {
        failures = List.copyOf(failures);
    }

    public record Failure(UUID userId, String error) {
    }
}
