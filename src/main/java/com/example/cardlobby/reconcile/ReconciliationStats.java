package com.example.cardlobby.reconcile;

import java.util.Map;

public record ReconciliationStats(
        long totalReconciliations,
        int roomsReconciled,
        int inProgress,
        Map<InconsistencyType, Long> commonInconsistencyTypes,
        double averageInconsistencies
) { }
