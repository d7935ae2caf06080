package com.example.cardlobby.delivery;

import java.util.List;
import java.util.Map;

public record DeliveryStats(
        Map<String, EventTypeStats.Snapshot> eventStats,
        int pendingEvents,
        List<String> criticalEvents
) { }
