package com.example.cardlobby.reconcile;

/** Ordered from least to most severe. */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
