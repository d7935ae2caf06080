package com.example.cardlobby.delivery;

public enum DeliveryStatus {
    PENDING,
    CONFIRMED,
    FAILED,
    /** Sent without a confirmation before the record was swept. */
    EXPIRED
}
