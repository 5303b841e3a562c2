package com.potatoregistry.catalog;

public enum EntryState {
    PENDING,    // slot reserved, bytes not yet confirmed durable
    PUBLISHED,
    DELETED     // soft-removed, blob kept until the row is purged
}
