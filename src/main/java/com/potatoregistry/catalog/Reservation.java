package com.potatoregistry.catalog;

/**
 * Outcome of {@link MetadataCatalog#beginPublish}.
 *
 * @param created false when an entry with the same content already held the slot
 */
public record Reservation(long entryId, EntryState state, boolean created) {}
