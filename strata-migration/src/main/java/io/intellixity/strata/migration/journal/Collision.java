package io.intellixity.strata.migration.journal;

/**
 * An on-disk file reusing the sequence number of a journaled migration with a different name.
 * {@code suggestedName} renumbers the conflicting file to the next free sequence.
 */
public record Collision(String existingName, String conflictingName, long sequenceNumber, String suggestedName) {}
