package io.buildunion.factcore.citation.conflict;

/** A disagreement between the photo estimate and the blueprint analysis of one project. */
public record SourceConflict(
    String id,
    ConflictType type,
    ConflictSeverity severity,
    String photoValue,
    String blueprintValue,
    int percentDiff,
    String description) {}
