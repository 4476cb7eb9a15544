package io.buildunion.factcore.projectload;

import io.buildunion.factcore.access.AccessTier;
import java.util.List;

public record SectionView(
    String key, String title, AccessTier requiredTier, List<CitationView> citations) {}
