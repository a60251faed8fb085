package com.pickalert.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Settings and the full ordered pick list of a draft, as fetched in one call.
 */
public record DraftSnapshot(String draftId, DraftSettings settings, List<Pick> picks) {

    public DraftSnapshot {
        Objects.requireNonNull(draftId, "draftId");
        Objects.requireNonNull(settings, "settings");
        picks = picks != null ? List.copyOf(picks) : List.of();
    }

    public int pickCount() {
        return picks.size();
    }
}
