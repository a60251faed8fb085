package com.pickalert.domain.ports;

import com.pickalert.domain.model.DraftSnapshot;

/**
 * Port for reading a draft's settings and picks from the draft host.
 */
public interface DraftFeedClient {

    /**
     * Fetches the current settings and the full ordered pick list of a draft.
     *
     * @param draftId The draft host's draft id
     * @return Snapshot with validated settings and picks
     * @throws DraftFeedException if the draft is unknown, the host is unreachable, or the payload is malformed
     */
    DraftSnapshot fetch(String draftId) throws DraftFeedException;
}
