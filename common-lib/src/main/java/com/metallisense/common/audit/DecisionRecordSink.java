package com.metallisense.common.audit;

import com.metallisense.common.model.DecisionRecord;

import java.util.List;

/**
 * Append-only audit trail for pipeline decisions.
 *
 * <p>Implementations are shared by all concurrent requests and MUST serialize
 * appends so entries from different requests never interleave.
 */
public interface DecisionRecordSink {

    void append(DecisionRecord record);

    /** Up to {@code limit} most recent records, oldest first. */
    List<DecisionRecord> recent(int limit);
}
