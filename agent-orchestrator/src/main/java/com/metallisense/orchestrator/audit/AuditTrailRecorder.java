package com.metallisense.orchestrator.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metallisense.common.audit.DecisionRecordSink;
import com.metallisense.common.model.DecisionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Append-only audit trail shared by all requests.
 *
 * <p>Each record is written as one JSON line to the {@code metallisense.audit} logger
 * and kept in a bounded in-memory window for inspection. {@link #append} is
 * synchronized so concurrent requests never interleave entries.
 */
@Component
public class AuditTrailRecorder implements DecisionRecordSink {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailRecorder.class);
    private static final Logger AUDIT = LoggerFactory.getLogger("metallisense.audit");

    private final ObjectMapper objectMapper;
    private final int retainedRecords;
    private final Deque<DecisionRecord> window = new ArrayDeque<>();

    public AuditTrailRecorder(ObjectMapper objectMapper,
                              @Value("${metallisense.audit.retained-records:1000}") int retainedRecords) {
        if (retainedRecords <= 0) {
            throw new IllegalArgumentException("metallisense.audit.retained-records must be positive");
        }
        this.objectMapper    = objectMapper;
        this.retainedRecords = retainedRecords;
    }

    @Override
    public synchronized void append(DecisionRecord record) {
        AUDIT.info(toJson(record));
        window.addLast(record);
        while (window.size() > retainedRecords) {
            window.removeFirst();
        }
    }

    @Override
    public synchronized List<DecisionRecord> recent(int limit) {
        List<DecisionRecord> all = new ArrayList<>(window);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    private String toJson(DecisionRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            log.warn("[Audit] JSON encoding failed, writing plain form. decision={}", record.decision(), e);
            return record.toString();
        }
    }
}
