package com.z254.vigil.warden.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.z254.vigil.warden.domain.model.ExecutionRecord;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.io.Writer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only record of every safety gateway decision.
 * <p>
 * Sequence numbers and decision timestamps are assigned inside the append lock, so the trail is
 * ordered by decision time and sequences increase strictly for the life of the instance.
 */
@Component
public class AuditTrail {

    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<ExecutionRecord> records = new ArrayList<>();
    private long sequence;

    public AuditTrail(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Stamp the draft with the next sequence and the decision time, then append it.
     */
    public ExecutionRecord append(ExecutionRecord.ExecutionRecordBuilder draft) {
        lock.lock();
        try {
            ExecutionRecord record = draft
                    .sequence(++sequence)
                    .decidedAt(clock.instant())
                    .build();
            records.add(record);
            return record;
        } finally {
            lock.unlock();
        }
    }

    public List<ExecutionRecord> records() {
        lock.lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records with a sequence greater than {@code afterSequence}, for incremental replay.
     */
    public List<ExecutionRecord> recordsAfter(long afterSequence) {
        return records().stream()
                .filter(r -> r.getSequence() > afterSequence)
                .toList();
    }

    public List<ExecutionRecord> recordsForIntent(String intentId) {
        return records().stream()
                .filter(r -> r.getIntentId().equals(intentId))
                .toList();
    }

    public Optional<ExecutionRecord> find(long auditSequence) {
        return records().stream()
                .filter(r -> r.getSequence() == auditSequence)
                .findFirst();
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot stream for export collaborators.
     */
    public Flux<ExecutionRecord> stream() {
        return Flux.defer(() -> Flux.fromIterable(records()));
    }

    /**
     * Write the trail as JSON lines, one record per line.
     */
    public void export(Writer writer) throws IOException {
        for (ExecutionRecord record : records()) {
            writer.write(toJson(record));
            writer.write('\n');
        }
        writer.flush();
    }

    public String toJson(ExecutionRecord record) throws IOException {
        return objectMapper.writeValueAsString(record);
    }
}
