package com.z254.vigil.warden.gateway;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pending approvals. Resolution claims (removes) an entry atomically, so approve, reject and
 * expiry can race without resolving one request twice.
 */
@Component
public class ApprovalRegistry {

    private final Map<String, PendingApproval> pending = new ConcurrentHashMap<>();

    public void register(PendingApproval approval) {
        PendingApproval previous = pending.putIfAbsent(approval.getApprovalId(), approval);
        if (previous != null) {
            throw new IllegalStateException("Approval already pending: " + approval.getApprovalId());
        }
    }

    public Optional<PendingApproval> claim(String approvalId) {
        return Optional.ofNullable(pending.remove(approvalId));
    }

    public Optional<PendingApproval> find(String approvalId) {
        return Optional.ofNullable(pending.get(approvalId));
    }

    /**
     * Remove and return every approval expired at {@code now}.
     */
    public List<PendingApproval> claimExpired(Instant now) {
        List<PendingApproval> expired = new ArrayList<>();
        for (PendingApproval approval : pending.values()) {
            if (approval.isExpired(now) && pending.remove(approval.getApprovalId(), approval)) {
                expired.add(approval);
            }
        }
        return expired;
    }

    public List<PendingApproval> list() {
        return pending.values().stream()
                .sorted(Comparator.comparing(PendingApproval::getRequestedAt))
                .toList();
    }

    public int size() {
        return pending.size();
    }
}
