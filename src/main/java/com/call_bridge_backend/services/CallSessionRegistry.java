package com.call_bridge_backend.services;

import com.call_bridge_backend.config.WorkerConfig;
import com.call_bridge_backend.models.ActiveCallSession;
import com.call_bridge_backend.repositories.ActiveCallSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps carrier call ids and AI session ids to the live {@link CallSession} handling them.
 *
 * <p>Entries expire after the worker session TTL unless refreshed. Every read purges expired
 * entries first. Records are also persisted so another worker can find which process owns a
 * provider call; persistence failures are logged and never affect the call.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CallSessionRegistry {

    private final ActiveCallSessionRepository repository;
    private final WorkerConfig workerConfig;
    private final Clock clock;

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Map<String, String> callIdsByAiSession = new ConcurrentHashMap<>();

    /**
     * Insert or replace the mapping for a call and restart its TTL.
     */
    public void register(String callId, String aiSessionId, CallSession session) {
        String key = trimToNull(callId);
        if (key == null || session == null) {
            return;
        }
        String aiKey = trimToNull(aiSessionId);
        Instant expiresAt = clock.instant().plus(workerConfig.getSessionTtl());

        Entry previous = entries.put(key, new Entry(session, aiKey, expiresAt));
        if (previous != null && previous.aiSessionId != null && !previous.aiSessionId.equals(aiKey)) {
            callIdsByAiSession.remove(previous.aiSessionId, key);
        }
        if (aiKey != null) {
            callIdsByAiSession.put(aiKey, key);
            persist(key, aiKey, expiresAt);
        }
        log.debug("[{}] Registered call session (ai session: {}, expires: {})", key, aiKey, expiresAt);
    }

    /**
     * Extend the TTL of a live call. Returns false when the entry was already gone or expired.
     */
    public boolean refresh(String callId) {
        String key = trimToNull(callId);
        if (key == null) {
            return false;
        }
        purgeExpired();
        Entry current = entries.get(key);
        if (current == null) {
            return false;
        }
        register(key, current.aiSessionId, current.session);
        return true;
    }

    public void unregister(String callId) {
        String key = trimToNull(callId);
        if (key == null) {
            return;
        }
        Entry removed = entries.remove(key);
        if (removed == null || removed.aiSessionId == null) {
            return;
        }
        callIdsByAiSession.remove(removed.aiSessionId, key);
        try {
            repository.deleteByCallId(removed.aiSessionId);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to remove persisted session {}", key, removed.aiSessionId, e);
        }
        log.debug("[{}] Unregistered call session", key);
    }

    public Optional<CallSession> findByCallId(String callId) {
        purgeExpired();
        String key = trimToNull(callId);
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(key)).map(Entry::session);
    }

    public Optional<CallSession> findByAiSessionId(String aiSessionId) {
        purgeExpired();
        String aiKey = trimToNull(aiSessionId);
        if (aiKey == null) {
            return Optional.empty();
        }
        String callId = callIdsByAiSession.get(aiKey);
        return callId == null ? Optional.empty() : Optional.ofNullable(entries.get(callId)).map(Entry::session);
    }

    /**
     * Persisted record for a provider call id, possibly owned by another worker.
     */
    public Optional<ActiveCallSession> findRecord(String aiSessionId) {
        String aiKey = trimToNull(aiSessionId);
        if (aiKey == null) {
            return Optional.empty();
        }
        try {
            repository.deleteExpired(clock.instant());
            return repository.findById(aiKey).or(() -> repository.findByCallSid(aiKey));
        } catch (RuntimeException e) {
            log.error("Failed to look up persisted session {}", aiKey, e);
            return Optional.empty();
        }
    }

    /**
     * Resolve the session a request refers to. Without an id a session is only returned when it is
     * the only active one; otherwise the caller has to disambiguate.
     */
    public Optional<CallSession> resolveActiveSession(String callId) {
        purgeExpired();
        String key = trimToNull(callId);
        if (key != null) {
            Optional<CallSession> byCallId = findByCallId(key);
            return byCallId.isPresent() ? byCallId : findByAiSessionId(key);
        }
        if (entries.size() == 1) {
            return entries.values().stream().findFirst().map(Entry::session);
        }
        return Optional.empty();
    }

    /**
     * Drop persisted sessions left behind by a previous process with the same worker id.
     */
    public void clearWorkerSessions(String workerId) {
        String key = trimToNull(workerId);
        if (key == null) {
            return;
        }
        try {
            repository.deleteExpired(clock.instant());
            int removed = repository.deleteByWorkerId(key);
            if (removed > 0) {
                log.info("Cleared {} stale sessions for worker {}", removed, key);
            }
        } catch (RuntimeException e) {
            log.error("Failed to clear sessions for worker {}", key, e);
        }
    }

    public List<String> activeCallIds() {
        purgeExpired();
        return new ArrayList<>(entries.keySet());
    }

    private void purgeExpired() {
        Instant now = clock.instant();
        Iterator<Map.Entry<String, Entry>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Entry> item = iterator.next();
            Entry entry = item.getValue();
            if (entry.expiresAt.isBefore(now)) {
                iterator.remove();
                if (entry.aiSessionId != null) {
                    callIdsByAiSession.remove(entry.aiSessionId, item.getKey());
                }
                log.info("[{}] Call session registration expired", item.getKey());
            }
        }
    }

    private void persist(String callId, String aiSessionId, Instant expiresAt) {
        ActiveCallSession record = ActiveCallSession.builder()
                .callId(aiSessionId)
                .callSid(callId)
                .workerId(workerConfig.getWorkerId())
                .workerAddress(trimToNull(workerConfig.getAddress()))
                .registeredAt(clock.instant())
                .expiresAt(expiresAt)
                .build();
        try {
            repository.deleteExpired(clock.instant());
            repository.save(record);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to persist session registration for worker {}", callId, record.getWorkerId(), e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private record Entry(CallSession session, String aiSessionId, Instant expiresAt) {
    }
}
