package com.call_bridge_backend.repositories;

import com.call_bridge_backend.models.ActiveCallSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface ActiveCallSessionRepository extends JpaRepository<ActiveCallSession, String> {

    Optional<ActiveCallSession> findByCallSid(String callSid);

    /**
     * Remove records whose TTL passed before the given instant
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("DELETE FROM ActiveCallSession s WHERE s.expiresAt IS NOT NULL AND s.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("DELETE FROM ActiveCallSession s WHERE s.workerId = :workerId")
    int deleteByWorkerId(@Param("workerId") String workerId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("DELETE FROM ActiveCallSession s WHERE s.callId = :callId")
    int deleteByCallId(@Param("callId") String callId);
}
