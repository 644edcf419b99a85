package com.call_bridge_backend.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cross-worker record of a live call: which worker owns the AI session for a provider call id.
 */
@Entity
@Table(name = "active_call_sessions", indexes = @Index(name = "idx_active_call_sessions_worker", columnList = "worker_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActiveCallSession {

    @Id
    @Column(name = "call_id", length = 191)
    private String callId;

    @Column(name = "call_sid", length = 191)
    private String callSid;

    @Column(name = "worker_id", nullable = false, length = 191)
    private String workerId;

    @Column(name = "worker_address", length = 512)
    private String workerAddress;

    @Column(name = "registered_at", nullable = false)
    private Instant registeredAt;

    @Column(name = "expires_at")
    private Instant expiresAt;
}
