package com.sni.curation.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit record of one state-affecting action on a narrative.
 *
 * <p>{@code narrative_id} is not a foreign key: entries outlive the narrative they describe.
 */
@Entity
@Immutable
@Table(name = "narrative_curation_log")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurationLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "narrative_id", nullable = false, updatable = false)
    private UUID narrativeId;

    @Column(name = "action_type", nullable = false, updatable = false, length = 50)
    private String actionType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "old_values", columnDefinition = "jsonb", updatable = false)
    private Map<String, Object> oldValues;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "new_values", columnDefinition = "jsonb", updatable = false)
    private Map<String, Object> newValues;

    @Column(name = "action_reason", columnDefinition = "TEXT", updatable = false)
    private String reason;

    @Column(name = "actor_id", nullable = false, updatable = false, length = 100)
    private String actorId;

    @Convert(converter = ActorTypeConverter.class)
    @Column(name = "actor_type", nullable = false, updatable = false, length = 20)
    private ActorType actorType;

    @Column(name = "session_id", updatable = false, length = 100)
    private String sessionId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb", updatable = false)
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
