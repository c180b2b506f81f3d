package lab.bridge.domain.intervention;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A critical relay warning that needs an operator: a claim nobody will make automatically, a
 * conflicting replay, a dead event source.
 */
@Entity
@Table(name = "bridge_interventions", indexes = {
        @Index(name = "idx_intervention_status", columnList = "status"),
        @Index(name = "idx_intervention_transfer", columnList = "transferId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class InterventionRecord {

    public static final int DETAIL_MAX_LENGTH = 4000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 64)
    private String kind;

    @Column(nullable = false, updatable = false, length = 32)
    private String source;

    // 0x-hex; null when the warning is not about one swap
    @Column(updatable = false, length = 66)
    private String transferId;

    @Column(nullable = false, updatable = false, length = 255)
    private String message;

    @Column(updatable = false, length = DETAIL_MAX_LENGTH)
    private String detail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private InterventionStatus status;

    @Column(nullable = false, updatable = false)
    private Instant raisedAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant resolvedAt;

    @Column(length = 64)
    private String resolvedBy;

    @Column(length = 255)
    private String resolutionNote;

    public static InterventionRecord open(String kind, String source, String transferId, String message, String detail, Instant raisedAt) {
        return InterventionRecord.builder()
                .kind(kind)
                .source(source)
                .transferId(transferId)
                .message(truncate(message, 255))
                .detail(truncate(detail, DETAIL_MAX_LENGTH))
                .status(InterventionStatus.OPEN)
                .raisedAt(raisedAt)
                .createdAt(Instant.now())
                .build();
    }

    public void resolve(String resolvedBy, String note) {
        if (status == InterventionStatus.RESOLVED) {
            throw new IllegalStateException("intervention " + id + " is already resolved");
        }
        this.status = InterventionStatus.RESOLVED;
        this.resolvedAt = Instant.now();
        this.resolvedBy = truncate(resolvedBy, 64);
        this.resolutionNote = truncate(note, 255);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
