package lab.bridge.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lab.bridge.domain.intervention.InterventionRecord;
import lab.bridge.domain.intervention.InterventionRepository;
import lab.bridge.domain.intervention.InterventionStatus;
import lab.bridge.domain.transfer.BridgeTransferId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists every critical relay warning so an operator can act on it, e.g. claim by hand with the
 * secret carried in the detail of a {@code CANNOT_COMPLETE_UNEXISTING_SWAP}.
 */
@Service
@Order(20)
@RequiredArgsConstructor
@Slf4j
public class InterventionService implements BridgeEventSink {

    private final InterventionRepository interventionRepository;
    private final ObjectMapper objectMapper;

    @Override
    public void accept(BridgeEvent event) {
        if (event instanceof BridgeWarning warning && warning.isCritical()) {
            record(warning);
        }
    }

    @Transactional
    public InterventionRecord record(BridgeWarning warning) {
        InterventionRecord saved = interventionRepository.save(InterventionRecord.open(
                warning.kind().name(),
                warning.source(),
                warning.transferId().map(BridgeTransferId::toHex).orElse(null),
                warning.message() == null ? warning.kind().name() : warning.message(),
                describe(warning.detail()),
                warning.occurredAt()
        ));
        log.info("event=intervention.recorded interventionId={} kind={} source={} transferId={}",
                saved.getId(), saved.getKind(), saved.getSource(), saved.getTransferId());
        return saved;
    }

    @Transactional
    public InterventionRecord resolve(UUID id, String resolvedBy, String note) {
        InterventionRecord intervention = interventionRepository.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("intervention not found: " + id));
        intervention.resolve(resolvedBy, note);
        log.info("event=intervention.resolved interventionId={} kind={} resolvedBy={}", id, intervention.getKind(), resolvedBy);
        return interventionRepository.save(intervention);
    }

    @Transactional(readOnly = true)
    public List<InterventionRecord> list(Optional<InterventionStatus> status) {
        return status
                .map(interventionRepository::findByStatusOrderByCreatedAtAsc)
                .orElseGet(interventionRepository::findAllByOrderByCreatedAtAsc);
    }

    private String describe(Object detail) {
        if (detail == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(detail);
        } catch (JsonProcessingException e) {
            log.warn("event=intervention.detail_unserializable type={} reason={}", detail.getClass().getSimpleName(), e.getOriginalMessage());
            return String.valueOf(detail);
        }
    }
}
