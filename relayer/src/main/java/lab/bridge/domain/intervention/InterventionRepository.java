package lab.bridge.domain.intervention;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface InterventionRepository extends JpaRepository<InterventionRecord, UUID> {
    List<InterventionRecord> findAllByOrderByCreatedAtAsc();

    List<InterventionRecord> findByStatusOrderByCreatedAtAsc(InterventionStatus status);

    List<InterventionRecord> findByTransferIdOrderByCreatedAtAsc(String transferId);
}
