package lab.bridge.relay;

import lab.bridge.domain.intervention.InterventionRecord;
import lab.bridge.domain.intervention.InterventionStatus;
import lab.bridge.domain.transfer.ChainAddress;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/bridge")
@Slf4j
public class BridgeOpsController {

    private final BridgeService<? extends ChainAddress, ? extends ChainAddress> bridgeService;
    private final RecentBridgeEvents recentBridgeEvents;
    private final InterventionService interventionService;

    @GetMapping("/swaps/{direction}")
    public ResponseEntity<List<? extends ActiveSwap<?>>> activeSwaps(@PathVariable SwapDirection direction) {
        List<? extends ActiveSwap<?>> swaps;
        if (direction == SwapDirection.B1_TO_B2) {
            swaps = bridgeService.activeSwapsOneToTwo().snapshot();
        } else {
            swaps = bridgeService.activeSwapsTwoToOne().snapshot();
        }
        log.info("event=bridge.swaps.response direction={} count={}", direction.label(), swaps.size());
        return ResponseEntity.ok(swaps);
    }

    @GetMapping("/events")
    public ResponseEntity<List<BridgeEvent>> recentEvents(@RequestParam(defaultValue = "100") int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return ResponseEntity.ok(recentBridgeEvents.recent(limit));
    }

    @GetMapping("/interventions")
    public ResponseEntity<List<InterventionRecord>> interventions(@RequestParam(required = false) InterventionStatus status) {
        List<InterventionRecord> interventions = interventionService.list(Optional.ofNullable(status));
        log.info("event=bridge.interventions.response status={} count={}", status, interventions.size());
        return ResponseEntity.ok(interventions);
    }

    // Operator confirms the manual follow-up (claim, refund, restart of a source) is done.
    @PostMapping("/interventions/{id}/resolve")
    public ResponseEntity<InterventionRecord> resolve(@PathVariable UUID id, @RequestBody ResolveInterventionRequest req) {
        if (req.resolvedBy() == null || req.resolvedBy().isBlank()) {
            throw new IllegalArgumentException("resolvedBy is required");
        }
        log.info("event=bridge.interventions.resolve.request interventionId={} resolvedBy={}", id, req.resolvedBy());
        return ResponseEntity.ok(interventionService.resolve(id, req.resolvedBy().trim(), req.note()));
    }
}
