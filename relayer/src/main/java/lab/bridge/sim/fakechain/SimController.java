package lab.bridge.sim.fakechain;

import lab.bridge.chain.ChainNames;
import lab.bridge.domain.transfer.Amount;
import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.EvmAddress;
import lab.bridge.domain.transfer.HashLock;
import lab.bridge.domain.transfer.HashLockPreImage;
import lab.bridge.domain.transfer.MoveAddress;
import lab.bridge.domain.transfer.RecipientAddress;
import lab.bridge.domain.transfer.TimeLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * User-side actions on the simulated chains, plus fault injection. Labs and integration tests drive
 * the relay through these endpoints and watch {@code /bridge/...} for its reaction.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/sim")
@ConditionalOnProperty(prefix = "bridge.chain-one", name = "mode", havingValue = "mock", matchIfMissing = true)
@Slf4j
public class SimController {

    private final FakeChain<EvmAddress> chainOne;
    private final FakeChain<MoveAddress> chainTwo;

    @PostMapping("/chain-one/transfers")
    public ResponseEntity<Map<String, String>> initiate(@RequestBody InitiateTransferRequest req) {
        if (req.initiator() == null || req.recipient() == null || req.hashLock() == null
                || req.timeLock() == null || req.amount() == null) {
            throw new IllegalArgumentException("initiator, recipient, hashLock, timeLock and amount are required");
        }
        BridgeTransferId id = chainOne.initiate(
                EvmAddress.fromHex(req.initiator()),
                RecipientAddress.fromHex(req.recipient()),
                HashLock.fromHex(req.hashLock()),
                TimeLock.of(req.timeLock()),
                Amount.parse(req.amount())
        );
        log.info("event=sim.initiate.response transferId={}", id);
        return ResponseEntity.ok(Map.of("bridgeTransferId", id.toHex()));
    }

    @PostMapping("/chain-one/transfers/{id}/refund")
    public ResponseEntity<Void> refund(@PathVariable String id) {
        chainOne.refund(BridgeTransferId.fromHex(id));
        return ResponseEntity.accepted().build();
    }

    // Redeliver the Initiated event, as a monitor replaying blocks would.
    @PostMapping("/chain-one/transfers/{id}/replay")
    public ResponseEntity<Void> replay(@PathVariable String id) {
        chainOne.replayInitiated(BridgeTransferId.fromHex(id));
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/chain-one/transfers/{id}")
    public ResponseEntity<Map<String, Object>> initiatorState(@PathVariable String id) {
        BridgeTransferId transferId = BridgeTransferId.fromHex(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("bridgeTransferId", transferId.toHex());
        body.put("state", chainOne.initiatorState(transferId)
                .orElseThrow(() -> new IllegalArgumentException("unknown transfer on chain-one: " + id)));
        body.put("claimed", chainOne.claimedSecret(transferId).isPresent());
        return ResponseEntity.ok(body);
    }

    // The recipient claims the chain-two lock, revealing the secret.
    @PostMapping("/chain-two/locks/{id}/claim")
    public ResponseEntity<Void> claim(@PathVariable String id, @RequestBody ClaimRequest req) {
        if (req.preImage() == null) {
            throw new IllegalArgumentException("preImage is required");
        }
        chainTwo.claim(BridgeTransferId.fromHex(id), HashLockPreImage.fromHex(req.preImage()));
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/chain-two/locks/{id}")
    public ResponseEntity<Map<String, Object>> lockState(@PathVariable String id) {
        BridgeTransferId transferId = BridgeTransferId.fromHex(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("bridgeTransferId", transferId.toHex());
        body.put("state", chainTwo.lockState(transferId)
                .orElseThrow(() -> new IllegalArgumentException("no lock on chain-two for: " + id)));
        chainTwo.lock(transferId).ifPresent(lock -> body.put("recipient", lock.recipientAddress().toHex()));
        return ResponseEntity.ok(body);
    }

    // Script how the next contract calls on a chain end, e.g. FAIL_SYSTEM x3 to exhaust retries.
    @PostMapping("/{chain}/next-outcome/{outcome}")
    public ResponseEntity<Void> setNextOutcome(
            @PathVariable String chain,
            @PathVariable FakeChain.NextOutcome outcome,
            @RequestParam(defaultValue = "1") int times
    ) {
        if (times < 1) {
            throw new IllegalArgumentException("times must be positive");
        }
        chain(chain).setNextOutcome(outcome, times);
        log.info("event=sim.next_outcome chain={} outcome={} times={}", chain, outcome, times);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{chain}/fail-stream")
    public ResponseEntity<Void> failStream(@PathVariable String chain, @RequestParam(defaultValue = "simulated decode failure") String reason) {
        chain(chain).failEventStream(reason);
        log.warn("event=sim.fail_stream chain={} reason={}", chain, reason);
        return ResponseEntity.accepted().build();
    }

    private FakeChain<?> chain(String name) {
        if (ChainNames.CHAIN_ONE.equals(name)) {
            return chainOne;
        }
        if (ChainNames.CHAIN_TWO.equals(name)) {
            return chainTwo;
        }
        throw new IllegalArgumentException("Unknown chain '%s'. Allowed chains: %s, %s"
                .formatted(name, ChainNames.CHAIN_ONE, ChainNames.CHAIN_TWO));
    }
}
