package lab.bridge.sim.fakechain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lab.bridge.chain.BridgeContractCounterpartyEvent;
import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.CounterpartyCompletedDetails;
import lab.bridge.domain.transfer.HashLockPreImage;
import lab.bridge.domain.transfer.MoveAddress;
import lab.bridge.relay.BridgeRelayRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.security.SecureRandom;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

// The relay thread is off; each step pumps the relay explicitly so assertions are deterministic.
@SpringBootTest(properties = {
        "bridge.relay.enabled=false",
        "bridge.tracker.max-attempts=3",
        "bridge.tracker.retry-backoff-ms=0"
})
@ActiveProfiles("test")
@AutoConfigureMockMvc
class BridgeRelayScenariosIntegrationTest {

    private static final String SECRET = "0x" + "7e".repeat(32);
    private static final String HASH_LOCK = "0x" + "5a".repeat(32);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private BridgeRelayRunner runner;

    @Autowired
    private FakeChain<MoveAddress> chainTwo;

    @Test
    void lab1_swapFromChainOne_isLockedOnChainTwoThenClaimedBack() throws Exception {
        String id = initiate("0x0b0b");
        runner.pump();

        mockMvc.perform(get("/bridge/swaps/B1_TO_B2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].bridgeTransferId", hasItem(id)));
        mockMvc.perform(get("/sim/chain-two/locks/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("LOCKED"))
                .andExpect(jsonPath("$.recipient").value("0x" + "0".repeat(60) + "0b0b"));

        mockMvc.perform(post("/sim/chain-two/locks/{id}/claim", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"preImage\": \"" + SECRET + "\"}"))
                .andExpect(status().isAccepted());
        runner.pump();

        mockMvc.perform(get("/sim/chain-one/transfers/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("COMPLETED"))
                .andExpect(jsonPath("$.claimed").value(true));
        mockMvc.perform(get("/bridge/swaps/B1_TO_B2"))
                .andExpect(jsonPath("$[*].bridgeTransferId", not(hasItem(id))));
        mockMvc.perform(get("/bridge/events").param("limit", "500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].type", hasItem("ContractEvent")))
                .andExpect(jsonPath("$[*].progress.outcome", hasItem("AssetsCompleted")));
    }

    @Test
    void lab2_lockFailingOnEveryAttempt_surfacesAWarningEvent() throws Exception {
        mockMvc.perform(post("/sim/chain-two/next-outcome/FAIL_SYSTEM").param("times", "3"))
                .andExpect(status().isAccepted());
        String id = initiate("0x0c0c");
        runner.pump();

        mockMvc.perform(get("/sim/chain-two/locks/{id}", id))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/bridge/events").param("limit", "500"))
                .andExpect(jsonPath("$[?(@.type == 'Warn')].kind", hasItem("LOCKING_FAILED")))
                .andExpect(jsonPath("$[?(@.kind == 'LOCKING_FAILED')].bridgeTransferId", hasItem(id)));
    }

    @Test
    void lab3_refundOnChainOne_abortsTheChainTwoLock() throws Exception {
        String id = initiate("0x0d0d");
        runner.pump();

        mockMvc.perform(post("/sim/chain-one/transfers/{id}/refund", id))
                .andExpect(status().isAccepted());
        runner.pump();

        mockMvc.perform(get("/sim/chain-two/locks/{id}", id))
                .andExpect(jsonPath("$.state").value("ABORTED"));
        mockMvc.perform(get("/bridge/swaps/B1_TO_B2"))
                .andExpect(jsonPath("$[*].bridgeTransferId", not(hasItem(id))));
    }

    @Test
    void lab4_completionOfAnUnknownSwap_opensAnInterventionTheOperatorCanResolve() throws Exception {
        byte[] raw = new byte[32];
        new SecureRandom().nextBytes(raw);
        BridgeTransferId unknown = BridgeTransferId.of(raw);
        chainTwo.emit(new BridgeContractCounterpartyEvent.Completed<>(
                new CounterpartyCompletedDetails(unknown, HashLockPreImage.fromHex(SECRET))));
        runner.pump();

        MvcResult open = mockMvc.perform(get("/bridge/interventions").param("status", "OPEN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].transferId", hasItem(unknown.toHex())))
                .andReturn();
        String interventionId = null;
        for (JsonNode node : objectMapper.readTree(open.getResponse().getContentAsString())) {
            if (unknown.toHex().equals(node.path("transferId").asText())) {
                interventionId = node.get("id").asText();
            }
        }

        mockMvc.perform(post("/bridge/interventions/{id}/resolve", interventionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolvedBy\": \"ops-oncall\", \"note\": \"claimed on chain one by hand\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"))
                .andExpect(jsonPath("$.kind").value("CANNOT_COMPLETE_UNEXISTING_SWAP"));
        mockMvc.perform(get("/bridge/interventions").param("status", "OPEN"))
                .andExpect(jsonPath("$[*].transferId", not(hasItem(unknown.toHex()))));
    }

    @Test
    void lab5_replayedInitiation_isWarnedWithoutASecondLock() throws Exception {
        String id = initiate("0x0e0e");
        runner.pump();

        mockMvc.perform(post("/sim/chain-one/transfers/{id}/replay", id))
                .andExpect(status().isAccepted());
        runner.pump();

        mockMvc.perform(get("/bridge/events").param("limit", "500"))
                .andExpect(jsonPath("$[?(@.kind == 'ALREADY_PRESENT')].bridgeTransferId", hasItem(id)));
        mockMvc.perform(get("/sim/chain-two/locks/{id}", id))
                .andExpect(jsonPath("$.state").value("LOCKED"));
    }

    @Test
    void invalidSimInput_isRejected() throws Exception {
        mockMvc.perform(post("/sim/chain-one/transfers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "initiator": "0xnot-an-address",
                                  "recipient": "0x0b0b",
                                  "hashLock": "%s",
                                  "timeLock": 3600,
                                  "amount": "100"
                                }
                                """.formatted(HASH_LOCK)))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/sim/chain-three/fail-stream"))
                .andExpect(status().isBadRequest());
    }

    private String initiate(String recipient) throws Exception {
        MvcResult result = mockMvc.perform(post("/sim/chain-one/transfers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "initiator": "0x1111111111111111111111111111111111111111",
                                  "recipient": "%s",
                                  "hashLock": "%s",
                                  "timeLock": 3600,
                                  "amount": "1000"
                                }
                                """.formatted(recipient, HASH_LOCK)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("bridgeTransferId").asText();
    }
}
