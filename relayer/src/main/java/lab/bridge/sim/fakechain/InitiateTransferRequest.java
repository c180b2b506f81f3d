package lab.bridge.sim.fakechain;

public record InitiateTransferRequest(
        String initiator,
        String recipient,
        String hashLock,
        Long timeLock,
        String amount
) {}
