package lab.bridge.sim.fakechain;

public record ClaimRequest(String preImage) {}
