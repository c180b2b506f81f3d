package lab.bridge.relay;

public enum SwapDirection {
    B1_TO_B2("B1->B2"),
    B2_TO_B1("B2->B1");

    private final String label;

    SwapDirection(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
