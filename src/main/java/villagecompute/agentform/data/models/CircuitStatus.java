package villagecompute.agentform.data.models;

/**
 * Breaker states for an external dependency.
 */
public enum CircuitStatus {
    CLOSED("closed"), OPEN("open"), HALF_OPEN("half_open");

    private final String wireName;

    CircuitStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
