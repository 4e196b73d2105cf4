package villagecompute.agentform.workflow;

/**
 * Outcome of one step attempt.
 */
public enum StepStatus {
    SUCCESS("success"), FAILURE("failure"), SKIPPED("skipped");

    private final String wireName;

    StepStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
