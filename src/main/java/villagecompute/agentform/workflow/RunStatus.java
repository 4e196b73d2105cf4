package villagecompute.agentform.workflow;

/**
 * Lifecycle of a {@link RunRecord}: {@code pending -> running -> {completed, partial, failed}}.
 *
 * <p>
 * There is no retrying state. A retry is a new run for the same work unit with a higher attempt number.
 */
public enum RunStatus {
    PENDING("pending"), RUNNING("running"), COMPLETED("completed"), PARTIAL("partial"), FAILED("failed");

    private final String wireName;

    RunStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL || this == FAILED;
    }
}
