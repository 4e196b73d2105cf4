package villagecompute.agentform.exceptions;

import java.math.BigDecimal;

/**
 * Exception thrown by strict-mode credit debits when the account cannot cover the requested amount.
 *
 * <p>
 * Only raised when {@code orchestrator.credits.enforce-on-debit=true}. The default ledger behavior debits
 * unconditionally and relies on the separate pre-check before paid steps.
 */
public class InsufficientCreditsException extends RuntimeException {

    private final String userId;
    private final BigDecimal remaining;
    private final BigDecimal requested;

    public InsufficientCreditsException(String userId, BigDecimal remaining, BigDecimal requested) {
        super("Insufficient AI credits for user " + userId + ": remaining=" + remaining.toPlainString() + ", requested="
                + requested.toPlainString());
        this.userId = userId;
        this.remaining = remaining;
        this.requested = requested;
    }

    public String getUserId() {
        return userId;
    }

    public BigDecimal getRemaining() {
        return remaining;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}
