package villagecompute.agentform.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.agentform.data.models.CreditAccount;
import villagecompute.agentform.exceptions.InsufficientCreditsException;
import villagecompute.agentform.exceptions.ValidationException;
import villagecompute.agentform.observability.ObservabilityMetrics;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Monthly AI credit accounts per user.
 *
 * <p>
 * Accounts are opened lazily with {@code orchestrator.credits.default-monthly-limit} and rolled to zero usage on the
 * first access in a new UTC month. All updates go through {@link ConcurrentMap#compute} so concurrent debits for the
 * same user are never lost.
 *
 * <p>
 * <b>Debit semantics:</b> by default {@link #debit} never rejects; usage may exceed the limit and
 * {@link #remaining} clamps at zero. Paid steps are gated up front with {@link #hasSufficientCredits}. Setting
 * {@code orchestrator.credits.enforce-on-debit=true} turns over-limit debits into {@link InsufficientCreditsException}.
 */
@ApplicationScoped
public class CreditLedgerService {

    private static final Logger LOG = Logger.getLogger(CreditLedgerService.class);

    @ConfigProperty(
            name = "orchestrator.credits.default-monthly-limit",
            defaultValue = "100")
    BigDecimal defaultMonthlyLimit;

    @ConfigProperty(
            name = "orchestrator.credits.minimum-balance",
            defaultValue = "1")
    BigDecimal minimumBalance;

    @ConfigProperty(
            name = "orchestrator.credits.enforce-on-debit",
            defaultValue = "false")
    boolean enforceOnDebit;

    @Inject
    Clock clock;

    @Inject
    ObservabilityMetrics observabilityMetrics;

    private final ConcurrentMap<String, CreditAccount> accounts = new ConcurrentHashMap<>();

    /**
     * Credits left this month, never negative.
     */
    public BigDecimal remaining(String userId) {
        return account(userId).remaining();
    }

    /**
     * Whether the user can start a paid step (remaining credits at or above the configured floor).
     */
    public boolean hasSufficientCredits(String userId) {
        return remaining(userId).compareTo(minimumBalance) >= 0;
    }

    /**
     * Records {@code amount} against the user's current month.
     *
     * @return remaining credits after the debit
     * @throws ValidationException
     *             if amount is null or negative
     * @throws InsufficientCreditsException
     *             in strict mode, if the amount exceeds the remaining credits
     */
    public BigDecimal debit(String userId, BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException("Debit amount must be non-negative: " + amount);
        }

        YearMonth period = currentPeriod();
        AtomicReference<BigDecimal> shortfall = new AtomicReference<>();
        CreditAccount updated = accounts.compute(userId, (id, existing) -> {
            CreditAccount current = existing == null ? CreditAccount.open(id, defaultMonthlyLimit, period)
                    : existing.rolledTo(period);
            if (enforceOnDebit && current.remaining().compareTo(amount) < 0) {
                shortfall.set(current.remaining());
                return current;
            }
            return current.debit(amount);
        });

        if (shortfall.get() != null) {
            LOG.warnf("Rejected credit debit: user=%s remaining=%s requested=%s", userId,
                    shortfall.get().toPlainString(), amount.toPlainString());
            throw new InsufficientCreditsException(userId, shortfall.get(), amount);
        }

        observabilityMetrics.recordCreditDebit(amount);
        LOG.debugf("Debited %s credits from user %s (used=%s, limit=%s)", amount.toPlainString(), userId,
                updated.used().toPlainString(), updated.monthlyLimit().toPlainString());
        if (updated.used().compareTo(updated.monthlyLimit()) > 0) {
            LOG.infof("User %s is over monthly AI credit limit: used=%s limit=%s", userId,
                    updated.used().toPlainString(), updated.monthlyLimit().toPlainString());
        }
        return updated.remaining();
    }

    /**
     * Current account state, opening or rolling it over as needed.
     */
    public CreditAccount account(String userId) {
        YearMonth period = currentPeriod();
        return accounts.compute(userId, (id, existing) -> existing == null
                ? CreditAccount.open(id, defaultMonthlyLimit, period) : existing.rolledTo(period));
    }

    /**
     * Sets the user's monthly limit (plan change). Usage in the current period is kept.
     */
    public CreditAccount configureAccount(String userId, BigDecimal monthlyLimit) {
        if (monthlyLimit == null || monthlyLimit.signum() < 0) {
            throw new ValidationException("Monthly limit must be non-negative: " + monthlyLimit);
        }
        YearMonth period = currentPeriod();
        CreditAccount updated = accounts.compute(userId, (id, existing) -> existing == null
                ? CreditAccount.open(id, monthlyLimit, period) : existing.rolledTo(period).withMonthlyLimit(monthlyLimit));
        LOG.infof("Configured AI credit limit for user %s: %s", userId, monthlyLimit.toPlainString());
        return updated;
    }

    private YearMonth currentPeriod() {
        return YearMonth.from(clock.instant().atZone(ZoneOffset.UTC));
    }
}
