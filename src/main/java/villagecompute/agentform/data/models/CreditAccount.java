package villagecompute.agentform.data.models;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Objects;

/**
 * Per-user AI credit quota for the current monthly period.
 *
 * <p>
 * {@code used} may exceed {@code monthlyLimit}: debits are not checked at write time. Reads go through
 * {@link #remaining()}, which clamps at zero.
 *
 * @param userId
 *            account owner
 * @param used
 *            credits consumed in the current period
 * @param monthlyLimit
 *            credits granted per period
 * @param periodStart
 *            first day of the current period
 */
public record CreditAccount(String userId, BigDecimal used, BigDecimal monthlyLimit, LocalDate periodStart) {

    public CreditAccount {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(used, "used is required");
        Objects.requireNonNull(monthlyLimit, "monthlyLimit is required");
        Objects.requireNonNull(periodStart, "periodStart is required");
    }

    public static CreditAccount open(String userId, BigDecimal monthlyLimit, YearMonth period) {
        return new CreditAccount(userId, BigDecimal.ZERO, monthlyLimit, period.atDay(1));
    }

    public BigDecimal remaining() {
        return monthlyLimit.subtract(used).max(BigDecimal.ZERO);
    }

    public CreditAccount debit(BigDecimal amount) {
        return new CreditAccount(userId, used.add(amount), monthlyLimit, periodStart);
    }

    public CreditAccount withMonthlyLimit(BigDecimal limit) {
        return new CreditAccount(userId, used, limit, periodStart);
    }

    /**
     * Returns this account reset to zero usage when {@code current} is a later period, otherwise this account.
     */
    public CreditAccount rolledTo(YearMonth current) {
        if (YearMonth.from(periodStart).equals(current)) {
            return this;
        }
        return new CreditAccount(userId, BigDecimal.ZERO, monthlyLimit, current.atDay(1));
    }
}
