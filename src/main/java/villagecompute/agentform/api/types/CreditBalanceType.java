package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.agentform.data.models.CreditAccount;

import java.math.BigDecimal;

public record CreditBalanceType(@JsonProperty("user_id") String userId,

        @JsonProperty("used") BigDecimal used,

        @JsonProperty("monthly_limit") BigDecimal monthlyLimit,

        @JsonProperty("remaining") BigDecimal remaining,

        @JsonProperty("period_start") String periodStart) {

    public static CreditBalanceType from(CreditAccount account) {
        return new CreditBalanceType(account.userId(), account.used(), account.monthlyLimit(), account.remaining(),
                account.periodStart().toString());
    }
}
