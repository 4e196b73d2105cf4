package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record CreditLimitRequestType(@JsonProperty("monthly_limit") @NotNull @PositiveOrZero BigDecimal monthlyLimit) {
}
