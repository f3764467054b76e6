package estate.token.controller.dto.account;

import jakarta.validation.constraints.NotNull;

public record DepositRequest(@NotNull(message = "입금액은 필수입니다") Long amount) {}
