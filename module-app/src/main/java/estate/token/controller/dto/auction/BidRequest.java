package estate.token.controller.dto.auction;

import jakarta.validation.constraints.NotNull;

public record BidRequest(@NotNull(message = "입찰 금액은 필수입니다") Long value) {}
