package estate.token.controller.dto.rental;

import jakarta.validation.constraints.NotNull;

public record ListForRentRequest(@NotNull(message = "월 임대료는 필수입니다") Long monthlyRent) {}
