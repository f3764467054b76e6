package estate.token.controller.dto.rental;

import jakarta.validation.constraints.NotNull;

public record ExtendRentalRequest(
    @NotNull(message = "연장 개월 수는 필수입니다") Long additionalMonths,
    @NotNull(message = "첨부 금액은 필수입니다") Long value) {}
