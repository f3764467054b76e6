package estate.token.controller.dto.rental;

import jakarta.validation.constraints.NotNull;

/**
 * @param months 임대 개월 수 (1개월 = 30일)
 * @param value 첨부 금액, 월 임대료 × 개월 수 이상
 */
public record RentRequest(
    @NotNull(message = "개월 수는 필수입니다") Long months,
    @NotNull(message = "첨부 금액은 필수입니다") Long value) {}
