package estate.token.controller.dto.market;

import jakarta.validation.constraints.NotNull;

/**
 * @param value 첨부 금액 (에스크로로 보관)
 */
public record MakeOfferRequest(@NotNull(message = "첨부 금액은 필수입니다") Long value) {}
