package estate.token.controller.dto.property;

import estate.token.domain.model.InputLimits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * 매물 발행 요청 DTO
 *
 * @param to 최초 소유자 계정
 * @param location 소재지
 * @param area 면적 (0 이상)
 * @param category 분류 (예: apartment)
 */
public record MintRequest(
    @NotBlank(message = "소유자 계정은 필수입니다")
        @Size(max = InputLimits.ACCOUNT_ID_MAX, message = "소유자 계정이 너무 깁니다")
        String to,
    @NotBlank(message = "소재지는 필수입니다")
        @Size(max = InputLimits.LOCATION_MAX, message = "소재지가 너무 깁니다")
        String location,
    @NotNull(message = "면적은 필수입니다") Long area,
    @NotBlank(message = "분류는 필수입니다")
        @Size(max = InputLimits.CATEGORY_MAX, message = "분류가 너무 깁니다")
        String category) {}
