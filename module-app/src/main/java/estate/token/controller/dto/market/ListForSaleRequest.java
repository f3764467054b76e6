package estate.token.controller.dto.market;

import jakarta.validation.constraints.NotNull;

/**
 * @param price 판매가 (양수 여부는 임대 상태/권한 확인 뒤에 검증)
 */
public record ListForSaleRequest(@NotNull(message = "판매가는 필수입니다") Long price) {}
