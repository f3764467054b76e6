package estate.token.controller.dto.auction;

import jakarta.validation.constraints.NotNull;

/**
 * @param startPrice 시작가
 * @param durationSeconds 경매 기간 (초)
 */
public record StartAuctionRequest(
    @NotNull(message = "시작가는 필수입니다") Long startPrice,
    @NotNull(message = "경매 기간은 필수입니다") Long durationSeconds) {}
