package estate.token.domain.model.auction;

/** 경매 상태 조회 모델. 종료된 경매도 계속 조회됩니다. */
public record AuctionDetails(
    Long propertyId,
    long startPrice,
    long highBid,
    String highBidder,
    long endTime,
    boolean ended,
    boolean open) {}
