package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

/** 종료된 경매 기록도 재개설을 막는다 */
public class AuctionExistsException extends StateConflictException {
  public AuctionExistsException(Long propertyId) {
    super(CommonErrorCode.AUCTION_EXISTS, propertyId);
  }
}
