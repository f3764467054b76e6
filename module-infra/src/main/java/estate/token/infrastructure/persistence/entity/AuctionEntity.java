package estate.token.infrastructure.persistence.entity;

import estate.token.error.exception.AuctionAlreadyEndedException;
import estate.token.error.exception.AuctionClosedException;
import estate.token.error.exception.AuctionNotEndedException;
import estate.token.error.exception.BidTooLowException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 영국식 경매 (자산당 최대 1건)
 *
 * <p>상태: 없음 → Open(startAuction) → Closed(endAuction, 종료 상태). 종료된 기록은 삭제하지 않고 계속 조회됩니다.
 */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "auction")
public class AuctionEntity {

  @Id private Long propertyId;

  @Column(nullable = false)
  private long startPrice;

  @Column(nullable = false)
  private long highBid;

  @Column(length = AccountEntity.ACCOUNT_ID_LENGTH)
  private String highBidder;

  @Column(nullable = false)
  private long endTime;

  @Column(nullable = false)
  private boolean ended;

  @Version private Long version;

  /** 밀려난 최고 입찰자에게 돌려줄 환불 */
  public record Refund(String bidder, long amount) {}

  private AuctionEntity(Long propertyId, long startPrice, long endTime) {
    this.propertyId = propertyId;
    this.startPrice = startPrice;
    this.endTime = endTime;
  }

  public static AuctionEntity open(Long propertyId, long startPrice, long endTime) {
    return new AuctionEntity(propertyId, startPrice, endTime);
  }

  public boolean isOpenAt(long now) {
    return !ended && now < endTime;
  }

  public Optional<String> findHighBidder() {
    return Optional.ofNullable(highBidder);
  }

  /**
   * 입찰 가능 여부 검증 (상태 변경 없음)
   *
   * @throws AuctionClosedException 종료 시각 이후이거나 종료 처리됨
   * @throws BidTooLowException 현재 최고가 이하이거나 시작가 미만
   */
  public void validateBid(long amount, long now) {
    if (!isOpenAt(now)) {
      throw new AuctionClosedException(propertyId);
    }
    if (amount <= highBid || amount < startPrice) {
      throw new BidTooLowException(amount, highBid, startPrice);
    }
  }

  /**
   * 입찰 기록
   *
   * <p>새 최고가를 먼저 기록하고, 이전 최고 입찰자의 환불 정보를 반환합니다. 환불 지급은 호출 측이 상태 변경을 모두 끝낸 뒤 수행합니다.
   *
   * @throws AuctionClosedException 종료 시각 이후이거나 종료 처리됨
   * @throws BidTooLowException 현재 최고가 이하이거나 시작가 미만
   */
  public Optional<Refund> placeBid(String bidder, long amount, long now) {
    validateBid(amount, now);

    Optional<Refund> refund =
        findHighBidder().map(previous -> new Refund(previous, this.highBid));
    this.highBid = amount;
    this.highBidder = bidder;
    return refund;
  }

  /**
   * 종료 처리 (정확히 한 번)
   *
   * @throws AuctionNotEndedException 종료 시각 전
   * @throws AuctionAlreadyEndedException 이미 종료 처리됨
   */
  public void close(long now) {
    if (now < endTime) {
      throw new AuctionNotEndedException(propertyId, endTime);
    }
    if (ended) {
      throw new AuctionAlreadyEndedException(propertyId);
    }
    this.ended = true;
  }
}
