package estate.token.service.auction;

import estate.token.aop.annotation.Locked;
import estate.token.core.port.out.ChainClock;
import estate.token.core.port.out.NotificationChannel;
import estate.token.core.port.out.OwnershipRegistry;
import estate.token.core.port.out.ValueTransferPort;
import estate.token.domain.model.InputLimits;
import estate.token.domain.model.auction.AuctionDetails;
import estate.token.domain.model.notification.PropertyNotification;
import estate.token.error.exception.AuctionExistsException;
import estate.token.error.exception.AuctionNotFoundException;
import estate.token.error.exception.InvalidArgumentException;
import estate.token.error.exception.PropertyListedException;
import estate.token.error.exception.PropertyRentedException;
import estate.token.infrastructure.persistence.entity.AuctionEntity;
import estate.token.infrastructure.persistence.entity.AuctionEntity.Refund;
import estate.token.infrastructure.persistence.entity.PropertyEntity;
import estate.token.infrastructure.persistence.repository.AuctionRepository;
import estate.token.service.auth.AuthorizationCheck;
import estate.token.service.property.PropertyRegistryService;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 영국식 경매 엔진
 *
 * <p>상태: 없음 → Open → Closed. 종료된 경매 기록은 남으며 같은 매물에 새 경매를 시작할 수 없습니다.
 *
 * <p>진행 중 최고 입찰액은 vault에 보관되고, 밀려난 입찰자는 새 입찰이 기록된 뒤 전액 환불받습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuctionService {

  private final PropertyRegistryService propertyRegistry;
  private final AuthorizationCheck authorizationCheck;
  private final AuctionRepository auctionRepository;
  private final OwnershipRegistry ownershipRegistry;
  private final ValueTransferPort valueTransfer;
  private final ChainClock chainClock;
  private final NotificationChannel notificationChannel;

  /**
   * @param duration 경매 기간 (초)
   */
  @Transactional
  @Locked(key = "'property:' + #propertyId")
  public void startAuction(String caller, Long propertyId, long startPrice, long duration) {
    PropertyEntity property = propertyRegistry.load(propertyId);
    authorizationCheck.requireAuthorized(propertyId, caller);
    long now = chainClock.now();
    if (property.isForSale()) {
      throw new PropertyListedException(propertyId);
    }
    if (property.isRentedAt(now)) {
      throw new PropertyRentedException(propertyId);
    }
    if (auctionRepository.existsById(propertyId)) {
      throw new AuctionExistsException(propertyId);
    }
    if (duration <= 0) {
      throw new InvalidArgumentException("duration must be positive: " + duration);
    }
    if (startPrice < 0) {
      throw new InvalidArgumentException("start price must not be negative: " + startPrice);
    }
    long endTime = endTimeOf(now, duration);

    auctionRepository.save(AuctionEntity.open(propertyId, startPrice, endTime));
    notificationChannel.append(
        new PropertyNotification.AuctionStarted(propertyId, startPrice, endTime));

    log.info(
        "[Auction] Started: propertyId={}, startPrice={}, endTime={}",
        propertyId,
        startPrice,
        endTime);
  }

  /** 입찰. 새 최고가를 먼저 기록하고 이전 최고 입찰자에게 전액 환불합니다. */
  @Transactional
  @Locked(key = "'property:' + #propertyId")
  public void bid(String caller, Long propertyId, long value) {
    propertyRegistry.load(propertyId);
    AuctionEntity auction = load(propertyId);
    long now = chainClock.now();
    auction.validateBid(value, now);
    InputLimits.requireAccountId("bidder", caller);

    valueTransfer.collect(caller, value);

    Optional<Refund> refund = auction.placeBid(caller, value, now);

    refund.ifPresent(r -> valueTransfer.push(r.bidder(), r.amount()));
    notificationChannel.append(new PropertyNotification.Bid(propertyId, caller, value));

    log.info(
        "[Auction] Bid: propertyId={}, bidder={}, amount={}, refunded={}",
        propertyId,
        caller,
        value,
        refund.map(Refund::bidder).orElse("-"));
  }

  /**
   * 경매 종료 (누구나 호출 가능)
   *
   * <p>종료 플래그와 소유권 이전을 먼저 반영하고, 이전 전 소유자에게 낙찰가를 지급합니다. 입찰이 없으면 이전과 지급 없이 종료 알림만 남깁니다.
   */
  @Transactional
  @Locked(key = "'property:' + #propertyId")
  public void endAuction(String caller, Long propertyId) {
    propertyRegistry.load(propertyId);
    AuctionEntity auction = load(propertyId);

    auction.close(chainClock.now());

    Optional<String> winner = auction.findHighBidder();
    if (winner.isEmpty()) {
      notificationChannel.append(new PropertyNotification.AuctionEnded(propertyId, null, 0L));
      log.info("[Auction] Ended without bids: propertyId={}, caller={}", propertyId, caller);
      return;
    }

    String seller = ownershipRegistry.ownerOf(propertyId);
    long amount = auction.getHighBid();
    ownershipRegistry.transfer(seller, winner.get(), propertyId);

    valueTransfer.push(seller, amount);
    notificationChannel.append(
        new PropertyNotification.AuctionEnded(propertyId, winner.get(), amount));

    log.info(
        "[Auction] Ended: propertyId={}, seller={}, winner={}, amount={}",
        propertyId,
        seller,
        winner.get(),
        amount);
  }

  @Transactional(readOnly = true)
  public AuctionDetails auctionOf(Long propertyId) {
    propertyRegistry.load(propertyId);
    AuctionEntity auction = load(propertyId);
    return new AuctionDetails(
        auction.getPropertyId(),
        auction.getStartPrice(),
        auction.getHighBid(),
        auction.getHighBidder(),
        auction.getEndTime(),
        auction.isEnded(),
        auction.isOpenAt(chainClock.now()));
  }

  private AuctionEntity load(Long propertyId) {
    return auctionRepository
        .findById(propertyId)
        .orElseThrow(() -> new AuctionNotFoundException(propertyId));
  }

  private long endTimeOf(long now, long duration) {
    try {
      return Math.addExact(now, duration);
    } catch (ArithmeticException e) {
      throw new InvalidArgumentException("auction end time overflow (duration: " + duration + ")");
    }
  }
}
