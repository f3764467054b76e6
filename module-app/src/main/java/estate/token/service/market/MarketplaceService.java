package estate.token.service.market;

import estate.token.aop.annotation.Locked;
import estate.token.core.port.out.ChainClock;
import estate.token.core.port.out.NotificationChannel;
import estate.token.core.port.out.OwnershipRegistry;
import estate.token.core.port.out.ValueTransferPort;
import estate.token.domain.model.InputLimits;
import estate.token.domain.model.notification.PropertyNotification;
import estate.token.error.exception.InvalidArgumentException;
import estate.token.error.exception.NotForSaleException;
import estate.token.error.exception.OfferNotFoundException;
import estate.token.error.exception.PropertyRentedException;
import estate.token.infrastructure.persistence.entity.OfferEscrowEntity;
import estate.token.infrastructure.persistence.entity.PropertyEntity;
import estate.token.infrastructure.persistence.repository.OfferEscrowRepository;
import estate.token.service.auth.AuthorizationCheck;
import estate.token.service.property.PropertyRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 직접 판매 (에스크로 오퍼) 엔진
 *
 * <p>모든 연산은 검증 → 첨부 금액 수납 → 내부 상태 변경 → 지급 → 알림 순서로 실행됩니다. 지급 시점에는 매물/에스크로 상태가 이미 최종 상태입니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketplaceService {

  private final PropertyRegistryService propertyRegistry;
  private final AuthorizationCheck authorizationCheck;
  private final OfferEscrowRepository offerEscrowRepository;
  private final OwnershipRegistry ownershipRegistry;
  private final ValueTransferPort valueTransfer;
  private final ChainClock chainClock;
  private final NotificationChannel notificationChannel;

  /** 판매 등록. 임대 중이면 호출자와 무관하게 먼저 거절합니다. */
  @Transactional
  @Locked(key = "'property:' + #propertyId")
  public void listForSale(String caller, Long propertyId, long price) {
    PropertyEntity property = propertyRegistry.load(propertyId);
    if (property.isRentedAt(chainClock.now())) {
      throw new PropertyRentedException(propertyId);
    }
    authorizationCheck.requireAuthorized(propertyId, caller);
    if (price <= 0) {
      throw new InvalidArgumentException("price must be positive: " + price);
    }

    property.listForSale(price);
    notificationChannel.append(new PropertyNotification.Listed(propertyId, price));

    log.info("[Marketplace] Listed: propertyId={}, price={}", propertyId, price);
  }

  /**
   * 오퍼 제출
   *
   * <p>같은 입찰자의 이전 오퍼는 누적되지 않고 덮어씁니다. 이전 금액은 vault에 남으며 환불되지 않습니다.
   */
  @Transactional
  @Locked(key = "'property:' + #propertyId")
  public void makeOffer(String caller, Long propertyId, long value) {
    PropertyEntity property = propertyRegistry.load(propertyId);
    if (!property.isForSale()) {
      throw new NotForSaleException(propertyId);
    }
    if (value <= 0) {
      throw new InvalidArgumentException("offer must be positive: " + value);
    }

    InputLimits.requireAccountId("bidder", caller);
    valueTransfer.collect(caller, value);

    offerEscrowRepository
        .findByPropertyIdAndBidder(propertyId, caller)
        .ifPresentOrElse(
            escrow -> overwrite(escrow, value),
            () -> offerEscrowRepository.save(OfferEscrowEntity.hold(propertyId, caller, value)));
    notificationChannel.append(new PropertyNotification.OfferMade(propertyId, caller, value));

    log.info(
        "[Marketplace] Offer made: propertyId={}, bidder={}, amount={}", propertyId, caller, value);
  }

  /**
   * 오퍼 수락
   *
   * <p>판매 종료, 에스크로 해제, 소유권 이전을 모두 끝낸 뒤 이전 전 소유자에게 대금을 지급합니다. 다른 입찰자의 에스크로는 그대로 남습니다.
   */
  @Transactional
  @Locked(key = "'property:' + #propertyId")
  public void acceptOffer(String caller, Long propertyId, String buyer) {
    PropertyEntity property = propertyRegistry.load(propertyId);
    authorizationCheck.requireAuthorized(propertyId, caller);
    if (!property.isForSale()) {
      throw new NotForSaleException(propertyId);
    }
    OfferEscrowEntity escrow = findHeldOffer(propertyId, buyer);

    String seller = ownershipRegistry.ownerOf(propertyId);
    property.closeSale();
    long amount = escrow.release();
    ownershipRegistry.transfer(seller, buyer, propertyId);

    valueTransfer.push(seller, amount);
    notificationChannel.append(new PropertyNotification.OfferAccepted(propertyId, buyer, amount));

    log.info(
        "[Marketplace] Offer accepted: propertyId={}, seller={}, buyer={}, amount={}",
        propertyId,
        seller,
        buyer,
        amount);
  }

  /** 오퍼 철회. 보관 금액 전액을 입찰자에게 돌려줍니다. */
  @Transactional
  @Locked(key = "'property:' + #propertyId")
  public void withdrawOffer(String caller, Long propertyId) {
    propertyRegistry.load(propertyId);
    OfferEscrowEntity escrow = findHeldOffer(propertyId, caller);

    long amount = escrow.release();

    valueTransfer.push(caller, amount);
    notificationChannel.append(new PropertyNotification.OfferWithdrawn(propertyId, caller));

    log.info(
        "[Marketplace] Offer withdrawn: propertyId={}, bidder={}, amount={}",
        propertyId,
        caller,
        amount);
  }

  @Transactional(readOnly = true)
  public long escrowOf(Long propertyId, String bidder) {
    propertyRegistry.load(propertyId);
    return offerEscrowRepository
        .findByPropertyIdAndBidder(propertyId, bidder)
        .map(OfferEscrowEntity::getAmount)
        .orElse(0L);
  }

  private OfferEscrowEntity findHeldOffer(Long propertyId, String bidder) {
    return offerEscrowRepository
        .findByPropertyIdAndBidder(propertyId, bidder)
        .filter(OfferEscrowEntity::isHeld)
        .orElseThrow(() -> new OfferNotFoundException(propertyId, bidder));
  }

  private void overwrite(OfferEscrowEntity escrow, long value) {
    if (escrow.isHeld()) {
      log.warn(
          "[Marketplace] Offer overwritten, previous amount stays in vault:"
              + " propertyId={}, bidder={}, previous={}",
          escrow.getPropertyId(),
          escrow.getBidder(),
          escrow.getAmount());
    }
    escrow.overwrite(value);
  }
}
