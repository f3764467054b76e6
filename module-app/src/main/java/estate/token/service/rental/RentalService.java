package estate.token.service.rental;

import estate.token.aop.annotation.Locked;
import estate.token.core.calculator.RentCalculator;
import estate.token.core.port.out.ChainClock;
import estate.token.core.port.out.NotificationChannel;
import estate.token.core.port.out.OwnershipRegistry;
import estate.token.core.port.out.ValueTransferPort;
import estate.token.domain.model.InputLimits;
import estate.token.domain.model.notification.PropertyNotification;
import estate.token.error.exception.InsufficientPaymentException;
import estate.token.error.exception.InvalidArgumentException;
import estate.token.error.exception.NotRenterException;
import estate.token.error.exception.PropertyListedException;
import estate.token.error.exception.PropertyRentedException;
import estate.token.error.exception.RentalNotListedException;
import estate.token.infrastructure.persistence.entity.PropertyEntity;
import estate.token.service.auth.AuthorizationCheck;
import estate.token.service.property.PropertyRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 고정 기간 임대 엔진
 *
 * <p>임대료는 요청 시점의 소유자에게 즉시 지급되며, 요구 금액을 넘는 초과 지불액은 환불하지 않습니다. 1개월은 30일 고정입니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RentalService {

  private final PropertyRegistryService propertyRegistry;
  private final AuthorizationCheck authorizationCheck;
  private final OwnershipRegistry ownershipRegistry;
  private final ValueTransferPort valueTransfer;
  private final ChainClock chainClock;
  private final NotificationChannel notificationChannel;

  @Transactional
  @Locked(key = "'property:' + #propertyId")
  public void listForRent(String caller, Long propertyId, long monthlyRent) {
    PropertyEntity property = propertyRegistry.load(propertyId);
    authorizationCheck.requireAuthorized(propertyId, caller);
    if (property.isForSale()) {
      throw new PropertyListedException(propertyId);
    }
    if (property.isRentedAt(chainClock.now())) {
      throw new PropertyRentedException(propertyId);
    }
    if (monthlyRent < 0) {
      throw new InvalidArgumentException("monthly rent must not be negative: " + monthlyRent);
    }

    property.listForRent(monthlyRent);
    notificationChannel.append(new PropertyNotification.RentalListed(propertyId, monthlyRent));

    log.info("[Rental] Listed: propertyId={}, monthlyRent={}", propertyId, monthlyRent);
  }

  /**
   * 임대 계약
   *
   * <p>판매 등록 여부는 확인하지 않습니다. 판매 중인 매물도 임대될 수 있습니다.
   */
  @Transactional
  @Locked(key = "'property:' + #propertyId")
  public void rentProperty(String caller, Long propertyId, long months, long value) {
    PropertyEntity property = propertyRegistry.load(propertyId);
    if (!property.isRentalListed()) {
      throw new RentalNotListedException(propertyId);
    }
    if (months <= 0) {
      throw new InvalidArgumentException("months must be positive: " + months);
    }
    long now = chainClock.now();
    if (property.isRentedAt(now)) {
      throw new PropertyRentedException(propertyId);
    }
    long required = RentCalculator.requiredRent(property.getMonthlyRent(), months);
    if (value < required) {
      throw new InsufficientPaymentException(required, value);
    }

    InputLimits.requireAccountId("renter", caller);
    valueTransfer.collect(caller, value);

    String landlord = ownershipRegistry.ownerOf(propertyId);
    property.lease(caller, now, months);

    valueTransfer.push(landlord, required);
    notificationChannel.append(
        new PropertyNotification.Rented(propertyId, caller, months, required));

    log.info(
        "[Rental] Rented: propertyId={}, renter={}, months={}, paid={}, rentalEnd={}",
        propertyId,
        caller,
        months,
        required,
        property.getRentalEnd());
  }

  /**
   * 임대 연장
   *
   * <p>연장 대금은 최초 임대인이 아니라 연장 시점의 소유자에게 지급됩니다. 만료된 임대도 기존 renter라면 연장할 수 있습니다.
   */
  @Transactional
  @Locked(key = "'property:' + #propertyId")
  public void extendRental(String caller, Long propertyId, long additionalMonths, long value) {
    PropertyEntity property = propertyRegistry.load(propertyId);
    if (!property.isRentedBy(caller)) {
      throw new NotRenterException(propertyId, caller);
    }
    if (additionalMonths <= 0) {
      throw new InvalidArgumentException(
          "additional months must be positive: " + additionalMonths);
    }
    long required = RentCalculator.requiredRent(property.getMonthlyRent(), additionalMonths);
    if (value < required) {
      throw new InsufficientPaymentException(required, value);
    }

    valueTransfer.collect(caller, value);

    String holder = ownershipRegistry.ownerOf(propertyId);
    property.extendLease(additionalMonths);

    valueTransfer.push(holder, required);
    notificationChannel.append(
        new PropertyNotification.Extended(propertyId, additionalMonths, required));

    log.info(
        "[Rental] Extended: propertyId={}, additionalMonths={}, paid={}, rentalEnd={}",
        propertyId,
        additionalMonths,
        required,
        property.getRentalEnd());
  }
}
