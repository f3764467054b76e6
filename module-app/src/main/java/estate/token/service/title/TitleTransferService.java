package estate.token.service.title;

import estate.token.aop.annotation.Locked;
import estate.token.core.port.out.NotificationChannel;
import estate.token.core.port.out.OwnershipRegistry;
import estate.token.domain.model.InputLimits;
import estate.token.domain.model.notification.PropertyNotification;
import estate.token.error.exception.InvalidArgumentException;
import estate.token.service.auth.AuthorizationCheck;
import estate.token.service.property.PropertyRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 소유자 직접 이전
 *
 * <p>위임 관리자는 이전할 수 없습니다. 임대 중 여부는 막지 않으며, 기존 관리자 지정도 그대로 유지됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TitleTransferService {

  private final PropertyRegistryService propertyRegistry;
  private final AuthorizationCheck authorizationCheck;
  private final OwnershipRegistry ownershipRegistry;
  private final NotificationChannel notificationChannel;

  @Transactional
  @Locked(key = "'property:' + #propertyId")
  public void transferTitle(String caller, Long propertyId, String to) {
    propertyRegistry.load(propertyId);
    String from = authorizationCheck.requireTitleHolder(propertyId, caller);
    if (to == null || to.isBlank()) {
      throw new InvalidArgumentException("recipient is required");
    }
    InputLimits.requireAccountId("recipient", to);

    ownershipRegistry.transfer(from, to, propertyId);
    notificationChannel.append(new PropertyNotification.TitleTransferred(propertyId, from, to));

    log.info("[Title] Transferred: propertyId={}, from={}, to={}", propertyId, from, to);
  }
}
