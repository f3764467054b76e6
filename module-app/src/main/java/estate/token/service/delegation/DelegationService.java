package estate.token.service.delegation;

import estate.token.aop.annotation.Locked;
import estate.token.core.port.out.NotificationChannel;
import estate.token.domain.model.InputLimits;
import estate.token.domain.model.notification.PropertyNotification;
import estate.token.infrastructure.persistence.entity.PropertyEntity;
import estate.token.service.auth.AuthorizationCheck;
import estate.token.service.property.PropertyRegistryService;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** 매물 관리자 위임 (소유자 본인만 지정/해제 가능) */
@Slf4j
@Service
@RequiredArgsConstructor
public class DelegationService {

  private final PropertyRegistryService propertyRegistry;
  private final AuthorizationCheck authorizationCheck;
  private final NotificationChannel notificationChannel;

  /**
   * @param manager 새 관리자, null 또는 공백이면 위임 해제
   */
  @Transactional
  @Locked(key = "'property:' + #propertyId")
  public void setManager(String caller, Long propertyId, String manager) {
    PropertyEntity property = propertyRegistry.load(propertyId);
    authorizationCheck.requireTitleHolder(propertyId, caller);
    String normalized = (manager == null || manager.isBlank()) ? null : manager;
    InputLimits.requireAccountId("manager", normalized);

    property.assignManager(normalized);
    notificationChannel.append(new PropertyNotification.ManagerAssigned(propertyId, normalized));

    log.info("[Delegation] Manager set: propertyId={}, manager={}", propertyId, normalized);
  }

  @Transactional(readOnly = true)
  public Optional<String> managerOf(Long propertyId) {
    return propertyRegistry.load(propertyId).findManager();
  }
}
