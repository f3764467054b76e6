package estate.token.infrastructure.security;

import estate.token.core.port.out.AccessControl;
import estate.token.infrastructure.config.AccessProperties;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** 설정(estate.access.privileged-accounts)에 등록된 계정만 특권 계정으로 인정 */
@Slf4j
@Component
public class ConfiguredAccessControl implements AccessControl {

  private final Set<String> privilegedAccounts;

  public ConfiguredAccessControl(AccessProperties properties) {
    this.privilegedAccounts = Set.copyOf(properties.privilegedAccounts());
    log.info("[Access] {} privileged account(s) configured", privilegedAccounts.size());
  }

  @Override
  public boolean isPrivileged(String caller) {
    return caller != null && privilegedAccounts.contains(caller);
  }
}
