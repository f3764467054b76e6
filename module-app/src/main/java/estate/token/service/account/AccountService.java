package estate.token.service.account;

import estate.token.aop.annotation.Locked;
import estate.token.core.port.out.AccessControl;
import estate.token.domain.model.InputLimits;
import estate.token.error.exception.InvalidArgumentException;
import estate.token.error.exception.NotPrivilegedException;
import estate.token.infrastructure.ledger.AccountLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** 계정 잔액 조회와 특권 계정의 입금 */
@Service
@RequiredArgsConstructor
public class AccountService {

  private final AccountLedger accountLedger;
  private final AccessControl accessControl;

  /**
   * @return 입금 후 잔액
   */
  @Transactional
  @Locked(key = "'account:' + #account")
  public long deposit(String caller, String account, long amount) {
    if (!accessControl.isPrivileged(caller)) {
      throw new NotPrivilegedException(caller);
    }
    if (account == null || account.isBlank()) {
      throw new InvalidArgumentException("account is required");
    }
    InputLimits.requireAccountId("account", account);
    if (amount <= 0) {
      throw new InvalidArgumentException("deposit must be positive: " + amount);
    }

    accountLedger.deposit(account, amount);
    return accountLedger.balanceOf(account);
  }

  @Transactional(readOnly = true)
  public long balanceOf(String account) {
    return accountLedger.balanceOf(account);
  }
}
