package estate.token.infrastructure.ledger;

import estate.token.core.port.out.ValueTransferPort;
import estate.token.error.exception.InsufficientFundsException;
import estate.token.error.exception.InternalSystemException;
import estate.token.error.exception.InvalidArgumentException;
import estate.token.infrastructure.config.LedgerProperties;
import estate.token.infrastructure.persistence.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 계정 원장 기반 통화 이동
 *
 * <p>첨부 금액은 호출자 → vault, 지급은 vault → 수신자로 흐릅니다. vault 잔액 = 살아있는 에스크로 + 진행 중 경매 최고가 + 환불되지 않는 초과
 * 지불액.
 *
 * <p>잔액 변경은 모두 조건부 UPDATE이므로 서로 다른 매물 연산이 같은 계정에 동시에 지급해도 별도 락이 필요 없습니다.
 *
 * <p>입금은 계정 행 생성과 가산을 한 문장(upsert)으로 처리하므로 처음 보는 계정으로 동시에 지급해도 PK 충돌이 나지 않습니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountLedger implements ValueTransferPort {

  private final AccountRepository accountRepository;
  private final LedgerProperties ledgerProperties;

  @Override
  @Transactional(propagation = Propagation.MANDATORY) // 반드시 엔진 트랜잭션 안에서 실행
  public void collect(String from, long amount) {
    requireNonNegative(amount);
    if (amount == 0) {
      return;
    }
    if (accountRepository.decreaseBalance(from, amount) == 0) {
      throw new InsufficientFundsException(from, amount);
    }
    credit(vaultAccount(), amount);
  }

  @Override
  @Transactional(propagation = Propagation.MANDATORY)
  public void push(String to, long amount) {
    requireNonNegative(amount);
    if (amount == 0) {
      return;
    }
    if (accountRepository.decreaseBalance(vaultAccount(), amount) == 0) {
      // 엔진이 수납한 금액만 지급하므로 여기 도달하면 장부 불일치
      throw new InternalSystemException("vault underflow (amount: " + amount + ")");
    }
    credit(to, amount);
    log.debug("[Ledger] Pushed: to={}, amount={}", to, amount);
  }

  /** 외부 체인 대신 로컬 계정에 자금을 넣는다 */
  @Transactional(propagation = Propagation.MANDATORY)
  public void deposit(String account, long amount) {
    credit(account, amount);
    log.info("[Ledger] Deposit: account={}, amount={}", account, amount);
  }

  /** 계정 행이 없으면 잔액 0으로 생성, 있으면 그대로 (vault 선생성용) */
  @Transactional
  public void openIfAbsent(String account) {
    accountRepository.upsertBalance(account, 0L);
  }

  @Transactional(readOnly = true)
  public long balanceOf(String account) {
    return accountRepository.findBalance(account).orElse(0L);
  }

  public String vaultAccount() {
    return ledgerProperties.vaultAccount();
  }

  private void requireNonNegative(long amount) {
    if (amount < 0) {
      throw new InvalidArgumentException("amount must not be negative: " + amount);
    }
  }

  private void credit(String account, long amount) {
    accountRepository.upsertBalance(account, amount);
  }
}
