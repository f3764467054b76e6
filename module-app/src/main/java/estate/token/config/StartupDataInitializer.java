package estate.token.config;

import estate.token.infrastructure.ledger.AccountLedger;
import estate.token.infrastructure.persistence.entity.SequenceEntity;
import estate.token.infrastructure.sequence.SequenceAllocator;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 기동 시 공유 행을 미리 만든다
 *
 * <p>vault 계정과 시퀀스 행은 모든 연산이 경유하므로, 첫 연산끼리 행 생성 경합(PK 충돌)으로 실패하지 않게 합니다.
 */
@Component
@RequiredArgsConstructor
public class StartupDataInitializer implements ApplicationRunner {

  private final AccountLedger accountLedger;
  private final SequenceAllocator sequenceAllocator;

  @Override
  public void run(ApplicationArguments args) {
    accountLedger.openIfAbsent(accountLedger.vaultAccount());
    sequenceAllocator.openIfAbsent(SequenceEntity.PROPERTY);
    sequenceAllocator.openIfAbsent(SequenceEntity.NOTIFICATION);
  }
}
