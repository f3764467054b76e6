package estate.token.support;

import estate.token.infrastructure.ledger.AccountLedger;
import estate.token.infrastructure.persistence.entity.SequenceEntity;
import estate.token.infrastructure.persistence.repository.AccountRepository;
import estate.token.infrastructure.persistence.repository.AuctionRepository;
import estate.token.infrastructure.persistence.repository.NotificationRepository;
import estate.token.infrastructure.persistence.repository.OfferEscrowRepository;
import estate.token.infrastructure.persistence.repository.PropertyRepository;
import estate.token.infrastructure.persistence.repository.SequenceRepository;
import estate.token.infrastructure.persistence.repository.TitleDeedRepository;
import estate.token.infrastructure.sequence.SequenceAllocator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * H2 기반 통합 테스트 공통 설정
 *
 * <p>엔진 연산이 실제로 커밋되어야 하므로 테스트 메서드에 @Transactional을 붙이지 않고, 매 테스트 후 테이블을 비웁니다. vault 계정과
 * 시퀀스 행은 기동 시점처럼 다시 열어 둡니다.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(ManualClockConfig.class)
public abstract class IntegrationTestSupport {

  protected static final String ADMIN = "0xadmin";

  @Autowired protected ManualChainClock clock;

  @Autowired protected AccountLedger accountLedger;

  @Autowired private SequenceAllocator sequenceAllocator;

  @Autowired private AccountRepository accountRepository;
  @Autowired private AuctionRepository auctionRepository;
  @Autowired private NotificationRepository notificationRepository;
  @Autowired private OfferEscrowRepository offerEscrowRepository;
  @Autowired private PropertyRepository propertyRepository;
  @Autowired private SequenceRepository sequenceRepository;
  @Autowired private TitleDeedRepository titleDeedRepository;

  @BeforeEach
  void resetClock() {
    clock.reset();
  }

  @AfterEach
  void cleanUp() {
    notificationRepository.deleteAllInBatch();
    offerEscrowRepository.deleteAllInBatch();
    auctionRepository.deleteAllInBatch();
    titleDeedRepository.deleteAllInBatch();
    propertyRepository.deleteAllInBatch();
    sequenceRepository.deleteAllInBatch();
    accountRepository.deleteAllInBatch();
    accountLedger.openIfAbsent(accountLedger.vaultAccount());
    sequenceAllocator.openIfAbsent(SequenceEntity.PROPERTY);
    sequenceAllocator.openIfAbsent(SequenceEntity.NOTIFICATION);
  }
}
