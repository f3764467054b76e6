package estate.token.infrastructure.sequence;

import estate.token.infrastructure.persistence.entity.SequenceEntity;
import estate.token.infrastructure.persistence.repository.SequenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * DB 행 락 기반 시퀀스 발급
 *
 * <p>발급한 번호의 행 락은 호출 트랜잭션 커밋까지 유지됩니다. 따라서 번호 N+1은 N을 발급한 트랜잭션이 끝난 뒤에야 발급되고, 커밋된 번호는 빈틈
 * 없이 오름차순으로 보입니다(롤백된 번호는 다음 발급에서 재사용). 여러 인스턴스가 같은 DB를 써도 동일하게 동작합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SequenceAllocator {

  private final SequenceRepository sequenceRepository;

  @Transactional(propagation = Propagation.MANDATORY)
  public long next(String name) {
    SequenceEntity sequence =
        sequenceRepository
            .findForUpdate(name)
            .orElseGet(() -> sequenceRepository.saveAndFlush(SequenceEntity.start(name)));
    return sequence.allocate();
  }

  /** 시퀀스 행이 없으면 생성 (기동 시 선생성용, 첫 발급끼리의 행 생성 경합 방지) */
  @Transactional
  public void openIfAbsent(String name) {
    if (!sequenceRepository.existsById(name)) {
      sequenceRepository.save(SequenceEntity.start(name));
      log.info("[Sequence] Opened: {}", name);
    }
  }
}
