package estate.token.infrastructure.persistence.repository;

import estate.token.infrastructure.persistence.entity.SequenceEntity;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SequenceRepository extends JpaRepository<SequenceEntity, String> {

  /**
   * 시퀀스 행을 비관적 쓰기 락으로 조회 (SELECT ... FOR UPDATE)
   *
   * <p>락은 호출 트랜잭션이 끝날 때까지 유지됩니다. 같은 시퀀스를 쓰는 다른 트랜잭션은 앞선 트랜잭션이 커밋/롤백할 때까지 대기하므로, 번호는 커밋
   * 순서대로 보이게 됩니다.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select s from SequenceEntity s where s.name = :name")
  Optional<SequenceEntity> findForUpdate(@Param("name") String name);
}
