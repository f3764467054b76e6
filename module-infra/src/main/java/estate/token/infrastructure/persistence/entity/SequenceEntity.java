package estate.token.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 이름별 단조 증가 시퀀스 (1부터)
 *
 * <ul>
 *   <li>{@link #PROPERTY}: 자산 ID
 *   <li>{@link #NOTIFICATION}: 알림 로그 시퀀스
 * </ul>
 */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "id_sequence")
public class SequenceEntity {

  public static final String PROPERTY = "property";
  public static final String NOTIFICATION = "notification";

  @Id
  @Column(length = 32)
  private String name;

  @Column(nullable = false)
  private long nextValue;

  @Version private Long version;

  private SequenceEntity(String name) {
    this.name = name;
    this.nextValue = 1L;
  }

  public static SequenceEntity start(String name) {
    return new SequenceEntity(name);
  }

  public long allocate() {
    return nextValue++;
  }
}
