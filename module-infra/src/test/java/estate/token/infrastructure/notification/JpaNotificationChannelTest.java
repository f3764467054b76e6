package estate.token.infrastructure.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import estate.token.core.port.out.ChainClock;
import estate.token.domain.model.InputLimits;
import estate.token.domain.model.notification.NotificationType;
import estate.token.domain.model.notification.PropertyNotification;
import estate.token.infrastructure.executor.DefaultLogicExecutor;
import estate.token.infrastructure.persistence.entity.NotificationEntity;
import estate.token.infrastructure.persistence.entity.SequenceEntity;
import estate.token.infrastructure.persistence.repository.NotificationRepository;
import estate.token.infrastructure.sequence.SequenceAllocator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.context.ApplicationEventPublisher;

@Tag("unit")
class JpaNotificationChannelTest {

  /** JSON에서 6자 유니코드 이스케이프로 바뀌는 제어 문자 */
  private static final String CONTROL = String.valueOf((char) 1);

  private NotificationRepository notificationRepository;
  private SequenceAllocator sequenceAllocator;
  private ApplicationEventPublisher eventPublisher;
  private JpaNotificationChannel channel;

  @BeforeEach
  void setUp() {
    notificationRepository = mock(NotificationRepository.class);
    sequenceAllocator = mock(SequenceAllocator.class);
    eventPublisher = mock(ApplicationEventPublisher.class);
    ChainClock chainClock = mock(ChainClock.class);
    given(chainClock.now()).willReturn(1_700_000_000L);
    given(sequenceAllocator.next(SequenceEntity.NOTIFICATION)).willReturn(7L);
    given(notificationRepository.save(any(NotificationEntity.class)))
        .willAnswer(invocation -> invocation.getArgument(0));

    channel =
        new JpaNotificationChannel(
            notificationRepository,
            sequenceAllocator,
            new ObjectMapper(),
            new DefaultLogicExecutor(new SimpleMeterRegistry()),
            chainClock,
            eventPublisher);
  }

  @Test
  @DisplayName("최대 길이 소재지와 소유자가 모두 이스케이프되어도 발행 알림이 payload 컬럼에 들어간다")
  void worstCaseMintedFitsPayloadColumn() {
    PropertyNotification minted =
        new PropertyNotification.Minted(
            Long.MAX_VALUE,
            CONTROL.repeat(InputLimits.ACCOUNT_ID_MAX),
            CONTROL.repeat(InputLimits.LOCATION_MAX));

    long sequence = channel.append(minted);

    NotificationEntity saved = savedEntity();
    assertThat(sequence).isEqualTo(7L);
    assertThat(saved.getPayload().length())
        .isGreaterThan(InputLimits.LOCATION_MAX * 6)
        .isLessThanOrEqualTo(NotificationEntity.PAYLOAD_LENGTH);
  }

  @Test
  @DisplayName("최대 길이 계정 두 개가 담긴 소유권 이전 알림도 payload 컬럼에 들어간다")
  void worstCaseTitleTransferFitsPayloadColumn() {
    String account = CONTROL.repeat(InputLimits.ACCOUNT_ID_MAX);

    channel.append(new PropertyNotification.TitleTransferred(Long.MAX_VALUE, account, account));

    assertThat(savedEntity().getPayload().length())
        .isLessThanOrEqualTo(NotificationEntity.PAYLOAD_LENGTH);
  }

  @Test
  @DisplayName("직렬화가 끝난 뒤 시퀀스를 발급하고, 저장한 시퀀스로 이벤트를 발행한다")
  void allocatesSequenceThenPublishes() {
    PropertyNotification listed = new PropertyNotification.Listed(3L, 1_000L);

    channel.append(listed);

    InOrder order = inOrder(sequenceAllocator, notificationRepository, eventPublisher);
    order.verify(sequenceAllocator).next(SequenceEntity.NOTIFICATION);
    order.verify(notificationRepository).save(any(NotificationEntity.class));
    order.verify(eventPublisher).publishEvent(new NotificationRecordedEvent(7L, listed));

    NotificationEntity saved = savedEntity();
    assertThat(saved.getType()).isEqualTo(NotificationType.LISTED);
    assertThat(saved.getPropertyId()).isEqualTo(3L);
    assertThat(saved.getRecordedAt()).isEqualTo(1_700_000_000L);
  }

  private NotificationEntity savedEntity() {
    ArgumentCaptor<NotificationEntity> captor = ArgumentCaptor.forClass(NotificationEntity.class);
    verify(notificationRepository).save(captor.capture());
    return captor.getValue();
  }
}
