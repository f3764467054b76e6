package estate.token.controller;

import estate.token.controller.dto.notification.NotificationResponse;
import estate.token.infrastructure.persistence.entity.NotificationEntity;
import estate.token.response.ApiResponse;
import estate.token.service.notification.NotificationQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** 상태 전이 알림 로그 API (외부 인덱서용) */
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
@Tag(name = "Notification", description = "알림 로그 조회 API")
public class NotificationController {

  private final NotificationQueryService notificationQueryService;

  @GetMapping
  @Operation(
      summary = "알림 조회",
      description = "after 이후 시퀀스를 오름차순으로 반환합니다. propertyId를 주면 해당 매물의 전체 로그를 반환합니다.")
  public ResponseEntity<ApiResponse<List<NotificationResponse>>> notifications(
      @RequestParam(defaultValue = "0") long after,
      @RequestParam(defaultValue = "100") int limit,
      @RequestParam(required = false) Long propertyId) {
    List<NotificationEntity> notifications =
        propertyId == null
            ? notificationQueryService.notifications(after, limit)
            : notificationQueryService.notificationsOf(propertyId);
    return ResponseEntity.ok(
        ApiResponse.success(notifications.stream().map(NotificationResponse::from).toList()));
  }
}
