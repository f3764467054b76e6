package estate.token.controller.dto.property;

import estate.token.domain.model.InputLimits;
import jakarta.validation.constraints.Size;

/**
 * @param manager 새 관리자 계정, null이면 위임 해제
 */
public record AssignManagerRequest(
    @Size(max = InputLimits.ACCOUNT_ID_MAX, message = "관리자 계정이 너무 깁니다") String manager) {}
