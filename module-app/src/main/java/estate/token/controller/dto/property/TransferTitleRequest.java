package estate.token.controller.dto.property;

import estate.token.domain.model.InputLimits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record TransferTitleRequest(
    @NotBlank(message = "수신 계정은 필수입니다")
        @Size(max = InputLimits.ACCOUNT_ID_MAX, message = "수신 계정이 너무 깁니다")
        String to) {}
