package estate.token.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Estate Token API",
            version = "0.1.0",
            description =
                "토큰화 부동산 거래 API\n\n"
                    + "## 호출자 식별\n"
                    + "- 모든 변경 요청은 `X-Account-Id` 헤더로 호출 계정을 전달합니다.\n"
                    + "- 요청에 첨부하는 금액은 본문의 `value` 필드입니다.\n\n"
                    + "## 주요 기능\n"
                    + "- 매물 발행/조회, 관리자 위임, 소유권 이전\n"
                    + "- 에스크로 오퍼 기반 직접 판매\n"
                    + "- 고정 기간 임대와 연장\n"
                    + "- 영국식 경매\n"
                    + "- 상태 전이 알림 로그"),
    servers = {@Server(url = "http://localhost:8080", description = "Local Development")})
public class OpenApiConfig {}
