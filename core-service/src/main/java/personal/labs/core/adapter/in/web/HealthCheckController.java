package personal.labs.core.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.labs.common.dto.ApiResponse;
import personal.labs.common.dto.HealthCheckResponse;
import personal.labs.common.health.HealthCheckService;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 데이터베이스와 Redis 연결 상태를 확인한다
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;

    /**
     * Health Check 엔드포인트
     * 구성 요소 중 하나라도 DOWN 이면 result=error 로 응답하지만 HTTP 상태는 200
     */
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        HealthCheckResponse data = new HealthCheckResponse(
                healthCheckService.checkDatabase(dataSource),
                healthCheckService.checkRedis()
        );

        if (data.allUp()) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }
}
