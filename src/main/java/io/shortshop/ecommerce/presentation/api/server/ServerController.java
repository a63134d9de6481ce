package io.shortshop.ecommerce.presentation.api.server;

import io.shortshop.ecommerce.config.AppProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;

/**
 * 서버 상태 확인용 엔드포인트
 */
@Tag(name = "Server")
@RestController
@RequiredArgsConstructor
public class ServerController {

    private final AppProperties appProperties;

    @Operation(summary = "서버 정보")
    @GetMapping("/")
    public ResponseEntity<ServerStatusResponse> root() {
        return ResponseEntity.ok(new ServerStatusResponse(
            "OK",
            appProperties.name() + " is running",
            appProperties.version()
        ));
    }

    @Operation(summary = "헬스 체크")
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse(
            "healthy",
            OffsetDateTime.now().toString(),
            "API is running normally"
        ));
    }

    public record ServerStatusResponse(String status, String message, String version) {}

    public record HealthResponse(String status, String timestamp, String message) {}
}
