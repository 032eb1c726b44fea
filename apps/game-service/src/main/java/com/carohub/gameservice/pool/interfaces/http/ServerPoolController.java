package com.carohub.gameservice.pool.interfaces.http;

import com.carohub.gameservice.pool.domain.model.PoolStats;
import com.carohub.gameservice.pool.domain.model.ServerRecord;
import com.carohub.gameservice.pool.service.ServerPoolService;
import com.carohub.web.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 游戏服务器池 HTTP 接口（供游戏服务器节点注册 / 心跳，以及运维查看）
 */
@RestController
@RequestMapping("/api/pool")
@RequiredArgsConstructor
public class ServerPoolController {

    private final ServerPoolService pool;

    @PostMapping("/servers")
    public ResponseEntity<ApiResponse<ServerRecord>> register(@Valid @RequestBody RegisterRequest req) {
        ServerRecord rec = pool.register(req.getServerId(), req.getHost(), req.getPort(), req.getCapacity(), req.getRegion());
        return ResponseEntity.ok(ApiResponse.success(rec));
    }

    @DeleteMapping("/servers/{serverId}")
    public ResponseEntity<ApiResponse<Map<String, Boolean>>> unregister(@PathVariable String serverId) {
        return ResponseEntity.ok(ApiResponse.success(Map.of("removed", pool.unregister(serverId))));
    }

    /**
     * 心跳；服务器未注册（或已被清理）时返回 404，节点应重新注册
     */
    @PostMapping("/servers/{serverId}/heartbeat")
    public ResponseEntity<ApiResponse<Object>> heartbeat(@PathVariable String serverId,
                                                         @RequestBody(required = false) HeartbeatRequest req) {
        Double cpu = req == null ? null : req.getCpuUsage();
        Double mem = req == null ? null : req.getMemoryUsage();
        if (!pool.heartbeat(serverId, cpu, mem)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound("服务器未注册: " + serverId));
        }
        return ResponseEntity.ok(ApiResponse.success());
    }

    /** 把会话分配到服务器；serverId 为空时自动挑选负载最低的 */
    @PostMapping("/assign")
    public ResponseEntity<ApiResponse<ServerRecord>> assign(@Valid @RequestBody AssignRequest req) {
        return ResponseEntity.ok(ApiResponse.success(pool.assign(req.getSessionId(), req.getServerId(), req.getRegion())));
    }

    @PostMapping("/release")
    public ResponseEntity<ApiResponse<Map<String, Boolean>>> release(@Valid @RequestBody AssignRequest req) {
        return ResponseEntity.ok(ApiResponse.success(Map.of("released", pool.release(req.getSessionId(), req.getServerId()))));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<PoolStats>> stats() {
        return ResponseEntity.ok(ApiResponse.success(pool.stats()));
    }

    @GetMapping("/servers")
    public ResponseEntity<ApiResponse<List<ServerRecord>>> servers() {
        return ResponseEntity.ok(ApiResponse.success(pool.listServers()));
    }

    @Data
    public static class RegisterRequest {
        @NotBlank(message = "serverId is required")
        private String serverId;
        @NotBlank(message = "host is required")
        private String host;
        private int port;
        private Integer capacity;
        private String region;
    }

    @Data
    public static class HeartbeatRequest {
        private Double cpuUsage;
        private Double memoryUsage;
    }

    @Data
    public static class AssignRequest {
        @NotBlank(message = "sessionId is required")
        private String sessionId;
        private String serverId;
        private String region;
    }
}
