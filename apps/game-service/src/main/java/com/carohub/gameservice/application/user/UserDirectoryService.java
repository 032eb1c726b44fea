package com.carohub.gameservice.application.user;

import com.carohub.gameservice.infrastructure.client.system.SystemUserClient;
import com.carohub.web.common.ApiResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 用户目录服务（对局域获取玩家展示名的统一入口）。
 * 通过 Feign 调用 system-service，并在此统一做熔断/兜底：失败时展示名退回 playerId。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserDirectoryService {

    private final SystemUserClient systemUserClient;

    /**
     * 查询用户档案
     *
     * @return 不存在或调用失败时返回 null
     */
    @CircuitBreaker(name = "systemUserClient", fallbackMethod = "fallbackUserInfo")
    public UserProfileView getUserInfo(String userId) {
        if (userId == null || userId.isBlank()) {
            return null;
        }
        ApiResponse<UserProfileView> resp = systemUserClient.getUserInfo(userId);
        if (resp == null || !resp.isSuccess() || resp.data() == null) {
            log.debug("用户档案不存在: userId={}, response={}", userId, resp);
            return null;
        }
        return resp.data();
    }

    @SuppressWarnings("unused")
    private UserProfileView fallbackUserInfo(String userId, Throwable ex) {
        log.warn("调用 system-service 失败，走兜底: userId={}, ex={}", userId, ex.toString());
        return null;
    }
}
