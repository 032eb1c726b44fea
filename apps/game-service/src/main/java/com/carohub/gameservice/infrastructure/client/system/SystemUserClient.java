package com.carohub.gameservice.infrastructure.client.system;

import com.carohub.gameservice.application.user.UserProfileView;
import com.carohub.web.common.ApiResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

/**
 * 调用 system-service 用户接口的 Feign Client。
 * 服务地址由 Spring Cloud LoadBalancer 解析（本地开发用 simple discovery 配置）。
 */
@FeignClient(name = "system-service", path = "/api/users")
public interface SystemUserClient {

    /** 按玩家 ID 查询用户档案（用于对局与匹配中的展示名） */
    @GetMapping("/users/{userId}")
    ApiResponse<UserProfileView> getUserInfo(@PathVariable("userId") String userId);
}
