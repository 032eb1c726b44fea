package com.carohub.gameservice.application.user;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 游戏服务视角下的“用户档案视图”，只读。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserProfileView {

    /** 用户ID（与对局中的 playerId 一致） */
    private String userId;
    /** 用户名 */
    private String username;
    /** 昵称（展示名） */
    private String nickname;
    /** 头像地址 */
    private String avatarUrl;

    /** 展示名：优先昵称，其次用户名，最后用 userId。 */
    public String getDisplayName() {
        if (nickname != null && !nickname.isBlank()) {
            return nickname;
        }
        if (username != null && !username.isBlank()) {
            return username;
        }
        return userId;
    }

    /** 取展示名；档案缺失时用 fallback */
    public static String displayNameOr(UserProfileView view, String fallback) {
        if (view == null) {
            return fallback;
        }
        String name = view.getDisplayName();
        return name == null ? fallback : name;
    }
}
