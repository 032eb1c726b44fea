package com.carohub.gameservice.games.caro.domain.rating;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 积分配置（caro.rating.*）
 */
@Data
@ConfigurationProperties(prefix = "caro.rating")
public class RatingProperties {
    /** K 系数 */
    private int kFactor = 32;
    /** 新玩家初始积分 */
    private int initial = 1200;
}
