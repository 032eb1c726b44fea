package com.carohub.gameservice.games.caro.application;

import com.carohub.gameservice.games.caro.domain.ai.CaroAI;
import com.carohub.gameservice.games.caro.domain.rating.EloRatingCalculator;
import com.carohub.gameservice.games.caro.domain.rating.RatingProperties;
import com.carohub.gameservice.games.caro.service.MatchProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Caro 领域组件装配：AI 与积分计算器都是无状态纯逻辑，这里只负责注入参数。
 */
@Configuration
@EnableConfigurationProperties({RatingProperties.class, MatchProperties.class})
public class CaroGameConfig {

    @Bean
    public CaroAI caroAI(Random random) {
        return new CaroAI(random);
    }

    @Bean
    public EloRatingCalculator eloRatingCalculator(RatingProperties props) {
        return new EloRatingCalculator(props.getKFactor());
    }
}
