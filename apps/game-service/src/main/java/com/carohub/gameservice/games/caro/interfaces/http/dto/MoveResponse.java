package com.carohub.gameservice.games.caro.interfaces.http.dto;

import com.carohub.gameservice.games.caro.service.MoveResult;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 落子返回；AI 对局里 AI 的应手同步返回在 aiMove 中
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MoveResponse(MoveResult move, MoveResult aiMove) {
}
