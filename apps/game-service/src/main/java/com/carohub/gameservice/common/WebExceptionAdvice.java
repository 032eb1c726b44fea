package com.carohub.gameservice.common;

import com.carohub.gameservice.games.caro.domain.exception.InvalidMoveException;
import com.carohub.gameservice.games.caro.domain.exception.PlayerNotFoundException;
import com.carohub.gameservice.games.caro.domain.exception.SessionNotFoundException;
import com.carohub.gameservice.pool.domain.PoolUnavailableException;
import com.carohub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 非法落子（格子已占、越界、未轮到、对局未进行）。
     * @return HTTP 400，message 前缀为原因码
     */
    @ExceptionHandler(InvalidMoveException.class)
    public ResponseEntity<ApiResponse<Object>> invalidMove(InvalidMoveException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.badRequest(e.getReason().name() + ": " + e.getMessage()));
    }

    /**
     * 处理参数不合法异常（IllegalArgumentException）。
     * 该异常通常出现在 Controller 或 Service 层的参数校验失败时。
     * @param e 参数非法异常
     * @return HTTP 400（Bad Request），响应体为异常信息
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /** 请求体校验失败（@Valid），返回第一个字段错误 */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> invalidBody(MethodArgumentNotValidException e) {
        FieldError fe = e.getBindingResult().getFieldError();
        String msg = fe == null ? "请求参数不合法" : fe.getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(msg));
    }

    /**
     * 处理非法状态异常（IllegalStateException）。
     * 该异常通常用于业务状态不符合预期的场景，例如对局已结束、重复加入等。
     * @param e 状态非法异常
     * @return HTTP 409（Conflict），响应体为异常信息
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> notFound(SessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound(e.getMessage()));
    }

    @ExceptionHandler(PlayerNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> playerNotFound(PlayerNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound(e.getMessage()));
    }

    /** 服务器池无可用节点，客户端可稍后重试 */
    @ExceptionHandler(PoolUnavailableException.class)
    public ResponseEntity<ApiResponse<Object>> unavailable(PoolUnavailableException e) {
        log.warn("服务器池不可用: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.unavailable(e.getMessage()));
    }
}
