package com.realm.config;

import com.realm.common.EntityNotFoundException;
import com.realm.common.GenerationExhaustedException;
import com.realm.common.RealmException;
import com.realm.common.TemplateNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import javax.validation.ConstraintViolationException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理器
 * 统一处理系统异常并返回标准格式的错误响应
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 未知模板 / 未知实体
     */
    @ExceptionHandler({TemplateNotFoundException.class, EntityNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(RealmException e) {
        logger.warn("查找失败: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "资源不存在", e.getMessage(), e.getCode());
    }

    /**
     * 约束无法满足
     */
    @ExceptionHandler(GenerationExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleExhausted(GenerationExhaustedException e) {
        logger.warn("生成失败: {}", e.getMessage());
        Map<String, Object> body = body("约束无法满足", e.getMessage(), e.getCode());
        body.put("attempts", e.getAttempts());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(NoSuchFileException.class)
    public ResponseEntity<Map<String, Object>> handleMissingSave(NoSuchFileException e) {
        logger.warn("存档不存在: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "存档不存在", e.getMessage(), "SAVE_NOT_FOUND");
    }

    /**
     * 请求体校验失败
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        FieldError field = e.getBindingResult().getFieldError();
        String message = field != null ? field.getField() + " " + field.getDefaultMessage() : "请求参数不合法";
        logger.warn("参数校验失败: {}", message);
        return respond(HttpStatus.BAD_REQUEST, "参数错误", message, "VALIDATION_FAILED");
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException e) {
        logger.warn("参数校验失败: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "参数错误", e.getMessage(), "VALIDATION_FAILED");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        logger.warn("参数错误: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "参数错误", e.getMessage(), "BAD_REQUEST");
    }

    /**
     * 处理参数缺失异常
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException e) {
        logger.warn("参数缺失: {}", e.getMessage());
        Map<String, Object> body = body("参数错误", "缺少必要参数: " + e.getParameterName(), "BAD_REQUEST");
        body.put("parameter", e.getParameterName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /**
     * 处理参数类型错误异常
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        logger.warn("参数类型错误: {}", e.getMessage());
        Map<String, Object> body = body("参数类型错误", "参数 " + e.getName() + " 类型不正确", "BAD_REQUEST");
        body.put("parameter", e.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /**
     * 世界尚未创建等状态错误
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException e) {
        logger.warn("状态错误: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "状态错误", e.getMessage(), "CONFLICT");
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, Object>> handleIo(IOException e) {
        logger.error("读写失败: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "读写失败", e.getMessage(), "IO_ERROR");
    }

    /**
     * 处理其他未捕获的异常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneralException(Exception e) {
        logger.error("系统异常: {}", e.getMessage(), e);
        Map<String, Object> body = body("系统错误", "系统内部错误，请联系管理员", "INTERNAL_ERROR");
        body.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, String message, String code) {
        return ResponseEntity.status(status).body(body(error, message, code));
    }

    private static Map<String, Object> body(String error, String message, String code) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("code", code);
        return body;
    }
}
