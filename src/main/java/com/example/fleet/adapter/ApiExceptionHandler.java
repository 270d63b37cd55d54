package com.example.fleet.adapter;

import com.example.fleet.core.proxy.ToolCallException;
import com.example.fleet.core.proxy.UnknownToolException;
import com.example.fleet.core.slave.LinkServerNotInitializedException;
import com.example.fleet.core.slave.RevocationException;
import com.example.fleet.core.slave.SlaveNotConnectedException;
import com.example.fleet.core.slave.UnknownSlaveException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders failures as {@code {"ok":false,"error":{"code":..,"message":..}}}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({UnknownSlaveException.class, UnknownToolException.class})
    public ResponseEntity<Map<String, Object>> notFound(RuntimeException e) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(SlaveNotConnectedException.class)
    public ResponseEntity<Map<String, Object>> notConnected(SlaveNotConnectedException e) {
        return error(HttpStatus.CONFLICT, "NOT_CONNECTED", e.getMessage());
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<Map<String, Object>> duplicate(DuplicateKeyException e) {
        return error(HttpStatus.CONFLICT, "ALREADY_EXISTS", "record already exists");
    }

    @ExceptionHandler(LinkServerNotInitializedException.class)
    public ResponseEntity<Map<String, Object>> notInitialized(LinkServerNotInitializedException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "NOT_INITIALIZED", e.getMessage());
    }

    @ExceptionHandler(RevocationException.class)
    public ResponseEntity<Map<String, Object>> revocationFailed(RevocationException e) {
        log.error("Revocation failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "REVOCATION_FAILED", e.getMessage());
    }

    @ExceptionHandler(ToolCallException.class)
    public ResponseEntity<Map<String, Object>> toolFailed(ToolCallException e) {
        return error(HttpStatus.BAD_GATEWAY, "TOOL_FAILED", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> storeFailed(DataAccessException e) {
        log.error("Store access failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "STORE_ERROR", "store unavailable");
    }

    static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> err = new LinkedHashMap<>();
        err.put("ok", false);
        Map<String, Object> e = new LinkedHashMap<>();
        e.put("code", code);
        e.put("message", message);
        err.put("error", e);
        return ResponseEntity.status(status).body(err);
    }
}
