package com.vedant.securequery.controller;

import com.vedant.securequery.dto.RetryOutcome;
import com.vedant.securequery.dto.SecureQueryRequestDTO;
import com.vedant.securequery.dto.SecureQueryResponseDTO;
import com.vedant.securequery.dto.SecuredStatement;
import com.vedant.securequery.exception.ViolationKind;
import com.vedant.securequery.service.SecureQueryService;
import com.vedant.securequery.service.SessionQueryHistory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/query")
public class SecureQueryController {

    public static final String TENANT_HEADER = "X-Tenant-Code";

    private final SecureQueryService queryService;
    private final SessionQueryHistory sessionHistory;

    public SecureQueryController(SecureQueryService queryService, SessionQueryHistory sessionHistory) {
        this.queryService = queryService;
        this.sessionHistory = sessionHistory;
    }

    @PostMapping("/secure")
    public ResponseEntity<SecureQueryResponseDTO> secureQuery(@RequestBody SecureQueryRequestDTO req,
                                                              @RequestHeader(TENANT_HEADER) String tenantCode,
                                                              HttpServletRequest request) {
        String sessionId = request.getSession().getId();
        RetryOutcome outcome = queryService.execute(req.getSql(), tenantCode, sessionId, req.getMaxRetries());

        SecureQueryResponseDTO dto = new SecureQueryResponseDTO();
        dto.setSuccess(outcome.success());
        dto.setAttempts(outcome.attempts());
        dto.setExecutionTimeMs(outcome.durationMs());
        if (outcome.success()) {
            dto.setSql(outcome.executedSql());
            dto.setRows(outcome.rows());
            dto.setRowCount(outcome.rowCount());
            dto.setMessage("OK");
            return ResponseEntity.ok(dto);
        }
        dto.setRowCount(0);
        dto.setRows(List.of());
        if (outcome.isSecurityFailure()) {
            dto.setMessage(outcome.violation().getUserMessage());
            HttpStatus status = outcome.violation() == ViolationKind.INVALID_TENANT_CODE
                    ? HttpStatus.BAD_REQUEST : HttpStatus.FORBIDDEN;
            return ResponseEntity.status(status).body(dto);
        }
        dto.setMessage("Execution error: " + outcome.error());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(dto);
    }

    @PostMapping("/preview")
    public ResponseEntity<SecuredStatement> preview(@RequestBody SecureQueryRequestDTO req,
                                                    @RequestHeader(TENANT_HEADER) String tenantCode) {
        return ResponseEntity.ok(queryService.preview(req.getSql(), tenantCode));
    }

    @GetMapping("/history")
    public ResponseEntity<List<Map<String, String>>> getHistory(HttpServletRequest request) {
        String sessionId = request.getSession().getId();
        return ResponseEntity.ok(sessionHistory.asMaps(sessionId));
    }
}
