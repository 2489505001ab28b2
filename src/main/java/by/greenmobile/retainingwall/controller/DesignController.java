package by.greenmobile.retainingwall.controller;

import by.greenmobile.retainingwall.config.RequestIdFilter;
import by.greenmobile.retainingwall.controller.dto.DesignRequest;
import by.greenmobile.retainingwall.controller.dto.DesignResponse;
import by.greenmobile.retainingwall.entity.DesignInput;
import by.greenmobile.retainingwall.entity.DesignResult;
import by.greenmobile.retainingwall.service.DesignExecutionService;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Тонкий адаптер над движком: проверка диапазонов, запуск, хранение ответа по request id.
 * 200 - спецификация, 422 - устойчивого решения нет (PDF не генерируется).
 */
@RestController
@RequestMapping("/api/designs")
@RequiredArgsConstructor
@Slf4j
public class DesignController {

    private final DesignExecutionService executionService;
    private final DesignResultStore resultStore;

    @PostMapping
    public ResponseEntity<DesignResponse> submit(@RequestBody DesignRequest request, HttpServletResponse httpResponse) {
        List<String> violations = request.violations();
        if (!violations.isEmpty()) {
            throw new InvalidDesignRequestException(violations);
        }

        String requestId = currentRequestId(httpResponse);
        DesignInput input = request.toDesignInput();

        log.info("HTTP /api/designs: rid={} H={} material={} slope={} soil={} objective={} topping={} slab={} minToe={}",
                requestId, input.getHeight(), input.getMaterial(), input.getSurcharge(), input.getSoilStiffness(),
                input.getOptimizationObjective(), input.getToppingDepth(), input.isAdjacentSlab(), input.getToeLength());

        DesignResult result = executionService.execute(input);
        DesignResponse response = DesignResponse.from(requestId, result);
        resultStore.put(requestId, response);

        HttpStatus status = response.isFeasible() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping("/{requestId}")
    public DesignResponse find(@PathVariable String requestId) {
        return resultStore.get(requestId).orElseThrow(() -> new DesignNotFoundException(requestId));
    }

    /**
     * rid из фильтра. Если фильтра не было (тесты, внутренние вызовы) или такой rid уже
     * занят в хранилище - новый; он же уходит в MDC и в заголовок ответа вместо клиентского.
     */
    private String currentRequestId(HttpServletResponse httpResponse) {
        String rid = MDC.get(RequestIdFilter.MDC_REQUEST_ID);
        if (rid != null && !rid.isBlank() && !resultStore.contains(rid)) {
            return rid;
        }
        String fresh = RequestIdFilter.newRequestId();
        log.info("HTTP /api/designs: rid={} is taken or missing, using rid={}", rid, fresh);
        MDC.put(RequestIdFilter.MDC_REQUEST_ID, fresh);
        httpResponse.setHeader(RequestIdFilter.HEADER, fresh);
        return fresh;
    }
}
