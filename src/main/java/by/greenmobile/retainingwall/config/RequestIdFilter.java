package by.greenmobile.retainingwall.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Кладёт данные запроса в MDC, чтобы каждую строку лога можно было связать с заявкой:
 * - rid: id запроса (из X-Request-Id или сгенерированный); он же ключ результата в DesignResultStore
 * - method / path
 * rid также возвращается клиенту в заголовке ответа.
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "rid";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String rid = Optional.ofNullable(request.getHeader(HEADER))
                .map(String::trim)
                .filter(h -> !h.isEmpty())
                .orElseGet(RequestIdFilter::newRequestId);

        MDC.put(MDC_REQUEST_ID, rid);
        MDC.put("method", request.getMethod());
        MDC.put("path", request.getRequestURI());
        response.setHeader(HEADER, rid);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove("method");
            MDC.remove("path");
        }
    }

    public static String newRequestId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
