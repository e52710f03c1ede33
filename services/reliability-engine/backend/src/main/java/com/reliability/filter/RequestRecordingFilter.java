package com.reliability.filter;

import com.reliability.observability.RequestRecorder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.util.List;

/**
 * 요청 완료 시 결과(endpoint, status, latency)를 RequestRecorder에 기록
 *
 * - TraceIdFilter 이후 실행
 * - 성공/실패와 무관하게 모든 요청 기록
 * - 관측/리포트 API 자체는 SLI를 왜곡하므로 제외
 * - endpoint는 URI 대신 매핑 패턴 사용 (/users/{id} 등, bucket 수 폭증 방지)
 */
@RequiredArgsConstructor
public class RequestRecordingFilter extends OncePerRequestFilter {

    static final List<String> EXCLUDED_PREFIXES = List.of(
            "/actuator",
            "/api/reliability",
            "/api/circuit-breakers"
    );

    private final RequestRecorder requestRecorder;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return EXCLUDED_PREFIXES.stream().anyMatch(uri::startsWith);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        long start = System.nanoTime();
        boolean failed = false;

        try {
            filterChain.doFilter(request, response);

        } catch (IOException | ServletException | RuntimeException e) {
            // 핸들러 밖으로 예외가 새어 나온 경우 응답 코드가 아직 200일 수 있음
            failed = true;
            throw e;

        } finally {
            double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
            int status = failed ? HttpStatus.INTERNAL_SERVER_ERROR.value() : response.getStatus();

            requestRecorder.record(resolveEndpoint(request), status, latencyMs);
        }
    }

    private static String resolveEndpoint(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        String path = pattern != null ? pattern.toString() : request.getRequestURI();
        return request.getMethod() + " " + path;
    }
}
