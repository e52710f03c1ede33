package com.reliability.filter;

import com.reliability.logging.TraceContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

public class TraceIdFilter extends OncePerRequestFilter {

    // HTTP 요청 단위 trace_id 생성 및 MDC 전파용 Filter
    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        // 외부에서 전달한 trace_id가 유효하면 재사용, 없으면 새로 생성
        String traceId = TraceContext.resolve(request.getHeader(TraceContext.TRACE_ID_HEADER));

        // MDC 저장 → 이후 모든 로그 및 에러 응답에 포함
        TraceContext.put(traceId);
        response.setHeader(TraceContext.TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // 서버 쓰레드 재사용으로 인한 trace_id 오염 방지
            TraceContext.clear();
        }
    }
}
