package com.reliability.config.filter;

import com.reliability.filter.RequestRecordingFilter;
import com.reliability.filter.TraceIdFilter;
import com.reliability.observability.RequestRecorder;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Filter 실행 순서를 명시적으로 고정
 *
 * 1. TraceIdFilter          : 요청 진입 시 trace_id 생성
 * 2. RequestRecordingFilter : trace_id 생성 이후 요청 결과 기록
 *
 * 로직은 Filter에 두고, 이 클래스는 "순서"만 책임
 */
@Configuration
public class FilterOrderConfig {

    @Bean
    public FilterRegistrationBean<TraceIdFilter> traceIdFilterRegistration() {
        FilterRegistrationBean<TraceIdFilter> registration =
                new FilterRegistrationBean<>(new TraceIdFilter());

        // trace_id 먼저 생성
        registration.setOrder(1);

        return registration;
    }

    @Bean
    public FilterRegistrationBean<RequestRecordingFilter> requestRecordingFilterRegistration(
            RequestRecorder requestRecorder
    ) {
        FilterRegistrationBean<RequestRecordingFilter> registration =
                new FilterRegistrationBean<>(new RequestRecordingFilter(requestRecorder));

        // trace_id 생성 이후 실행
        registration.setOrder(2);

        return registration;
    }
}
