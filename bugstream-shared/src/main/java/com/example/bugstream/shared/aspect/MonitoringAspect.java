package com.example.bugstream.shared.aspect;

import com.example.bugstream.shared.config.MonitoringConfig;
import com.example.bugstream.shared.dto.Correlated;
import io.opentelemetry.api.trace.Span;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.BugStreamMetricsCollector metricsCollector;

    @Around("@within(com.example.bugstream.shared.aspect.Monitored) || @annotation(com.example.bugstream.shared.aspect.Monitored)")
    public Object monitorMethod(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        Monitored monitoredAnnotation = method.getAnnotation(Monitored.class);
        if (monitoredAnnotation == null) {
            monitoredAnnotation = method.getDeclaringClass().getAnnotation(Monitored.class);
        }
        if (monitoredAnnotation == null) {
            return joinPoint.proceed();
        }

        String operationType = monitoredAnnotation.value();
        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = signature.getName();
        long startTime = System.currentTimeMillis();

        Span currentSpan = Span.current();
        if (currentSpan.getSpanContext().isValid()) {
            for (Object arg : joinPoint.getArgs()) {
                if (arg instanceof Correlated correlated && correlated.correlationId() != null) {
                    currentSpan.setAttribute("app.correlation_id", correlated.correlationId());
                    break;
                }
            }
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            metricsCollector.recordTimer("bugstream." + operationType + ".latency", duration, "class", className, "method", methodName, "status", "success");
            metricsCollector.incrementCounter("bugstream." + operationType + ".calls", "class", className, "method", methodName, "status", "success");

            log.debug("{}.{} ({}) completed in {}ms", className, methodName, operationType, duration);
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;

            metricsCollector.recordTimer("bugstream." + operationType + ".latency", duration, "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter("bugstream." + operationType + ".calls", "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter("bugstream.errors", "type", operationType, "class", className, "method", methodName);

            if (currentSpan.getSpanContext().isValid()) {
                currentSpan.recordException(e);
            }

            log.error("{}.{} ({}) failed after {}ms: {}", className, methodName, operationType, duration, e.getMessage());
            throw e;
        }
    }
}
