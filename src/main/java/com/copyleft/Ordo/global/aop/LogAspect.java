package com.copyleft.Ordo.global.aop;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

@Slf4j
@Aspect
@Component
public class LogAspect {

    @Pointcut("execution(* com.copyleft.Ordo.feature..*Service.*(..))")
    public void serviceLayer() {}

    // 인자와 반환값에는 비밀 토큰이 섞여 있으므로 남기지 않는다
    @Around("serviceLayer()")
    public Object logExecutionTime(ProceedingJoinPoint joinPoint) throws Throwable {
        StopWatch stopWatch = new StopWatch();
        stopWatch.start();

        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = joinPoint.getSignature().getName();

        log.info("▶ [START] {}.{} | Args: {}개", className, methodName, joinPoint.getArgs().length);

        try {
            return joinPoint.proceed();
        } catch (Throwable e) {
            log.warn("🛑 [EXCEPTION] {}.{} | Msg: {}", className, methodName, e.getMessage());
            throw e;
        } finally {
            if (stopWatch.isRunning()) {
                stopWatch.stop();
            }
            log.info("◀ [END] {}.{} | Time: {}ms", className, methodName, stopWatch.getTotalTimeMillis());
        }
    }
}
