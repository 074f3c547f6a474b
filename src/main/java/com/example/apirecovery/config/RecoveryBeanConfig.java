package com.example.apirecovery.config;

import com.example.apirecovery.limit.LimitManager;
import com.example.apirecovery.recovery.ErrorRecoveryOrchestrator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RecoveryBeanConfig {

    // 限流关卡只在 limit.enabled=true 时挂载
    @Bean(destroyMethod = "shutdown")
    public ErrorRecoveryOrchestrator errorRecoveryOrchestrator(RecoveryConfig recoveryConfig, LimitManager limitManager) {
        return new ErrorRecoveryOrchestrator(recoveryConfig, limitManager.isEnabled() ? limitManager : null);
    }
}
