package com.uwb.positioning.config;

import com.uwb.positioning.motion.InMemoryMotionCache;
import com.uwb.positioning.motion.MotionCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core collaborators that are shared process-wide.
 */
@Configuration
public class ServiceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Per-tag motion state lives for the lifetime of the process and is reset on restart.
     */
    @Bean
    public MotionCache motionCache() {
        return new InMemoryMotionCache();
    }
}
