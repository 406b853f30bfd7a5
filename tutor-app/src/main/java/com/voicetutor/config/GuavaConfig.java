package com.voicetutor.config;

import com.google.common.util.concurrent.Striped;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.locks.Lock;

/**
 * Guava 并发组件配置类。
 * <p>
 * 会话事件按 sessionId 映射到分段锁上串行处理；不同会话大概率落在不同分段，互不阻塞。
 * </p>
 *
 * @author voicetutor
 * @since 2026-03-02
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "sessionLocks")
    public Striped<Lock> sessionLocks(@Value("${tutor.session.lock-stripes:64}") int stripes) {
        return Striped.lazyWeakLock(Math.max(stripes, 1));
    }

}
