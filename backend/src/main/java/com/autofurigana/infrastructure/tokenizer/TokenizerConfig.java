package com.autofurigana.infrastructure.tokenizer;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class TokenizerConfig {

    static final String BUILD_THREAD_NAME = "tokenizer-build";

    @Value("${tokenizer.init-timeout-ms:10000}")
    private long initTimeoutMs;

    @Bean(destroyMethod = "shutdown")
    public ExecutorService tokenizerBuildExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, BUILD_THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public TokenizerProvider tokenizerProvider(ExecutorService tokenizerBuildExecutor) {
        return new TokenizerProvider(
                KuromojiReadingTokenizer::create,
                tokenizerBuildExecutor,
                Duration.ofMillis(initTimeoutMs));
    }
}
