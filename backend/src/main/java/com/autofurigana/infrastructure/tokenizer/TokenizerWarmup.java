package com.autofurigana.infrastructure.tokenizer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the tokenizer build in the background once the application is up,
 * so the first requests are less likely to be served in degraded mode.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenizerWarmup {

    private final TokenizerProvider tokenizerProvider;

    @Value("${tokenizer.warmup-on-startup:true}")
    private boolean warmupOnStartup;

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        if (!warmupOnStartup) {
            log.info("Tokenizer warmup disabled; it will be built on first request");
            return;
        }
        tokenizerProvider.initialize();
    }
}
