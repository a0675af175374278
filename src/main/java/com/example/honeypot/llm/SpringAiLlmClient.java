package com.example.honeypot.llm;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link LlmClient} backed by the Spring AI {@link ChatClient}. Calls run on a small
 * dedicated pool; after {@code honeypot.llm.timeout-ms} the worker is interrupted
 * and its thread returned to the pool.
 */
@Component
public class SpringAiLlmClient implements LlmClient {

    private static final Logger logger = LoggerFactory.getLogger(SpringAiLlmClient.class);

    private final ChatClient chatClient;
    private final ExecutorService llmExecutor;

    @Value("${honeypot.llm.timeout-ms:8000}")
    private long timeoutMs;

    public SpringAiLlmClient(ChatClient.Builder chatClientBuilder,
                             @Value("${honeypot.llm.max-threads:8}") int maxThreads) {
        this.chatClient = chatClientBuilder.build();
        this.llmExecutor = createExecutorService(maxThreads);
    }

    private ExecutorService createExecutorService(int maxThreads) {
        int threadCount = maxThreads > 0 ? maxThreads : 8;
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threadCount, r -> {
            Thread t = new Thread(r, "llm-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        Future<String> call = llmExecutor.submit(() -> chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content());
        try {
            String content = call.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (content == null || content.isBlank()) {
                throw new LlmException("Model returned an empty completion");
            }
            return content;
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new LlmException("Model call timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while waiting for the model", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.debug("Model call failed", cause);
            throw new LlmException("Model call failed: " + cause.getMessage(), cause);
        }
    }

    @PreDestroy
    public void shutdown() {
        llmExecutor.shutdownNow();
    }
}
