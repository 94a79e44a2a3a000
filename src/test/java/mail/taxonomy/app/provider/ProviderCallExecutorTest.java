package mail.taxonomy.app.provider;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProviderCallExecutorTest {
    private static final RetryPolicy THREE_QUICK_ATTEMPTS = new RetryPolicy(3, Duration.ZERO, Duration.ZERO);

    private final ProviderCallExecutor callExecutor = new ProviderCallExecutor(new SimpleAsyncTaskExecutor("test-call-"));

    private static ProviderErrorKind ioIsTransient(Exception e) {
        return e instanceof IOException ? ProviderErrorKind.TRANSIENT : ProviderErrorKind.REJECTED;
    }

    @Test
    void execute_WhenCallSucceeds_ShouldReturnValue() {
        // When
        ProviderResult<String> result = callExecutor.execute("list", () -> "Label_1",
                THREE_QUICK_ATTEMPTS, Duration.ofSeconds(5), ProviderCallExecutorTest::ioIsTransient);

        // Then
        assertTrue(result.isOk());
        assertEquals("Label_1", result.getValue());
    }

    @Test
    void execute_WithTransientFailures_ShouldRetryUntilSuccess() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        ProviderResult<String> result = callExecutor.execute("create", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            return "Label_2";
        }, THREE_QUICK_ATTEMPTS, Duration.ofSeconds(5), ProviderCallExecutorTest::ioIsTransient);

        // Then
        assertTrue(result.isOk());
        assertEquals(3, calls.get());
    }

    @Test
    void execute_WhenTransientFailuresPersist_ShouldGiveUpAfterMaxAttempts() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        ProviderResult<String> result = callExecutor.execute("create", () -> {
            calls.incrementAndGet();
            throw new IOException("connection reset");
        }, THREE_QUICK_ATTEMPTS, Duration.ofSeconds(5), ProviderCallExecutorTest::ioIsTransient);

        // Then
        assertFalse(result.isOk());
        assertEquals(ProviderErrorKind.TRANSIENT, result.getErrorKind());
        assertEquals(3, calls.get());
    }

    @Test
    void execute_WithPermanentFailure_ShouldNotRetry() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        ProviderResult<String> result = callExecutor.execute("create", () -> {
            calls.incrementAndGet();
            throw new ProviderApiException(400, "invalidArgument", "Invalid label name");
        }, THREE_QUICK_ATTEMPTS, Duration.ofSeconds(5), ProviderCallExecutorTest::ioIsTransient);

        // Then
        assertEquals(ProviderErrorKind.REJECTED, result.getErrorKind());
        assertEquals("HTTP 400 invalidArgument", result.getMessage());
        assertEquals(1, calls.get());
    }

    @Test
    void execute_WhenCallHangs_ShouldTimeOutAsTransient() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        ProviderResult<String> result = callExecutor.execute("list", () -> {
            calls.incrementAndGet();
            Thread.sleep(5_000);
            return "too late";
        }, new RetryPolicy(2, Duration.ZERO, Duration.ZERO), Duration.ofMillis(100), ProviderCallExecutorTest::ioIsTransient);

        // Then
        assertEquals(ProviderErrorKind.TRANSIENT, result.getErrorKind());
        assertTrue(result.getMessage().contains("timed out"));
        assertEquals(2, calls.get());
    }

    @Test
    void execute_WhenCallPoolIsSaturated_ShouldBackOffAndRetry() throws Exception {
        // Given
        AsyncTaskExecutor saturatedPool = mock(AsyncTaskExecutor.class);
        when(saturatedPool.submit(ArgumentMatchers.<Callable<String>>any()))
                .thenThrow(new TaskRejectedException("Executor did not accept task"))
                .thenAnswer(inv -> CompletableFuture.completedFuture(inv.<Callable<String>>getArgument(0).call()));
        ProviderCallExecutor executor = new ProviderCallExecutor(saturatedPool);

        // When
        ProviderResult<String> result = executor.execute("list", () -> "Label_1",
                THREE_QUICK_ATTEMPTS, Duration.ofSeconds(5), ProviderCallExecutorTest::ioIsTransient);

        // Then
        assertTrue(result.isOk());
        assertEquals("Label_1", result.getValue());
        verify(saturatedPool, times(2)).submit(ArgumentMatchers.<Callable<String>>any());
    }

    @Test
    void execute_WhenCallPoolStaysSaturated_ShouldReturnTransientFailure() {
        // Given
        AsyncTaskExecutor saturatedPool = mock(AsyncTaskExecutor.class);
        when(saturatedPool.submit(ArgumentMatchers.<Callable<String>>any()))
                .thenThrow(new TaskRejectedException("Executor did not accept task"));
        ProviderCallExecutor executor = new ProviderCallExecutor(saturatedPool);

        // When
        ProviderResult<String> result = executor.execute("create", () -> "Label_1",
                THREE_QUICK_ATTEMPTS, Duration.ofSeconds(5), ProviderCallExecutorTest::ioIsTransient);

        // Then
        assertEquals(ProviderErrorKind.TRANSIENT, result.getErrorKind());
        assertTrue(result.getMessage().contains("saturated"));
    }

    @Test
    void delayAfter_ShouldGrowExponentiallyUpToCap() {
        // Given
        RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(2), Duration.ofSeconds(30));

        // Then
        assertEquals(Duration.ofSeconds(2), policy.delayAfter(1));
        assertEquals(Duration.ofSeconds(4), policy.delayAfter(2));
        assertEquals(Duration.ofSeconds(16), policy.delayAfter(4));
        assertEquals(Duration.ofSeconds(30), policy.delayAfter(5));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO));
    }
}
