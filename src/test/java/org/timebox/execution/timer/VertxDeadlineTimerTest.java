package org.timebox.execution.timer;

import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
public class VertxDeadlineTimerTest {

    @Mock
    private Vertx vertx;

    private VertxDeadlineTimer deadlineTimer;

    @BeforeEach
    public void setUp() {
        deadlineTimer = new VertxDeadlineTimer(vertx);
    }

    @Test
    public void registerShouldSetVertxTimerWithDelayInMillis() {
        // when
        deadlineTimer.register(2, TimeUnit.SECONDS, () -> {
        });

        // then
        verify(vertx).setTimer(eq(2000L), any());
    }

    @Test
    public void registerShouldRoundDelayUpToWholeMillis() {
        // when
        deadlineTimer.register(1500, TimeUnit.MICROSECONDS, () -> {
        });
        deadlineTimer.register(1, TimeUnit.NANOSECONDS, () -> {
        });

        // then
        verify(vertx).setTimer(eq(2L), any());
        verify(vertx).setTimer(eq(1L), any());
    }

    @Test
    public void toDelayMillisShouldKeepExactMillis() {
        assertThat(VertxDeadlineTimer.toDelayMillis(3000, TimeUnit.MICROSECONDS)).isEqualTo(3L);
        assertThat(VertxDeadlineTimer.toDelayMillis(10, TimeUnit.MILLISECONDS)).isEqualTo(10L);
    }

    @Test
    public void toDelayMillisShouldSaturateForDelaysBeyondMillisRange() {
        assertThat(VertxDeadlineTimer.toDelayMillis(Long.MAX_VALUE, TimeUnit.SECONDS)).isEqualTo(Long.MAX_VALUE);
        assertThat(VertxDeadlineTimer.toDelayMillis(Long.MAX_VALUE, TimeUnit.DAYS)).isEqualTo(Long.MAX_VALUE);
        assertThat(VertxDeadlineTimer.toDelayMillis(Long.MAX_VALUE, TimeUnit.NANOSECONDS))
                .isEqualTo(TimeUnit.NANOSECONDS.toMillis(Long.MAX_VALUE) + 1);
    }

    @Test
    public void registerShouldNotShortenSaturatedDelay() {
        // when
        deadlineTimer.register(Long.MAX_VALUE, TimeUnit.SECONDS, () -> {
        });

        // then
        verify(vertx).setTimer(eq(Long.MAX_VALUE), any());
    }

    @Test
    public void disposeShouldCancelVertxTimerOnlyOnce() {
        // given
        given(vertx.setTimer(anyLong(), any())).willReturn(42L);
        final TimerHandle handle = deadlineTimer.register(10, TimeUnit.MILLISECONDS, () -> {
        });

        // when
        handle.dispose();
        handle.dispose();

        // then
        verify(vertx).cancelTimer(42L);
    }

    @Test
    public void fireShouldRunCallbackOnce() {
        // given
        final AtomicInteger fires = new AtomicInteger();
        deadlineTimer.register(10, TimeUnit.MILLISECONDS, fires::incrementAndGet);
        final Handler<Long> timerHandler = captureTimerHandler();

        // when
        timerHandler.handle(1L);
        timerHandler.handle(1L);

        // then
        assertThat(fires).hasValue(1);
    }

    @Test
    public void disposeShouldDoNothingAfterFire() {
        // given
        final TimerHandle handle = deadlineTimer.register(10, TimeUnit.MILLISECONDS, () -> {
        });
        captureTimerHandler().handle(1L);

        // when
        handle.dispose();

        // then
        verify(vertx, never()).cancelTimer(anyLong());
    }

    @Test
    public void fireShouldBeSuppressedAfterDispose() {
        // given
        final AtomicInteger fires = new AtomicInteger();
        final TimerHandle handle = deadlineTimer.register(10, TimeUnit.MILLISECONDS, fires::incrementAndGet);
        final Handler<Long> timerHandler = captureTimerHandler();

        // when
        handle.dispose();
        timerHandler.handle(1L);

        // then
        assertThat(fires).hasValue(0);
    }

    @SuppressWarnings("unchecked")
    private Handler<Long> captureTimerHandler() {
        final ArgumentCaptor<Handler<Long>> captor = ArgumentCaptor.forClass(Handler.class);
        verify(vertx).setTimer(anyLong(), captor.capture());
        return captor.getValue();
    }
}
