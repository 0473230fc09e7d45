package com.platform.resourcecontroller.reconciliation;

import com.platform.resourcecontroller.resource.ResourceIdentity;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ReconcileQueueTest {
    
    private static final ResourceIdentity BUCKET = ResourceIdentity.of("bucket", "logs");
    private static final ResourceIdentity FUNCTION = ResourceIdentity.of("function", "checkout");
    
    private final TaskScheduler scheduler = mock(TaskScheduler.class);
    private final ReconcileQueue queue = new ReconcileQueue(scheduler);
    
    @Test
    void waitingIdentityIsQueuedOnce() throws InterruptedException {
        queue.add(BUCKET);
        queue.add(BUCKET);
        queue.add(FUNCTION);
        
        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.poll(10, TimeUnit.MILLISECONDS)).isEqualTo(BUCKET);
        assertThat(queue.poll(10, TimeUnit.MILLISECONDS)).isEqualTo(FUNCTION);
        assertThat(queue.poll(10, TimeUnit.MILLISECONDS)).isNull();
    }
    
    @Test
    void identityAddedWhileInFlightIsRequeuedOnDone() throws InterruptedException {
        queue.add(BUCKET);
        ResourceIdentity taken = queue.poll(10, TimeUnit.MILLISECONDS);
        assertThat(queue.isProcessing(taken)).isTrue();
        
        queue.add(BUCKET);
        assertThat(queue.size()).isZero();
        
        queue.done(taken);
        assertThat(queue.isProcessing(BUCKET)).isFalse();
        assertThat(queue.poll(10, TimeUnit.MILLISECONDS)).isEqualTo(BUCKET);
    }
    
    @Test
    void doneWithoutNewAddDoesNotRequeue() throws InterruptedException {
        queue.add(BUCKET);
        queue.done(queue.poll(10, TimeUnit.MILLISECONDS));
        
        assertThat(queue.size()).isZero();
    }
    
    @Test
    void zeroDelayAddsImmediately() {
        queue.addAfter(BUCKET, Duration.ZERO);
        
        assertThat(queue.size()).isEqualTo(1);
        verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }
    
    @Test
    void positiveDelayIsScheduled() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        
        queue.addAfter(BUCKET, Duration.ofSeconds(5));
        
        verify(scheduler).schedule(task.capture(), any(Instant.class));
        assertThat(queue.size()).isZero();
        
        task.getValue().run();
        assertThat(queue.size()).isEqualTo(1);
    }
}
