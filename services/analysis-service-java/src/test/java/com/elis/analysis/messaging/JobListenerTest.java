package com.elis.analysis.messaging;

import com.elis.analysis.model.JobKind;
import com.elis.analysis.model.JobStatus;
import com.elis.analysis.service.ExecutionOutcome;
import com.elis.analysis.service.TaskQueueRuntime;
import com.rabbitmq.client.Channel;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;

class JobListenerTest {

    private final TaskQueueRuntime runtime = mock(TaskQueueRuntime.class);
    private final Channel channel = mock(Channel.class);
    private final JobListener listener = new JobListener(runtime);

    @Test
    void acksAfterRuntimeReturns() throws Exception {
        JobMessage message = new JobMessage(UUID.randomUUID(), JobKind.EXTRACT_IMAGES, 0);
        given(runtime.execute(message)).willReturn(ExecutionOutcome.finalized(message.jobId(), JobStatus.COMPLETED));

        listener.onMessage(message, channel, 42L);

        verify(channel).basicAck(42L, false);
        verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
    }

    @Test
    void nacksWithRequeueWhenRuntimeFails() throws Exception {
        JobMessage message = new JobMessage(UUID.randomUUID(), JobKind.DETECT_TAMPER, 1);
        given(runtime.execute(message)).willThrow(new IllegalStateException("database unavailable"));

        listener.onMessage(message, channel, 7L);

        verify(channel).basicNack(7L, false, true);
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
    }
}
