package com.redarm.api.messaging;

import com.redarm.processing.JobWorker;
import com.redarm.processing.QueueMessageDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LocalQueueTransportTest {

    private final JobWorker exportWorker = mock(JobWorker.class);

    private LocalQueueTransport transport() {
        when(exportWorker.getQueueName()).thenReturn("q-export");
        return new LocalQueueTransport(new SyncTaskExecutor(), new QueueMessageDispatcher(List.of(exportWorker)));
    }

    @Test
    void messageIsHandedToWorker() throws Exception {
        transport().sendQueueMessage("q-export", "encoded");

        verify(exportWorker).handle("encoded");
    }

    @Test
    void workerFailureDoesNotReachProducer() throws Exception {
        LocalQueueTransport transport = transport();
        doThrow(new IOException("boom")).when(exportWorker).handle("encoded");

        assertThatCode(() -> transport.sendQueueMessage("q-export", "encoded")).doesNotThrowAnyException();
    }

    @Test
    void unknownQueueIsRejectedAtSend() {
        LocalQueueTransport transport = transport();

        assertThatThrownBy(() -> transport.sendQueueMessage("q-nowhere", "encoded"))
                .isInstanceOf(QueuePublishException.class);
    }
}
