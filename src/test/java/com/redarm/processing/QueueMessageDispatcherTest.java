package com.redarm.processing;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueueMessageDispatcherTest {

    private JobWorker worker(String queue) {
        JobWorker worker = mock(JobWorker.class);
        when(worker.getQueueName()).thenReturn(queue);
        return worker;
    }

    @Test
    void routesByQueueName() throws Exception {
        JobWorker export = worker("q-export");
        JobWorker ocr = worker("q-ocr");
        QueueMessageDispatcher dispatcher = new QueueMessageDispatcher(List.of(export, ocr));

        dispatcher.dispatch("q-ocr", "payload");

        verify(ocr).handle("payload");
        assertThat(dispatcher.workerFor("q-export")).containsSame(export);
        assertThat(dispatcher.workerFor("q-missing")).isEmpty();
        assertThat(dispatcher.queueNames()).containsExactlyInAnyOrder("q-export", "q-ocr");
    }

    @Test
    void unknownQueueIsRejected() {
        QueueMessageDispatcher dispatcher = new QueueMessageDispatcher(List.of(worker("q-export")));

        assertThatThrownBy(() -> dispatcher.dispatch("q-other", "payload"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void twoWorkersOnOneQueueIsAConfigurationError() {
        assertThatThrownBy(() -> new QueueMessageDispatcher(List.of(worker("q-export"), worker("q-export"))))
                .isInstanceOf(IllegalStateException.class);
    }
}
