package br.com.tempmail.api.service;

import br.com.tempmail.api.config.TempMailProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Fila em memória dos IDs de tarefas a processar, consumida pelo {@link BatchTaskWorker}.
 * Sem garantia de entrega: o polling do cliente continua disparando o processamento.
 */
@Component
public class BatchTaskQueue {

    private final BlockingQueue<String> queue;

    public BatchTaskQueue(TempMailProperties properties) {
        this.queue = new LinkedBlockingQueue<>(properties.getBatch().getQueueCapacity());
    }

    // Nunca bloqueia; false = fila cheia
    public boolean offer(String taskId) {
        return queue.offer(taskId);
    }

    public String take() throws InterruptedException {
        return queue.take();
    }

    public int size() {
        return queue.size();
    }
}
