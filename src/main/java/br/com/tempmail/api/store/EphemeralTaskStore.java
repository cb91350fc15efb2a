package br.com.tempmail.api.store;

import br.com.tempmail.api.model.BatchTask;

import java.util.Optional;

/**
 * Armazenamento chave-valor com TTL das tarefas em andamento.
 * Toda escrita renova a retenção da entrada.
 */
public interface EphemeralTaskStore {

    String KEY_PREFIX = "batch_task:";

    Optional<BatchTask> get(String taskId);

    /**
     * Grava sem checar versão. A versão da tarefa passa a ser a maior conhecida + 1.
     */
    void put(BatchTask task);

    /**
     * Grava somente se a versão armazenada ainda for {@code expectedVersion}.
     * Em caso de sucesso a tarefa recebe {@code expectedVersion + 1}.
     *
     * @return false se a entrada mudou (ou sumiu) desde a leitura
     */
    boolean compareAndSet(BatchTask task, long expectedVersion);

    static String key(String taskId) {
        return KEY_PREFIX + taskId;
    }
}
