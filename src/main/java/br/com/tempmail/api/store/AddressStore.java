package br.com.tempmail.api.store;

import br.com.tempmail.api.model.EmailAddress;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Tabela durável de endereços emitidos. Única por endereço normalizado (minúsculas).
 * Violações de unicidade chegam como {@link org.springframework.dao.DataIntegrityViolationException}.
 */
public interface AddressStore {

    boolean exists(String address);

    /** Insere todos numa única transação: ou entram todos, ou nenhum. */
    List<EmailAddress> insertAll(List<EmailAddress> addresses);

    EmailAddress insert(EmailAddress address);

    long countActive(String userId, LocalDateTime now);

    List<String> findCreatedInWindow(String userId, String domain, LocalDateTime from, LocalDateTime to, int limit);
}
