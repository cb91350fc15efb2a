package br.com.tempmail.api.repository;

import br.com.tempmail.api.model.EmailAddress;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface EmailAddressRepository extends JpaRepository<EmailAddress, UUID> {

    boolean existsByAddressKey(String addressKey);

    // E-mails ainda ativos do usuário (base do limite de cota)
    long countByUserIdAndExpiresAtAfter(String userId, LocalDateTime now);

    /**
     * Reconstrução aproximada da lista de um lote cujo registro efêmero já expirou:
     * endereços do usuário criados dentro da janela da tarefa, no domínio da tarefa.
     */
    @Query("""
        SELECT e.address FROM EmailAddress e
        WHERE e.userId = :userId
          AND e.createdAt >= :from
          AND e.createdAt <= :to
          AND e.addressKey LIKE :suffix
        ORDER BY e.createdAt ASC
    """)
    List<String> findAddressesCreatedInWindow(@Param("userId") String userId,
                                              @Param("from") LocalDateTime from,
                                              @Param("to") LocalDateTime to,
                                              @Param("suffix") String suffix,
                                              Pageable pageable);
}
