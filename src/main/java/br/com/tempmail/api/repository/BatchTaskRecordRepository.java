package br.com.tempmail.api.repository;

import br.com.tempmail.api.model.BatchTaskRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BatchTaskRecordRepository extends JpaRepository<BatchTaskRecord, String> {

    // limit/offset livres (o offset não precisa ser múltiplo do limit)
    @Query(nativeQuery = true, value = """
        SELECT * FROM batch_task
        WHERE user_id = :userId
        ORDER BY created_at DESC
        LIMIT :limit OFFSET :offset
    """)
    List<BatchTaskRecord> findHistoryPage(@Param("userId") String userId,
                                          @Param("limit") int limit,
                                          @Param("offset") int offset);

    long countByUserId(String userId);
}
