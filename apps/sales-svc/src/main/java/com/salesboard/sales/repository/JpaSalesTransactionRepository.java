package com.salesboard.sales.repository;

import com.salesboard.sales.entity.SalesTransactionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaSalesTransactionRepository extends JpaRepository<SalesTransactionEntity, String>,
        JpaSpecificationExecutor<SalesTransactionEntity> {

    @Query("""
            SELECT DISTINCT t.tags FROM SalesTransactionEntity t
            WHERE t.tags IS NOT NULL AND t.tags <> '' AND t.tags <> '{}'
            """)
    List<String> findEncodedTags();

    @Query("SELECT MIN(t.age), MAX(t.age) FROM SalesTransactionEntity t")
    List<Object[]> findAgeBounds();
}
