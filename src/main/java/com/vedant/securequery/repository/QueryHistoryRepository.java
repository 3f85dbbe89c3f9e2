package com.vedant.securequery.repository;

import com.vedant.securequery.entity.QueryHistory;
import org.springframework.data.jpa.repository.JpaRepository;

public interface QueryHistoryRepository extends JpaRepository<QueryHistory, Long> {
}
