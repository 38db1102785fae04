package com.example.proctorstream.repo;

import com.example.proctorstream.model.OutboxEvent;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface OutboxRepo extends MongoRepository<OutboxEvent, String> {
    List<OutboxEvent> findTop50ByProcessedFalseAndAttemptsLessThanOrderByTsAsc(int maxAttempts);
    long countByProcessedFalse();
}
