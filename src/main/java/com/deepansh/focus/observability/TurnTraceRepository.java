package com.deepansh.focus.observability;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TurnTraceRepository extends MongoRepository<TurnTrace, String> {

    List<TurnTrace> findBySessionIdOrderByCreatedAtDesc(String sessionId);
}
