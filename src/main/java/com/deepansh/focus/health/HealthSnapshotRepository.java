package com.deepansh.focus.health;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface HealthSnapshotRepository extends MongoRepository<HealthSnapshot, String> {

    Optional<HealthSnapshot> findFirstByOrderByRecordedAtDesc();
}
