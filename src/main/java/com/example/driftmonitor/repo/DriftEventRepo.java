package com.example.driftmonitor.repo;

import com.example.driftmonitor.model.DriftEvent;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface DriftEventRepo extends MongoRepository<DriftEvent, String> {
    List<DriftEvent> findTop20ByOrderByTimestampDesc();
}
