package com.example.driftmonitor.store;

import com.example.driftmonitor.error.DataSourceException;
import com.example.driftmonitor.model.EmbeddingType;
import com.example.driftmonitor.model.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MongoLogAccessor implements LogAccessor {

    private static final Logger logger = LoggerFactory.getLogger(MongoLogAccessor.class);

    private final MongoTemplate mongo;

    public MongoLogAccessor(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public <T extends LogRecord> List<T> getRecords(LogQuery query, Class<T> type) {
        LogStream stream = query.getStream();
        if (!stream.recordType().equals(type)) {
            throw new IllegalArgumentException("Stream " + stream + " holds " + stream.recordType().getSimpleName());
        }
        // Mongo treats a limit of 0 as unlimited
        if (query.getLimit() <= 0) {
            throw new IllegalArgumentException("Row limit must be positive, got " + query.getLimit());
        }

        Criteria criteria = Criteria.where("timestamp")
                .gte(query.getWindow().getStart())
                .lt(query.getWindow().getEnd());
        Criteria category = categoryCriteria(stream, query.getCategory());
        Query q = new Query(category == null ? criteria : new Criteria().andOperator(criteria, category));
        q.with(Sort.by(query.isNewestFirst() ? Sort.Direction.DESC : Sort.Direction.ASC, "timestamp"));
        q.limit(query.getLimit());

        try {
            List<T> rows = mongo.find(q, type, stream.collection());
            logger.debug("Read {} rows from {} for {}", rows.size(), stream.collection(), query.getWindow());
            if (rows.size() == query.getLimit()) {
                logger.warn("Row limit {} reached on {}; later rows in {} are ignored",
                        query.getLimit(), stream.collection(), query.getWindow());
            }
            return rows;
        } catch (DataAccessException e) {
            throw new DataSourceException("Query on " + stream.collection() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean streamExists(LogStream stream) {
        try {
            return mongo.collectionExists(stream.collection());
        } catch (DataAccessException e) {
            throw new DataSourceException("Cannot inspect collection " + stream.collection(), e);
        }
    }

    private Criteria categoryCriteria(LogStream stream, String category) {
        if (category == null) {
            return null;
        }
        switch (stream) {
            case EMBEDDINGS:
                return EmbeddingType.ALL.value().equals(category) ? null : Criteria.where("type").is(category);
            case INTERACTIONS:
                return Criteria.where(category + "_flag").is(true);
            case EVALUATIONS:
                return Criteria.where("evaluation_set_name").is(category);
            case TASKS:
                return Criteria.where("task_type").is(category);
            default:
                return null;
        }
    }
}
