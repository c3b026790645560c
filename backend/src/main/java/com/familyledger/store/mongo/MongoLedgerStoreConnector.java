package com.familyledger.store.mongo;

import com.familyledger.domain.LedgerColumns;
import com.familyledger.store.LedgerConnectionException;
import com.familyledger.store.LedgerStore;
import com.familyledger.store.LedgerStoreConnector;
import com.mongodb.MongoException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Verifies the database answers a ping before handing out a {@link MongoLedgerStore}.
 */
@RequiredArgsConstructor
@Slf4j
public class MongoLedgerStoreConnector implements LedgerStoreConnector {

    private final MongoTemplate mongoTemplate;
    private final String collection;
    private final LedgerColumns columns;

    @Override
    public LedgerStore connect() {
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
        } catch (DataAccessException | MongoException e) {
            throw new LedgerConnectionException("MongoDB unreachable: " + e.getMessage(), e);
        }
        log.info("Connected to MongoDB ledger collection {}", collection);
        return new MongoLedgerStore(mongoTemplate, collection, columns);
    }
}
