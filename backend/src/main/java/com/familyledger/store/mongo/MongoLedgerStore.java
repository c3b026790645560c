package com.familyledger.store.mongo;

import com.familyledger.domain.LedgerColumns;
import com.familyledger.domain.LedgerRow;
import com.familyledger.store.LedgerStore;
import com.familyledger.store.LedgerStoreException;
import com.mongodb.MongoException;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.springframework.core.convert.ConversionException;
import org.springframework.core.convert.ConversionService;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only MongoDB collection, one document per ledger row keyed by the configured column names.
 * Storage order is insertion order ({@code _id} ascending).
 */
@Slf4j
public class MongoLedgerStore implements LedgerStore {

    private static final String ID = "_id";

    private final MongoTemplate mongoTemplate;
    private final String collection;
    private final LedgerColumns columns;
    private final ConversionService conversions;

    public MongoLedgerStore(MongoTemplate mongoTemplate, String collection, LedgerColumns columns) {
        this.mongoTemplate = mongoTemplate;
        this.collection = collection;
        this.columns = columns;
        this.conversions = mongoTemplate.getConverter().getConversionService();
    }

    @Override
    public List<Map<String, Object>> readAll() {
        List<Document> documents;
        try {
            documents = mongoTemplate.find(new Query().with(Sort.by(Sort.Direction.ASC, ID)), Document.class, collection);
        } catch (DataAccessException | MongoException e) {
            throw new LedgerStoreException("MongoDB read of " + collection + " failed: " + e.getMessage(), e);
        }
        List<Map<String, Object>> records = new ArrayList<>(documents.size());
        for (Document doc : documents) {
            Map<String, Object> record = new LinkedHashMap<>();
            doc.forEach((key, value) -> {
                if (!ID.equals(key)) {
                    record.put(key, toCell(value));
                }
            });
            records.add(record);
        }
        log.debug("Read {} rows from {}", records.size(), describe());
        return records;
    }

    @Override
    public void appendRow(LedgerRow row) {
        Document doc = new Document();
        doc.put(columns.date(), row.isoDate());
        doc.put(columns.type(), row.type());
        doc.put(columns.description(), row.description());
        try {
            doc.put(columns.amount(), conversions.convert(row.amount(), Decimal128.class));
            doc.put(columns.goldGrams(), conversions.convert(row.goldGrams(), Decimal128.class));
        } catch (ConversionException e) {
            throw new LedgerStoreException("Amount not storable as Decimal128: " + e.getMessage(), e);
        }
        try {
            mongoTemplate.insert(doc, collection);
        } catch (DataAccessException | MongoException e) {
            throw new LedgerStoreException("MongoDB append to " + collection + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "mongo:" + collection;
    }

    /**
     * Numeric cells become BigDecimal. NaN and infinities become "" so the loader zeroes them like any blank cell.
     */
    private Object toCell(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Decimal128 d) {
            if (d.isNaN() || d.isInfinite()) {
                return "";
            }
            try {
                return conversions.convert(d, BigDecimal.class);
            } catch (ConversionException e) {
                log.debug("Unreadable Decimal128 cell {} in {}: {}", d, collection, e.getMessage());
                return "";
            }
        }
        if (value instanceof Double || value instanceof Float) {
            double v = ((Number) value).doubleValue();
            return Double.isFinite(v) ? BigDecimal.valueOf(v) : "";
        }
        if (value instanceof Number n && !(value instanceof BigDecimal)) {
            return new BigDecimal(n.toString());
        }
        return value;
    }
}
