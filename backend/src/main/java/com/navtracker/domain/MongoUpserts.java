package com.navtracker.domain;

import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Set;

/**
 * Builds a $set update from an entity through the template's converter, so custom conversions
 * (BigDecimal to Decimal128) apply exactly as on save.
 */
final class MongoUpserts {

    private MongoUpserts() {
    }

    static Update replaceFieldsOf(MongoTemplate mongoTemplate, Object entity, String... insertOnlyFields) {
        Document document = new Document();
        mongoTemplate.getConverter().write(entity, document);
        document.remove("_id");
        document.remove("_class");
        for (String field : Set.of(insertOnlyFields)) {
            document.remove(field);
        }
        Update update = new Update();
        document.forEach(update::set);
        return update;
    }
}
