package com.xksgroup.streamarchiver.repo;

import com.xksgroup.streamarchiver.model.record.SeenVideo;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Seen-set backed by the {@code video_history} collection. The check and the insert are one
 * upsert, so two pollers can never both observe an id as new.
 */
@Component
@RequiredArgsConstructor
public class MongoSeenItemStore implements SeenItemStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Override
    public boolean containsOrInsert(String id) {
        Query query = new Query(Criteria.where("_id").is(id));
        Update update = new Update().setOnInsert("firstSeen", clock.instant());
        SeenVideo previous = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(false), SeenVideo.class);
        return previous != null;
    }

    @Override
    public void remove(String id) {
        mongoTemplate.remove(new Query(Criteria.where("_id").is(id)), SeenVideo.class);
    }
}
