package com.deepansh.agentplatform.health;

import com.deepansh.agentplatform.resilience.DependencyNames;
import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

/**
 * {@code ping} command against the storage database.
 */
@Component
@RequiredArgsConstructor
public class MongoDependencyProbe implements DependencyProbe {

    private final MongoTemplate mongoTemplate;

    @Override
    public String dependencyName() {
        return DependencyNames.STORAGE;
    }

    @Override
    public void probe() {
        Document reply = mongoTemplate.executeCommand("{ ping: 1 }");
        Object ok = reply != null ? reply.get("ok") : null;
        if (!(ok instanceof Number) || ((Number) ok).doubleValue() != 1.0) {
            throw new IllegalStateException("MongoDB ping not acknowledged: " + reply);
        }
    }
}
