package io.scheduler4j.internal.mongo;

import io.scheduler4j.store.AbstractSnapshotTaskStore;
import io.scheduler4j.store.TaskPersistenceException;
import io.scheduler4j.store.TaskSnapshotEntry;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MongoDB snapshot store.
 *
 * <p>Same full-overwrite contract as the file store: each save empties the collection and
 * inserts the current pending set. The two steps are not atomic; a crash between them loses
 * the snapshot.
 */
public class MongoTaskStore extends AbstractSnapshotTaskStore {

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public MongoTaskStore(MongoTemplate mongoTemplate, String collection) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.collection = Objects.requireNonNull(collection, "collection must not be null");
        if (collection.isBlank()) {
            throw new IllegalArgumentException("collection must not be blank");
        }
    }

    @Override
    protected List<TaskSnapshotEntry> readSnapshot() {
        try {
            Query q = new Query().with(Sort.by(Sort.Order.asc("timestamp"), Sort.Order.asc("priority")));
            List<ScheduledTaskDocument> docs = mongoTemplate.find(q, ScheduledTaskDocument.class, collection);
            List<TaskSnapshotEntry> entries = new ArrayList<>(docs.size());
            for (ScheduledTaskDocument doc : docs) {
                entries.add(toEntry(doc));
            }
            return entries;
        } catch (DataAccessException e) {
            throw new TaskPersistenceException("Failed to read task snapshot from " + describe(), e);
        }
    }

    @Override
    protected void writeSnapshot(List<TaskSnapshotEntry> entries) {
        try {
            mongoTemplate.remove(new Query(), collection);
            if (entries.isEmpty()) {
                return;
            }
            List<ScheduledTaskDocument> docs = new ArrayList<>(entries.size());
            for (TaskSnapshotEntry entry : entries) {
                docs.add(toDocument(entry));
            }
            mongoTemplate.insert(docs, collection);
        } catch (DataAccessException e) {
            throw new TaskPersistenceException("Failed to write task snapshot to " + describe(), e);
        }
    }

    @Override
    protected String describe() {
        return "mongo:" + collection;
    }

    private static ScheduledTaskDocument toDocument(TaskSnapshotEntry entry) {
        ScheduledTaskDocument doc = new ScheduledTaskDocument();
        doc.setTimestamp(entry.timestamp());
        doc.setPriority(entry.priority());
        doc.setTaskId(entry.taskId());
        doc.setTaskData(entry.taskData());
        doc.setRecurring(entry.recurring());
        doc.setRecurrenceInterval(entry.recurrenceInterval());
        return doc;
    }

    private static TaskSnapshotEntry toEntry(ScheduledTaskDocument doc) {
        return new TaskSnapshotEntry(
                doc.getTimestamp(),
                doc.getPriority(),
                doc.getTaskId(),
                doc.getTaskData(),
                doc.isRecurring(),
                doc.getRecurrenceInterval()
        );
    }
}
