package io.autopilot4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Key/value setting. {@code value} is a sub-document or a scalar depending on the key.
 */
@Document(collection = "settings")
public class SettingDocument {

    @Id
    private String id;

    private Object value;
    private Instant updatedAt;

    public SettingDocument() {
    }

    public SettingDocument(String id, Object value, Instant updatedAt) {
        this.id = id;
        this.value = value;
        this.updatedAt = updatedAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
