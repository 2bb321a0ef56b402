package com.agile.Buro.dto;

import java.util.Map;
import java.util.UUID;

public final class ProjectUpdate extends FieldUpdate<ProjectUpdate.Field> {

    public enum Field { NAME, KEY, DESCRIPTION, DEFAULT_ASSIGNEE }

    private ProjectUpdate(Map<Field, Object> values) {
        super(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String name() { return get(Field.NAME, String.class); }
    public String key() { return get(Field.KEY, String.class); }
    public String description() { return get(Field.DESCRIPTION, String.class); }
    public UUID defaultAssigneeId() { return get(Field.DEFAULT_ASSIGNEE, UUID.class); }

    public static final class Builder extends FieldUpdate.Builder<Field, Builder> {
        private Builder() {
            super(Field.class);
        }

        public Builder name(String name) { return put(Field.NAME, name); }
        public Builder key(String key) { return put(Field.KEY, key); }
        public Builder description(String description) { return put(Field.DESCRIPTION, description); }
        public Builder defaultAssignee(UUID userId) { return put(Field.DEFAULT_ASSIGNEE, userId); }

        public ProjectUpdate build() {
            return new ProjectUpdate(values.clone());
        }
    }
}
