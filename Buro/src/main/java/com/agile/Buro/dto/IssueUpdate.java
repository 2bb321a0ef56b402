package com.agile.Buro.dto;

import com.agile.Buro.entity.IssuePriority;
import com.agile.Buro.entity.IssueStatus;
import com.agile.Buro.entity.IssueType;

import java.util.Map;
import java.util.UUID;

public final class IssueUpdate extends FieldUpdate<IssueUpdate.Field> {

    public enum Field { TITLE, DESCRIPTION, TYPE, PRIORITY, ASSIGNEE, STATUS }

    private IssueUpdate(Map<Field, Object> values) {
        super(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String title() { return get(Field.TITLE, String.class); }
    public String description() { return get(Field.DESCRIPTION, String.class); }
    public IssueType type() { return get(Field.TYPE, IssueType.class); }
    public IssuePriority priority() { return get(Field.PRIORITY, IssuePriority.class); }
    /** {@code null} with {@link Field#ASSIGNEE} present means unassign. */
    public UUID assigneeId() { return get(Field.ASSIGNEE, UUID.class); }
    public IssueStatus status() { return get(Field.STATUS, IssueStatus.class); }

    public static final class Builder extends FieldUpdate.Builder<Field, Builder> {
        private Builder() {
            super(Field.class);
        }

        public Builder title(String title) { return put(Field.TITLE, title); }
        public Builder description(String description) { return put(Field.DESCRIPTION, description); }
        public Builder type(IssueType type) { return put(Field.TYPE, type); }
        public Builder priority(IssuePriority priority) { return put(Field.PRIORITY, priority); }
        public Builder assignee(UUID assigneeId) { return put(Field.ASSIGNEE, assigneeId); }
        public Builder status(IssueStatus status) { return put(Field.STATUS, status); }

        public IssueUpdate build() {
            return new IssueUpdate(values.clone());
        }
    }
}
