package com.agile.Buro.dto;

import com.agile.Buro.entity.UserRole;

import java.util.Map;

public final class UserUpdate extends FieldUpdate<UserUpdate.Field> {

    public enum Field { FULL_NAME, AVATAR_URL, ROLE, PASSWORD }

    private UserUpdate(Map<Field, Object> values) {
        super(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String fullName() { return get(Field.FULL_NAME, String.class); }
    public String avatarUrl() { return get(Field.AVATAR_URL, String.class); }
    public UserRole role() { return get(Field.ROLE, UserRole.class); }
    public String password() { return get(Field.PASSWORD, String.class); }

    public static final class Builder extends FieldUpdate.Builder<Field, Builder> {
        private Builder() {
            super(Field.class);
        }

        public Builder fullName(String fullName) { return put(Field.FULL_NAME, fullName); }
        public Builder avatarUrl(String avatarUrl) { return put(Field.AVATAR_URL, avatarUrl); }
        public Builder role(UserRole role) { return put(Field.ROLE, role); }
        public Builder password(String password) { return put(Field.PASSWORD, password); }

        public UserUpdate build() {
            return new UserUpdate(values.clone());
        }
    }
}
