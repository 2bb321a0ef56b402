package com.agile.Buro.dto.request;

import com.agile.Buro.dto.UserUpdate;
import com.agile.Buro.entity.UserRole;

public class UserUpdateRequest extends UnknownFieldCollector {

    private final UserUpdate.Builder builder = UserUpdate.builder();

    public void setFullName(String fullName) { builder.fullName(fullName); }
    public void setAvatarUrl(String avatarUrl) { builder.avatarUrl(avatarUrl); }
    public void setRole(UserRole role) { builder.role(role); }
    public void setPassword(String password) { builder.password(password); }

    public UserUpdate toUpdate() {
        rejectUnknownFields();
        return builder.build();
    }
}
