package com.agile.Buro.Response;

import com.agile.Buro.Models.UserModel;

public record LoginResponse(String accessToken, String tokenType, UserModel user) {

    public LoginResponse(String accessToken, UserModel user) {
        this(accessToken, "bearer", user);
    }
}
