package com.refharvest.core.model;

import java.util.Objects;

/** 로그인 자격 증명. toString()에서 비밀번호는 가린다. */
public record Credentials(String username, String password) {
    public Credentials {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
    }

    @Override public String toString() { return "Credentials[username=" + username + ", password=***]"; }
}
