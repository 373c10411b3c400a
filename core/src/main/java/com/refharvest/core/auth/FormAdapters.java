package com.refharvest.core.auth;

import java.util.Locale;

/** 설정 이름(auth.formAdapter) → FormAdapter */
public final class FormAdapters {
    private FormAdapters() {}

    public static FormAdapter forName(String name, String redirectTo) {
        String n = (name == null || name.isBlank()) ? "default" : name.trim().toLowerCase(Locale.ROOT);
        switch (n) {
            case "default":
            case "generic":
                return new DefaultFormAdapter();
            case "wordpress":
                return new WordPressFormAdapter(redirectTo);
            default:
                throw new IllegalArgumentException("Unknown form adapter: " + name);
        }
    }
}
