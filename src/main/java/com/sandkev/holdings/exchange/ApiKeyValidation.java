package com.sandkev.holdings.exchange;

public record ApiKeyValidation(boolean ok, String message) {

    public static ApiKeyValidation valid() {
        return new ApiKeyValidation(true, "");
    }

    public static ApiKeyValidation invalid(String message) {
        return new ApiKeyValidation(false, message);
    }
}
