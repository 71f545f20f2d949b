package com.strata.platform.api.dto;

public record LoginResponse(String token, UserProfile user) {}
