package com.kats.api.dto;

public record SyncRefreshResponse(String message) {
}
