package com.navtracker.api.dto;

public record ResetResponse(String userId, long deleted) {
}
