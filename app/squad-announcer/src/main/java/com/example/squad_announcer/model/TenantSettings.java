package com.example.squad_announcer.model;

import java.time.Instant;

public record TenantSettings(String tenantId, String announcementChannelId, Instant updatedAt) {}
