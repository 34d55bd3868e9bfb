package com.example.squad_announcer.model;

public record DroppedMember(String userId, DropReason reason) {}
