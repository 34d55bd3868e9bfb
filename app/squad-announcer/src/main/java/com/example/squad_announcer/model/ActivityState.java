package com.example.squad_announcer.model;

public enum ActivityState {
  IDLE,
  PLAYING,
  PENDING_RESOLUTION
}
