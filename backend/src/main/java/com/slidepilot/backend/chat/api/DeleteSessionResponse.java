package com.slidepilot.backend.chat.api;

public record DeleteSessionResponse(boolean success, String message) {}
