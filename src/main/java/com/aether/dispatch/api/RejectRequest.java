package com.aether.dispatch.api;

public record RejectRequest(String feedback) {}
