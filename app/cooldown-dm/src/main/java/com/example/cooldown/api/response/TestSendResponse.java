package com.example.cooldown.api.response;

public record TestSendResponse(boolean ok, String message) {}
