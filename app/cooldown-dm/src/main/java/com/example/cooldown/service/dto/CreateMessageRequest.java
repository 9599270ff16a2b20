package com.example.cooldown.service.dto;

public record CreateMessageRequest(String content) {}
