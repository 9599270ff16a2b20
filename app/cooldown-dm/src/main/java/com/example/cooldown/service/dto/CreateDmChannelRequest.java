package com.example.cooldown.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateDmChannelRequest(@JsonProperty("recipient_id") String recipientId) {}
