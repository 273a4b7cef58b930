package com.syncnest.identityservice.dto;

public record MessageResponse(String message) {}
