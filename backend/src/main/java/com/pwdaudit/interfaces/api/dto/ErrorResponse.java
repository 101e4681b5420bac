package com.pwdaudit.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
