package com.elis.analysis.dto;

/**
 * {@code identifier} is either the username or the email address.
 */
public record LoginRequest(String identifier, String password) {
}
