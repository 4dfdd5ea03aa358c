package dev.gazettemonitor.model;

public record UserInfo(String username, String role) {
}
