package net.modshub.controller.dto;

public record ModStatusRequest(String status, String reason) {
}
