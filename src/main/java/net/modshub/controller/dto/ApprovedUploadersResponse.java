package net.modshub.controller.dto;

import java.util.List;

public record ApprovedUploadersResponse(List<String> approvedUsers) {
}
