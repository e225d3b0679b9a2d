package net.modshub.controller;

import java.util.List;
import net.modshub.domain.CallerContext;
import net.modshub.exception.InvalidModRequestException;
import net.modshub.exception.ModAccessDeniedException;
import org.junit.jupiter.api.Test;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AdminApprovalControllerTest extends AbstractModControllerMvcTest {

    @Test
    void should_ListApprovedUploaders() throws Exception {
        when(uploaderApprovalService.listApproved(CallerContext.admin("root"))).thenReturn(List.of("alice", "bob"));

        performAsync(get("/admin/approvals").principal(admin("root")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.approvedUsers", contains("alice", "bob")));
    }

    @Test
    void should_ApproveUser() throws Exception {
        mockMvc.perform(post("/admin/approvals/carol").principal(admin("root")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success", equalTo(true)))
            .andExpect(jsonPath("$.userId", equalTo("carol")));

        verify(uploaderApprovalService).approve("carol", CallerContext.admin("root"));
    }

    @Test
    void should_SucceedOnRevoke_When_UserWasNeverApproved() throws Exception {
        when(uploaderApprovalService.revoke("carol", CallerContext.admin("root"))).thenReturn(false);

        mockMvc.perform(delete("/admin/approvals/carol").principal(admin("root")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success", equalTo(true)));
    }

    @Test
    void should_Return403_When_CallerIsNotAdmin() throws Exception {
        doThrow(ModAccessDeniedException.adminOnly("approve uploader approvals"))
            .when(uploaderApprovalService).approve("carol", CallerContext.user("alice"));

        mockMvc.perform(post("/admin/approvals/carol").principal(user("alice")))
            .andExpect(status().isForbidden());
    }

    @Test
    void should_Return400_When_UserIdTooLong() throws Exception {
        String longId = "u".repeat(129);
        doThrow(new InvalidModRequestException("userId must be at most 128 characters"))
            .when(uploaderApprovalService).approve(longId, CallerContext.admin("root"));

        mockMvc.perform(post("/admin/approvals/" + longId).principal(admin("root")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail", equalTo("userId must be at most 128 characters")));
    }
}
