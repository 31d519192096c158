package org.campusbulletin.content.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.campusbulletin.content.ContentFixtures;
import org.campusbulletin.content.model.OpportunityRecord;
import org.campusbulletin.content.service.BookmarkService;
import org.campusbulletin.content.service.RsvpService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(EngagementController.class)
@Import(ApiExceptionHandler.class)
class EngagementControllerTest {

  private static final UUID USER_ID = UUID.fromString("3b0d7c53-95e4-4b7e-8f0e-1b2f0c6a7d21");
  private static final UUID TARGET_ID = UUID.fromString("9a7e4c2d-1b3f-4e5a-8c6d-7f8e9a0b1c2d");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private BookmarkService bookmarkService;
  @MockitoBean private RsvpService rsvpService;

  @Test
  void addBookmarkReportsChange() throws Exception {
    when(bookmarkService.addBookmark(USER_ID, TARGET_ID)).thenReturn(false);

    mockMvc
        .perform(put("/v1/users/" + USER_ID + "/bookmarks/" + TARGET_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.changed").value(false));
  }

  @Test
  void bookmarkOnExpiredOpportunityIsNotFound() throws Exception {
    when(bookmarkService.addBookmark(USER_ID, TARGET_ID))
        .thenThrow(new ContentNotFoundException("opportunity", TARGET_ID));

    mockMvc
        .perform(put("/v1/users/" + USER_ID + "/bookmarks/" + TARGET_ID))
        .andExpect(status().isNotFound());
  }

  @Test
  void listBookmarksReturnsOpportunities() throws Exception {
    final OpportunityRecord opportunity =
        ContentFixtures.opportunity(TARGET_ID, null, true, Instant.parse("2026-03-10T09:00:00Z"));
    when(bookmarkService.listBookmarks(USER_ID)).thenReturn(List.of(opportunity));

    mockMvc
        .perform(get("/v1/users/" + USER_ID + "/bookmarks"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value(USER_ID.toString()))
        .andExpect(jsonPath("$.opportunities[0].opportunity_id").value(TARGET_ID.toString()))
        .andExpect(jsonPath("$.opportunities[0].opportunity_type").value("internship"));
  }

  @Test
  void removeRsvpReportsChange() throws Exception {
    when(rsvpService.removeRsvp(USER_ID, TARGET_ID)).thenReturn(true);

    mockMvc
        .perform(delete("/v1/users/" + USER_ID + "/rsvps/" + TARGET_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.changed").value(true));
  }
}
