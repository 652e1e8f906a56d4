package com.anorby.matching.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.anorby.common.config.TimeConfig;
import com.anorby.matching.api.response.MatchHistoryResponse;
import com.anorby.matching.api.response.MatchSummary;
import com.anorby.matching.model.MatchStateSnapshot;
import com.anorby.matching.model.MatchStatus;
import com.anorby.matching.service.MatchHistoryService;
import com.anorby.matching.state.MatchTrigger;
import com.anorby.matching.state.TriggerDecision;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(MatchingController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import({ApiExceptionHandler.class, TimeConfig.class})
class MatchingControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private MatchTrigger matchTrigger;

  @MockitoBean private MatchHistoryService matchHistoryService;

  @Test
  void stateReturnsSnakeCaseSnapshot() throws Exception {
    when(matchTrigger.checkAndTrigger(any())).thenReturn(TriggerDecision.NOT_DUE);
    when(matchTrigger.currentStatus())
        .thenReturn(
            new MatchStateSnapshot(
                MatchStatus.IDLE, Instant.parse("2026-03-01T00:00:00Z"), null, null));

    mockMvc
        .perform(get("/v1/matching/state"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("IDLE"))
        .andExpect(jsonPath("$.last_completed_at").value("2026-03-01T00:00:00Z"))
        .andExpect(jsonPath("$.last_failed_at").doesNotExist());
  }

  @Test
  void everyRequestRunsTriggerCheck() throws Exception {
    when(matchTrigger.currentStatus()).thenReturn(MatchStateSnapshot.initial());

    mockMvc.perform(get("/v1/matching/state")).andExpect(status().isOk());

    verify(matchTrigger).checkAndTrigger(any());
  }

  @Test
  void triggerFailureDoesNotFailRequest() throws Exception {
    when(matchTrigger.checkAndTrigger(any())).thenThrow(new IllegalStateException("lock"));
    when(matchTrigger.currentStatus()).thenReturn(MatchStateSnapshot.initial());

    mockMvc.perform(get("/v1/matching/state")).andExpect(status().isOk());
  }

  @Test
  void matchesReturnsHistory() throws Exception {
    when(matchHistoryService.findMatches(10L))
        .thenReturn(
            new MatchHistoryResponse(
                10L, List.of(new MatchSummary(12L, "2026-03-01T00:00:00Z"))));

    mockMvc
        .perform(get("/v1/matching/users/10/matches"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value(10))
        .andExpect(jsonPath("$.matches[0].partner_id").value(12))
        .andExpect(jsonPath("$.matches[0].matched_on").value("2026-03-01T00:00:00Z"));
  }

  @Test
  void matchesReturns400WhenServiceRejectsUserId() throws Exception {
    when(matchHistoryService.findMatches(0L))
        .thenThrow(new InvalidMatchingRequestException("userId must be positive"));

    mockMvc
        .perform(get("/v1/matching/users/0/matches"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("MATCHING_BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("userId must be positive"));
  }

  @Test
  void matchesReturns400WhenUserIdIsNotNumeric() throws Exception {
    mockMvc
        .perform(get("/v1/matching/users/abc/matches"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("MATCHING_BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("userId is invalid"));
  }

  @Test
  void unexpectedErrorReturns500() throws Exception {
    when(matchHistoryService.findMatches(10L)).thenThrow(new IllegalStateException("db"));

    mockMvc
        .perform(get("/v1/matching/users/10/matches"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("MATCHING_INTERNAL_ERROR"));
  }
}
