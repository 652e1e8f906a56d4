package com.anorby.matching.service;

import static com.anorby.matching.MatchingTestFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.anorby.matching.api.InvalidMatchingRequestException;
import com.anorby.matching.api.response.MatchHistoryResponse;
import com.anorby.matching.model.MatchRecord;
import com.anorby.matching.repository.MatchRecordRepository;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class MatchHistoryServiceTest {

  private final MatchRecordRepository repository = mock(MatchRecordRepository.class);
  private final MatchHistoryService service = new MatchHistoryService(repository, properties());

  @Test
  void mapsRecordsToSummariesInRepositoryOrder() {
    when(repository.findByUserId(10L, 50))
        .thenReturn(
            List.of(
                new MatchRecord(10, 12, Instant.parse("2026-03-02T00:00:00Z")),
                new MatchRecord(10, 11, Instant.parse("2026-02-01T00:00:00Z"))));

    final MatchHistoryResponse response = service.findMatches(10L);

    assertThat(response.userId()).isEqualTo(10L);
    assertThat(response.matches()).hasSize(2);
    assertThat(response.matches().get(0).partnerId()).isEqualTo(12L);
    assertThat(response.matches().get(0).matchedOn()).isEqualTo("2026-03-02T00:00:00Z");
  }

  @Test
  void rejectsNonPositiveUserId() {
    assertThatThrownBy(() -> service.findMatches(0L))
        .isInstanceOf(InvalidMatchingRequestException.class);
  }
}
