package com.cadastral.lookup.application.service;

import com.cadastral.lookup.api.dto.QueryHistoryResponseDto;
import com.cadastral.lookup.application.mapper.QueryHistoryMapper;
import com.cadastral.lookup.application.port.out.QueryHistoryRepository;
import com.cadastral.lookup.domain.model.QueryHistory;
import com.cadastral.lookup.domain.service.CadastralNumberValidator;
import com.cadastral.lookup.module.test.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.Collections;
import java.util.List;

import static com.cadastral.lookup.module.test.support.TestFixtures.CadastralNumbers;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HistoryQueryServiceTest {

  private static final Long USER_ID = 11L;

  @Mock
  private QueryHistoryRepository queryHistoryRepository;

  private HistoryQueryService historyQueryService;

  @BeforeEach
  void setUp() {
    historyQueryService = new HistoryQueryService(queryHistoryRepository,
        new CadastralNumberValidator(), new QueryHistoryMapper());
  }

  @Test
  void testList_Unfiltered_UsesNewestFirstPage() {
    // Given
    QueryHistory record = TestFixtures.queryHistory(USER_ID, CadastralNumbers.PRIMARY, true);
    when(queryHistoryRepository.findByUserId(eq(USER_ID), any(Pageable.class))).thenReturn(List.of(record));

    // When
    List<QueryHistoryResponseDto> result = historyQueryService.list(USER_ID, null, 3, 20);

    // Then
    assertThat(result).hasSize(1);
    assertThat(result.get(0).getResult()).isTrue();

    ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
    verify(queryHistoryRepository).findByUserId(eq(USER_ID), pageable.capture());
    assertThat(pageable.getValue().getPageNumber()).isEqualTo(2);
    assertThat(pageable.getValue().getPageSize()).isEqualTo(20);
    assertThat(pageable.getValue().getSort().getOrderFor("createdAt").getDirection()).isEqualTo(Sort.Direction.DESC);
    assertThat(pageable.getValue().getSort().getOrderFor("id").getDirection()).isEqualTo(Sort.Direction.DESC);
  }

  @Test
  void testList_EmptyFilter_TreatedAsUnfiltered() {
    when(queryHistoryRepository.findByUserId(eq(USER_ID), any(Pageable.class)))
        .thenReturn(List.of(TestFixtures.queryHistory(USER_ID, CadastralNumbers.PRIMARY, false)));

    assertThat(historyQueryService.list(USER_ID, "", 1, 10)).hasSize(1);
  }

  @Test
  void testList_Filtered_QueriesByNumber() {
    when(queryHistoryRepository.findByUserIdAndCadastralNumber(eq(USER_ID), eq(CadastralNumbers.SECONDARY),
        any(Pageable.class)))
        .thenReturn(List.of(TestFixtures.queryHistory(USER_ID, CadastralNumbers.SECONDARY, false)));

    List<QueryHistoryResponseDto> result = historyQueryService.list(USER_ID, CadastralNumbers.SECONDARY, 1, 10);

    assertThat(result).extracting(QueryHistoryResponseDto::getCadastralNumber)
        .containsExactly(CadastralNumbers.SECONDARY);
  }

  @Test
  void testList_MalformedFilter_RejectedBeforeLookup() {
    assertThatThrownBy(() -> historyQueryService.list(USER_ID, "not-a-number", 1, 10))
        .isInstanceOf(CadastralNumberValidator.CadastralNumberFormatException.class);
    verifyNoInteractions(queryHistoryRepository);
  }

  @Test
  void testList_NothingFound_ThrowsNotFound() {
    when(queryHistoryRepository.findByUserIdAndCadastralNumber(anyLong(), any(), any(Pageable.class)))
        .thenReturn(Collections.emptyList());

    assertThatThrownBy(() -> historyQueryService.list(USER_ID, CadastralNumbers.UNUSED, 1, 10))
        .isInstanceOf(HistoryQueryService.HistoryNotFoundException.class)
        .hasMessage(HistoryQueryService.NOT_FOUND_MESSAGE);
  }

  @Test
  void testList_PageBeyondAddressableOffset_ThrowsNotFound() {
    assertThatThrownBy(() -> historyQueryService.list(USER_ID, null, 30_000_000, HistoryQueryService.MAX_PAGE_SIZE))
        .isInstanceOf(HistoryQueryService.HistoryNotFoundException.class)
        .hasMessage(HistoryQueryService.NOT_FOUND_MESSAGE);
    verifyNoInteractions(queryHistoryRepository);
  }

  @Test
  void testList_LargestAddressablePage_Queried() {
    // offset Integer.MAX_VALUE - 1 still fits the store
    when(queryHistoryRepository.findByUserId(eq(USER_ID), any(Pageable.class))).thenReturn(Collections.emptyList());

    assertThatThrownBy(() -> historyQueryService.list(USER_ID, null, Integer.MAX_VALUE, 1))
        .isInstanceOf(HistoryQueryService.HistoryNotFoundException.class);
    verify(queryHistoryRepository).findByUserId(eq(USER_ID), any(Pageable.class));
  }

  @Test
  void testList_PageZero_Rejected() {
    assertThatThrownBy(() -> historyQueryService.list(USER_ID, null, 0, 10))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testList_SizeOutOfRange_Rejected() {
    assertThatThrownBy(() -> historyQueryService.list(USER_ID, null, 1, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> historyQueryService.list(USER_ID, null, 1, HistoryQueryService.MAX_PAGE_SIZE + 1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
