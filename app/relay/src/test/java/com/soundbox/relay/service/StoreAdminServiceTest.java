package com.soundbox.relay.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.soundbox.relay.api.StoreNotFoundException;
import com.soundbox.relay.model.StoreRecord;
import com.soundbox.relay.repository.StoreRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StoreAdminServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Mock private StoreRepository storeRepository;

  private StoreAdminService service;

  @BeforeEach
  void setUp() {
    service = new StoreAdminService(storeRepository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void newStoreWithoutTokenGetsGeneratedToken() {
    final StoreRecord created = new StoreRecord("S1", "Warung A", "sb_x", true, NOW);
    when(storeRepository.findById("S1")).thenReturn(Optional.empty(), Optional.of(created));

    assertThat(service.upsert(" S1 ", " Warung A ", null)).isEqualTo(created);

    final ArgumentCaptor<String> token = ArgumentCaptor.forClass(String.class);
    verify(storeRepository).insert(eq("S1"), eq("Warung A"), token.capture(), eq(NOW));
    assertThat(token.getValue()).matches("sb_[0-9a-f]{32}");
  }

  @Test
  void existingStoreKeepsTokenWhenNoneSupplied() {
    final StoreRecord existing = new StoreRecord("S1", "Warung A", "tok-old", true, NOW);
    when(storeRepository.findById("S1")).thenReturn(Optional.of(existing));

    service.upsert("S1", "Warung Baru", "  ");

    verify(storeRepository).updateNameAndToken("S1", "Warung Baru", "tok-old");
    verify(storeRepository, never()).insert(anyString(), anyString(), anyString(), any());
  }

  @Test
  void suppliedTokenIsTrimmedAndReplacesExisting() {
    final StoreRecord existing = new StoreRecord("S1", "Warung A", "tok-old", true, NOW);
    when(storeRepository.findById("S1")).thenReturn(Optional.of(existing));

    service.upsert("S1", "Warung A", " tok-new ");

    verify(storeRepository).updateNameAndToken("S1", "Warung A", "tok-new");
  }

  @Test
  void upsertValidatesInput() {
    assertThatThrownBy(() -> service.upsert("S1", " ", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("store_id and name required");
    assertThatThrownBy(() -> service.upsert("bad id", "Warung", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("store_id has invalid characters");
  }

  @Test
  void unknownStoreActionsAreNotFound() {
    when(storeRepository.updateEnabled("missing", true)).thenReturn(0);
    when(storeRepository.updateEnabled("missing", false)).thenReturn(0);
    when(storeRepository.delete("missing")).thenReturn(0);

    assertThatThrownBy(() -> service.enable("missing"))
        .isInstanceOf(StoreNotFoundException.class);
    assertThatThrownBy(() -> service.disable("missing"))
        .isInstanceOf(StoreNotFoundException.class);
    assertThatThrownBy(() -> service.delete("missing"))
        .isInstanceOf(StoreNotFoundException.class);
  }

  @Test
  void disableUpdatesExistingStore() {
    when(storeRepository.updateEnabled("S1", false)).thenReturn(1);

    service.disable(" S1 ");

    verify(storeRepository).updateEnabled("S1", false);
  }
}
