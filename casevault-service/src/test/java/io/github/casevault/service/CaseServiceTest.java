package io.github.casevault.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.casevault.api.dto.CaseDto;
import io.github.casevault.api.dto.UpdateCaseRequest;
import io.github.casevault.model.CaseCategory;
import io.github.casevault.model.CaseStatus;
import io.github.casevault.persistence.entity.CaseEntity;
import io.github.casevault.persistence.repo.CaseRepository;
import io.github.casevault.store.ResourceNotFoundException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CaseServiceTest {

    private CaseRepository caseRepository;
    private CaseService service;

    @BeforeEach
    void setUp() {
        caseRepository = mock(CaseRepository.class);
        service = new CaseService();
        service.caseRepository = caseRepository;
    }

    private CaseEntity stored() {
        CaseEntity entity = new CaseEntity();
        entity.setId(UUID.randomUUID());
        entity.setTitle("Lease review");
        entity.setCategory(CaseCategory.REAL_ESTATE);
        entity.setStatus(CaseStatus.OPEN);
        entity.setPriority(2);
        entity.setOwnerId(UUID.randomUUID());
        entity.setCreatedAt(OffsetDateTime.now());
        entity.setUpdatedAt(OffsetDateTime.now());
        when(caseRepository.findByIdOptional(entity.getId())).thenReturn(Optional.of(entity));
        return entity;
    }

    @Test
    void update_applies_only_the_fields_given() {
        CaseEntity entity = stored();
        UUID owner = entity.getOwnerId();
        UpdateCaseRequest request = new UpdateCaseRequest();
        request.setTitle("  Lease dispute ");
        request.setStatus(CaseStatus.CLOSED);

        CaseDto dto = service.update(entity.getId(), request);

        assertEquals("Lease dispute", dto.getTitle());
        assertEquals(CaseStatus.CLOSED, dto.getStatus());
        assertEquals(CaseCategory.REAL_ESTATE, dto.getCategory());
        assertEquals(2, dto.getPriority());
        assertEquals(owner.toString(), dto.getOwnerId());
    }

    @Test
    void empty_update_is_rejected_before_lookup() {
        UUID caseId = UUID.randomUUID();

        assertThrows(
                IllegalArgumentException.class,
                () -> service.update(caseId, new UpdateCaseRequest()));
        verify(caseRepository, never()).findByIdOptional(any());
    }

    @Test
    void blank_title_is_rejected() {
        CaseEntity entity = stored();
        UpdateCaseRequest request = new UpdateCaseRequest();
        request.setTitle("   ");

        assertThrows(IllegalArgumentException.class, () -> service.update(entity.getId(), request));
        assertEquals("Lease review", entity.getTitle());
    }

    @Test
    void update_of_missing_case_fails() {
        UUID missing = UUID.randomUUID();
        when(caseRepository.findByIdOptional(missing)).thenReturn(Optional.empty());
        UpdateCaseRequest request = new UpdateCaseRequest();
        request.setPriority(4);

        assertThrows(ResourceNotFoundException.class, () -> service.update(missing, request));
    }

    @Test
    void delete_reports_missing_case() {
        UUID missing = UUID.randomUUID();
        when(caseRepository.deleteById(missing)).thenReturn(false);

        assertFalse(service.delete(missing));
    }

    @Test
    void blank_search_term_is_ignored() {
        Set<UUID> ids = Set.of(UUID.randomUUID());
        when(caseRepository.search(ids, null, CaseStatus.OPEN, null)).thenReturn(List.of());

        assertEquals(List.of(), service.search(ids, "  ", CaseStatus.OPEN, null));
        verify(caseRepository).search(any(), isNull(), any(), isNull());
    }
}
