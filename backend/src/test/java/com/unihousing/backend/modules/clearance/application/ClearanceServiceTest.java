package com.unihousing.backend.modules.clearance.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import com.unihousing.backend.global.error.ProblemException;
import com.unihousing.backend.modules.clearance.domain.ClearanceProcess;
import com.unihousing.backend.modules.clearance.domain.ClearanceStatus;
import com.unihousing.backend.modules.clearance.infrastructure.persistence.ClearanceProcessRepository;
import com.unihousing.backend.modules.clearance.presentation.dto.ClearanceResponse;
import com.unihousing.backend.modules.student.domain.Student;
import com.unihousing.backend.modules.student.infrastructure.persistence.StudentRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class ClearanceServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-05-01T09:30:00Z");

    @Mock
    private ClearanceProcessRepository clearanceProcessRepository;

    @Mock
    private StudentRepository studentRepository;

    private ClearanceService clearanceService;

    @BeforeEach
    void setUp() {
        clearanceService = new ClearanceService(
                clearanceProcessRepository,
                studentRepository,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC)
        );
    }

    @Test
    void missingProcessReadsAsNotInitiated() {
        when(clearanceProcessRepository.findByStudentId(5L)).thenReturn(Optional.empty());

        ClearanceResponse response = clearanceService.getClearance(5L);

        assertThat(response.status()).isEqualTo(ClearanceStatus.NOT_INITIATED);
        assertThat(response.percentage()).isZero();
        assertThat(response.initiatedAt()).isNull();
    }

    @Test
    void halfwayProcessIsPending() {
        ClearanceProcess process = new ClearanceProcess(new Student(), NOW.minusDays(2));
        process.setKeysReturned(true);
        when(clearanceProcessRepository.findByStudentId(5L)).thenReturn(Optional.of(process));

        ClearanceResponse response = clearanceService.getClearance(5L);

        assertThat(response.status()).isEqualTo(ClearanceStatus.PENDING);
        assertThat(response.percentage()).isEqualTo(50);
        assertThat(response.keysReturned()).isTrue();
    }

    @Test
    void initiateStampsCurrentTime() {
        when(clearanceProcessRepository.existsByStudentId(5L)).thenReturn(false);
        when(studentRepository.findById(5L)).thenReturn(Optional.of(new Student()));
        when(clearanceProcessRepository.saveAndFlush(any(ClearanceProcess.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        ClearanceResponse response = clearanceService.initiate(5L);

        assertThat(response.status()).isEqualTo(ClearanceStatus.PENDING);
        assertThat(response.initiatedAt()).isEqualTo(NOW);
    }

    @Test
    void secondInitiationIsConflict() {
        when(clearanceProcessRepository.existsByStudentId(5L)).thenReturn(true);

        assertThatThrownBy(() -> clearanceService.initiate(5L))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo(ClearanceService.CLEARANCE_ALREADY_INITIATED);
                });
        verify(clearanceProcessRepository, never()).saveAndFlush(any());
    }
}
