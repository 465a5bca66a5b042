package com.factory.stockkeeper.service;

import com.factory.stockkeeper.model.DocumentSequence;
import com.factory.stockkeeper.repository.DocumentSequenceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DocumentNumberServiceTest {

    @Mock
    private DocumentSequenceRepository sequenceRepository;

    @InjectMocks
    private DocumentNumberService documentNumberService;

    private final String today = LocalDate.now().format(DateTimeFormatter.BASIC_ISO_DATE);

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void next_incrementsExistingCounter() {
        DocumentSequence sequence = new DocumentSequence("MO", LocalDate.now());
        sequence.setLastValue(41);
        when(sequenceRepository.findForUpdate(eq("MO"), any(LocalDate.class))).thenReturn(Optional.of(sequence));

        assertEquals("MO-" + today + "-0042", documentNumberService.next(DocumentNumberService.ORDER));
        assertEquals(42, sequence.getLastValue());
        verify(sequenceRepository, never()).saveAndFlush(any());
    }

    @Test
    void next_startsNewCounterForTheDay() {
        when(sequenceRepository.findForUpdate(eq("PR"), any(LocalDate.class))).thenReturn(Optional.empty());
        when(sequenceRepository.saveAndFlush(any(DocumentSequence.class))).thenAnswer(inv -> inv.getArgument(0));

        assertEquals("PR-" + today + "-0001", documentNumberService.next(DocumentNumberService.RECEIPT));
        verify(sequenceRepository).save(any(DocumentSequence.class));
    }
}
