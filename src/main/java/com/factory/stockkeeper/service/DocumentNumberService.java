package com.factory.stockkeeper.service;

import com.factory.stockkeeper.model.DocumentSequence;
import com.factory.stockkeeper.repository.DocumentSequenceRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Issues document numbers of the form {@code PREFIX-yyyyMMdd-NNNN}. The per-day counter row
 * is read under a write lock, so numbers stay unique across concurrent transactions. Two
 * transactions racing to create the first counter of a day collide on the unique key; the
 * loser fails and is retried by {@link UnitOfWork}.
 */
@Service
public class DocumentNumberService {

    public static final String ORDER = "MO";
    public static final String ISSUE = "MI";
    public static final String RECEIPT = "PR";
    public static final String BATCH = "B";

    private final DocumentSequenceRepository sequenceRepository;

    public DocumentNumberService(DocumentSequenceRepository sequenceRepository) {
        this.sequenceRepository = sequenceRepository;
    }

    @Transactional
    public String next(String prefix) {
        LocalDate today = LocalDate.now();
        DocumentSequence sequence = sequenceRepository.findForUpdate(prefix, today)
                .orElseGet(() -> sequenceRepository.saveAndFlush(new DocumentSequence(prefix, today)));

        sequence.setLastValue(sequence.getLastValue() + 1);
        sequenceRepository.save(sequence);

        return String.format("%s-%s-%04d", prefix, today.format(DateTimeFormatter.BASIC_ISO_DATE),
                sequence.getLastValue());
    }
}
