package com.factory.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDate;

@Entity
@Table(name = "document_sequences", uniqueConstraints = @UniqueConstraint(name = DocumentSequence.UNIQUE_KEY,
        columnNames = { "prefix", "sequenceDate" }))
@Data
@NoArgsConstructor
public class DocumentSequence {

    public static final String UNIQUE_KEY = "uk_document_sequence_prefix_day";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 10)
    private String prefix;

    @Column(nullable = false)
    private LocalDate sequenceDate;

    @Column(nullable = false)
    private long lastValue;

    public DocumentSequence(String prefix, LocalDate sequenceDate) {
        this.prefix = prefix;
        this.sequenceDate = sequenceDate;
        this.lastValue = 0;
    }
}
