package com.factory.stockkeeper.service;

import com.factory.stockkeeper.dto.BomRequest;
import com.factory.stockkeeper.dto.BomView;
import com.factory.stockkeeper.exception.InvalidStateTransitionException;
import com.factory.stockkeeper.exception.ValidationException;
import com.factory.stockkeeper.model.*;
import com.factory.stockkeeper.repository.BomHeaderRepository;
import com.factory.stockkeeper.repository.BomLineRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BomServiceTest {

    @Mock
    private BomHeaderRepository bomRepository;

    @Mock
    private BomLineRepository bomLineRepository;

    @Mock
    private BomExplosionCalculator explosionCalculator;

    @Mock
    private InventoryLedgerService ledgerService;

    @Mock
    private ReferenceDataService referenceDataService;

    @Mock
    private AuditService auditService;

    @Mock
    private UnitOfWork unitOfWork;

    @InjectMocks
    private BomService bomService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(unitOfWork.execute(anyString(), any())).thenAnswer(inv -> ((Supplier<?>) inv.getArgument(1)).get());
        when(bomRepository.save(any(BomHeader.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void createBom_continuesCodeSequenceForType() {
        BomHeader last = new BomHeader();
        last.setBomCode("BOM-KIT-0007");
        when(bomRepository.findTopByBomCodeStartingWithOrderByBomCodeDesc("BOM-KIT-")).thenReturn(Optional.of(last));
        when(referenceDataService.requireProduct(anyLong())).thenAnswer(inv -> product(inv.getArgument(0)));

        BomView view = bomService.createBom(request(), "engineer");

        assertEquals("BOM-KIT-0008", view.bomCode());
        assertEquals(BomStatus.DRAFT, view.status());
        assertEquals(1, view.version());
        assertEquals(1, view.lines().size());
        assertEquals(0, BigDecimal.ZERO.compareTo(view.lines().get(0).scrapRate()));
        verify(auditService).log(eq("engineer"), eq("CREATE_BOM"), eq("BOM-KIT-0008"), anyString());
    }

    @Test
    void createBom_startsSequenceAtOne() {
        when(bomRepository.findTopByBomCodeStartingWithOrderByBomCodeDesc("BOM-KIT-")).thenReturn(Optional.empty());
        when(referenceDataService.requireProduct(anyLong())).thenAnswer(inv -> product(inv.getArgument(0)));

        assertEquals("BOM-KIT-0001", bomService.createBom(request(), "engineer").bomCode());
    }

    @Test
    void createBom_requiresLines() {
        BomRequest request = request();
        request.setLines(List.of());

        assertThrows(ValidationException.class, () -> bomService.createBom(request, "engineer"));
        verify(bomRepository, never()).save(any());
    }

    @Test
    void updateStatus_activatesDraft() {
        BomHeader bom = existing(BomStatus.DRAFT);
        when(bomRepository.findById(5L)).thenReturn(Optional.of(bom));

        BomView view = bomService.updateStatus(5L, BomStatus.ACTIVE, "engineer");

        assertEquals(BomStatus.ACTIVE, view.status());
    }

    @Test
    void updateStatus_cannotReturnToDraft() {
        when(bomRepository.findById(5L)).thenReturn(Optional.of(existing(BomStatus.ACTIVE)));

        assertThrows(InvalidStateTransitionException.class,
                () -> bomService.updateStatus(5L, BomStatus.DRAFT, "engineer"));
        verify(auditService, never()).log(any(), any(), any(), any());
    }

    private static BomRequest request() {
        return BomRequest.builder()
                .bomName("Gift Box")
                .bomType(BomType.KITTING)
                .productId(1L)
                .outputQty(BigDecimal.ONE)
                .uom("BOX")
                .lines(List.of(BomRequest.Line.builder()
                        .materialId(2L)
                        .materialType(MaterialType.PACKAGING)
                        .quantity(BigDecimal.ONE)
                        .uom("PCS")
                        .build()))
                .build();
    }

    private static BomHeader existing(BomStatus status) {
        BomHeader bom = new BomHeader();
        bom.setId(5L);
        bom.setBomCode("BOM-CUT-0002");
        bom.setBomType(BomType.CUTTING);
        bom.setStatus(status);
        bom.setVersion(1);
        bom.setProduct(product(1L));
        return bom;
    }

    private static Product product(Long id) {
        Product product = new Product();
        product.setId(id);
        product.setCode("P-" + id);
        product.setName("Product " + id);
        product.setUom("PCS");
        return product;
    }
}
