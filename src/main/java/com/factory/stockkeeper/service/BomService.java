package com.factory.stockkeeper.service;

import com.factory.stockkeeper.dto.*;
import com.factory.stockkeeper.exception.InvalidStateTransitionException;
import com.factory.stockkeeper.exception.NotFoundException;
import com.factory.stockkeeper.exception.ValidationException;
import com.factory.stockkeeper.model.*;
import com.factory.stockkeeper.repository.BomHeaderRepository;
import com.factory.stockkeeper.repository.BomLineRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
@Slf4j
public class BomService {

    private final BomHeaderRepository bomRepository;
    private final BomLineRepository bomLineRepository;
    private final BomExplosionCalculator explosionCalculator;
    private final InventoryLedgerService ledgerService;
    private final ReferenceDataService referenceDataService;
    private final AuditService auditService;
    private final UnitOfWork unitOfWork;

    public BomService(BomHeaderRepository bomRepository, BomLineRepository bomLineRepository,
            BomExplosionCalculator explosionCalculator, InventoryLedgerService ledgerService,
            ReferenceDataService referenceDataService, AuditService auditService, UnitOfWork unitOfWork) {
        this.bomRepository = bomRepository;
        this.bomLineRepository = bomLineRepository;
        this.explosionCalculator = explosionCalculator;
        this.ledgerService = ledgerService;
        this.referenceDataService = referenceDataService;
        this.auditService = auditService;
        this.unitOfWork = unitOfWork;
    }

    /**
     * Creates a DRAFT recipe, version 1, coded {@code BOM-<TYP>-NNNN}.
     */
    public BomView createBom(BomRequest request, String actor) {
        validate(request);

        return unitOfWork.execute("createBom", () -> {
            BomHeader bom = new BomHeader();
            bom.setBomCode(nextCode(request.getBomType()));
            bom.setBomName(request.getBomName().trim());
            bom.setBomType(request.getBomType());
            bom.setStatus(BomStatus.DRAFT);
            bom.setVersion(1);
            bom.setProduct(referenceDataService.requireProduct(request.getProductId()));
            bom.setOutputQty(request.getOutputQty());
            bom.setUom(request.getUom());
            bom.setEffectiveDate(request.getEffectiveDate());
            bom.setNotes(request.getNotes());
            bom.setCreatedBy(actor);

            for (BomRequest.Line lineRequest : request.getLines()) {
                BomLine line = new BomLine();
                line.setMaterial(referenceDataService.requireProduct(lineRequest.getMaterialId()));
                line.setMaterialType(lineRequest.getMaterialType());
                line.setQuantity(lineRequest.getQuantity());
                line.setUom(lineRequest.getUom());
                line.setScrapRate(lineRequest.getScrapRate() != null ? lineRequest.getScrapRate() : BigDecimal.ZERO);
                bom.addLine(line);
            }

            bom = bomRepository.save(bom);
            auditService.log(actor, "CREATE_BOM", bom.getBomCode(),
                    "Type: " + bom.getBomType() + ", Lines: " + bom.getLines().size());
            log.info("Created BOM {} ({}) with {} lines", bom.getBomCode(), bom.getBomType(), bom.getLines().size());
            return BomView.from(bom);
        });
    }

    public BomView updateStatus(Long bomId, BomStatus target, String actor) {
        if (target == null) {
            throw new ValidationException("Target status is required");
        }
        return unitOfWork.execute("updateBomStatus", () -> {
            BomHeader bom = bomRepository.findById(bomId).orElseThrow(() -> NotFoundException.of("BOM", bomId));
            BomStatus from = bom.getStatus();
            if (!from.canTransitionTo(target)) {
                throw InvalidStateTransitionException.of("BOM " + bom.getBomCode(), from, target);
            }
            bom.setStatus(target);
            bomRepository.save(bom);

            auditService.log(actor, "UPDATE_BOM_STATUS", bom.getBomCode(), from + " -> " + target);
            log.info("BOM {} moved from {} to {}", bom.getBomCode(), from, target);
            return BomView.from(bom);
        });
    }

    @Transactional(readOnly = true)
    public BomView getBom(Long bomId) {
        return BomView.from(bomRepository.findById(bomId).orElseThrow(() -> NotFoundException.of("BOM", bomId)));
    }

    @Transactional(readOnly = true)
    public List<BomView> listBoms(BomType type, BomStatus status, String search) {
        String pattern = search == null || search.isBlank() ? null
                : "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
        return bomRepository.search(type, status, pattern).stream()
                .map(BomView::from)
                .toList();
    }

    /**
     * Flat material list for {@code qty} units. Works on recipes in any status.
     */
    @Transactional(readOnly = true)
    public List<MaterialRequirementLine> explode(Long bomId, BigDecimal qty) {
        BomHeader bom = bomRepository.findById(bomId).orElseThrow(() -> NotFoundException.of("BOM", bomId));
        return explosionCalculator.explode(bom, qty, false);
    }

    /**
     * Explodes the recipe and compares each material against the current balance in the
     * warehouse. Nothing is persisted.
     */
    @Transactional(readOnly = true)
    public List<AvailabilityRow> checkAvailability(Long bomId, BigDecimal qty, Long warehouseId) {
        referenceDataService.requireWarehouse(warehouseId);
        List<AvailabilityRow> rows = new ArrayList<>();
        for (MaterialRequirementLine line : explode(bomId, qty)) {
            BigDecimal available = ledgerService.stockBalance(line.materialId(), warehouseId);
            rows.add(new AvailabilityRow(line.materialId(), line.materialName(), line.requiredQty(), available,
                    line.uom(), available.compareTo(line.requiredQty()) >= 0));
        }
        return rows;
    }

    @Transactional(readOnly = true)
    public List<MaterialUsageRow> materialUsageSummary() {
        List<MaterialUsageRow> rows = new ArrayList<>();
        for (Object[] row : bomLineRepository.summarizeActiveUsage()) {
            Long materialId = (Long) row[0];
            rows.add(new MaterialUsageRow(materialId, (String) row[1], ((Number) row[2]).longValue(),
                    (BigDecimal) row[3], bomLineRepository.findActiveBomTypesUsing(materialId)));
        }
        return rows;
    }

    private String nextCode(BomType type) {
        String prefix = type.codePrefix() + "-";
        int next = bomRepository.findTopByBomCodeStartingWithOrderByBomCodeDesc(prefix)
                .map(last -> parseSequence(last.getBomCode(), prefix) + 1)
                .orElse(1);
        return String.format("%s%04d", prefix, next);
    }

    private static int parseSequence(String code, String prefix) {
        try {
            return Integer.parseInt(code.substring(prefix.length()));
        } catch (NumberFormatException e) {
            log.warn("Unexpected BOM code {}, restarting sequence", code);
            return 0;
        }
    }

    private static void validate(BomRequest request) {
        if (request.getBomName() == null || request.getBomName().isBlank()) {
            throw new ValidationException("BOM name is required");
        }
        InputLimits.checkLength("BOM name", request.getBomName().trim(), InputLimits.NAME_LENGTH);
        InputLimits.checkLength("Unit of measure", request.getUom(), 20);
        InputLimits.checkLength("Notes", request.getNotes(), InputLimits.NOTES_LENGTH);
        if (request.getBomType() == null) {
            throw new ValidationException("BOM type is required");
        }
        if (request.getOutputQty() == null || request.getOutputQty().signum() <= 0) {
            throw new ValidationException("Output quantity must be greater than zero");
        }
        InputLimits.checkQuantity("Output quantity", request.getOutputQty());
        if (request.getLines() == null || request.getLines().isEmpty()) {
            throw new ValidationException("A BOM needs at least one material line");
        }
        for (BomRequest.Line line : request.getLines()) {
            if (line.getQuantity() == null || line.getQuantity().signum() <= 0) {
                throw new ValidationException("Material quantity must be greater than zero");
            }
            InputLimits.checkQuantity("Material quantity", line.getQuantity());
            InputLimits.checkLength("Unit of measure", line.getUom(), 20);
            if (line.getScrapRate() != null && line.getScrapRate().signum() < 0) {
                throw new ValidationException("Scrap rate cannot be negative");
            }
        }
    }
}
