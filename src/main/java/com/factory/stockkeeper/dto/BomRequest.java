package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.BomType;
import com.factory.stockkeeper.model.MaterialType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BomRequest {
    @NotBlank
    @Size(max = 255)
    private String bomName;

    @NotNull
    private BomType bomType;

    @NotNull
    private Long productId;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @Digits(integer = 14, fraction = 4)
    private BigDecimal outputQty;

    @NotBlank
    @Size(max = 20)
    private String uom;

    private LocalDate effectiveDate;

    @Size(max = 1000)
    private String notes;

    @Valid
    @NotEmpty
    @Builder.Default
    private List<Line> lines = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Line {
        @NotNull
        private Long materialId;

        @NotNull
        private MaterialType materialType;

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        @Digits(integer = 14, fraction = 4)
        private BigDecimal quantity;

        @NotBlank
        @Size(max = 20)
        private String uom;

        @DecimalMin("0")
        @Digits(integer = 5, fraction = 2)
        private BigDecimal scrapRate;
    }
}
