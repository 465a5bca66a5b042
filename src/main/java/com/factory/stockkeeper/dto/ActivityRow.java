package com.factory.stockkeeper.dto;

import java.time.LocalDateTime;

public record ActivityRow(String activity, String reference, LocalDateTime timestamp, String user) {
}
