package com.primemath.backend.modules.maintenance.presentation.dto;

import java.time.LocalDate;

public record MissingCheckoutResult(LocalDate workDate, int marked) {
}
