package com.thedigest.continuity.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Daily ledger of paid generation calls.
 */
@Entity
@Table(name = "api_usage")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiUsage {

    @Id
    @Column(name = "usage_date", nullable = false)
    private LocalDate usageDate;

    @Column(name = "input_tokens", nullable = false)
    private long inputTokens;

    @Column(name = "output_tokens", nullable = false)
    private long outputTokens;

    @Column(name = "cost_cents", nullable = false)
    private long costCents;

    @Column(name = "call_count", nullable = false)
    private int callCount;
}
