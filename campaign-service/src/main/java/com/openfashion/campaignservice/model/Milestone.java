package com.openfashion.campaignservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Milestone {

    @Column(name = "amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "description", nullable = false, length = 500)
    private String description;

    @Column(name = "completed", nullable = false)
    private boolean completed;

    // A fresh instance, so the element collection is marked dirty on replace
    public Milestone markCompleted() {
        return new Milestone(amount, description, true);
    }
}
