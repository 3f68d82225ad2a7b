package com.openfashion.campaignservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "platform_settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformSettings {

    public static final int SINGLETON_ID = 1;

    @Id
    private Integer id;

    private boolean paused;

    @Column(nullable = false)
    private int feeBasisPoints;

    @Column(nullable = false)
    @Version
    private long version;

    @UpdateTimestamp
    private Instant updatedAt;
}
